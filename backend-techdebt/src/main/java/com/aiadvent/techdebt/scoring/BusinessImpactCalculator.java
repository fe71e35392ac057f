package com.aiadvent.techdebt.scoring;

import com.aiadvent.techdebt.config.TechDebtProperties;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingCategory;
import com.aiadvent.techdebt.model.ScanResult.BusinessImpact;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Translates debt minutes and finding counts into cost, time, risk and impact labels. */
@Component
public class BusinessImpactCalculator {

  static final int MINUTES_PER_HOUR = 60;
  static final int MINUTES_PER_DAY = 480;
  static final int MINUTES_PER_WEEK = 2400;
  static final int MINUTES_PER_MONTH = 9600;
  static final int MAX_RISK = 100;

  private final TechDebtProperties properties;

  public BusinessImpactCalculator(TechDebtProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  /**
   * @param totalCyclomatic summed cyclomatic complexity of every file
   * @param codeSmells count of non-security findings
   */
  public BusinessImpact calculate(
      long debtMinutes,
      double debtRatio,
      String rating,
      List<Finding> findings,
      long totalCyclomatic,
      int codeSmells,
      double testCoverage) {
    int security = (int) findings.stream().filter(Finding::isSecurity).count();
    int reliability =
        (int) findings.stream().filter(f -> f.category() == FindingCategory.RELIABILITY).count();
    return new BusinessImpact(
        financialCost(debtMinutes),
        formatTime(debtMinutes),
        riskScore(findings),
        productivityImpact(totalCyclomatic, codeSmells, debtRatio),
        customerImpact(security, reliability),
        recommendations(rating, security, totalCyclomatic, testCoverage));
  }

  public double financialCost(long debtMinutes) {
    return (double) debtMinutes / MINUTES_PER_HOUR * properties.getScoring().getHourlyRate();
  }

  public int riskScore(Collection<Finding> findings) {
    int score = 0;
    for (Finding finding : findings) {
      score += properties.severityWeight(finding.severity());
      if (score >= MAX_RISK) {
        return MAX_RISK;
      }
    }
    return score;
  }

  public static String formatTime(double minutes) {
    if (minutes < MINUTES_PER_HOUR) {
      return Math.round(minutes) + " minutes";
    }
    if (minutes < MINUTES_PER_DAY) {
      return oneDecimal(minutes / MINUTES_PER_HOUR) + " hours";
    }
    if (minutes < MINUTES_PER_WEEK) {
      return oneDecimal(minutes / MINUTES_PER_DAY) + " days";
    }
    if (minutes < MINUTES_PER_MONTH) {
      return oneDecimal(minutes / MINUTES_PER_WEEK) + " weeks";
    }
    return oneDecimal(minutes / MINUTES_PER_MONTH) + " months";
  }

  static String productivityImpact(long totalCyclomatic, int codeSmells, double debtRatio) {
    double score = totalCyclomatic / 100.0 + codeSmells / 50.0 + debtRatio / 20.0;
    if (score > 2) {
      return "High - Development velocity significantly impacted";
    }
    if (score > 1) {
      return "Medium - Moderate slowdown in feature delivery";
    }
    return "Low - Minimal impact on development speed";
  }

  static String customerImpact(int securityIssues, int reliabilityIssues) {
    if (securityIssues > 5 || reliabilityIssues > 10) {
      return "High - Critical issues affecting user experience and security";
    }
    if (securityIssues > 2 || reliabilityIssues > 5) {
      return "Medium - Some issues may affect user satisfaction";
    }
    return "Low - Limited direct impact on end users";
  }

  List<String> recommendations(
      String rating, int securityIssues, long totalCyclomatic, double testCoverage) {
    List<String> out = new ArrayList<>();
    if ("D".equals(rating) || "E".equals(rating)) {
      out.add("URGENT: Schedule immediate technical debt reduction sprint");
      out.add("Consider allocating 30-40% of sprint capacity to refactoring");
    }
    if (securityIssues > 0) {
      out.add("Address %d security vulnerabilities immediately".formatted(securityIssues));
      out.add("Implement security code review process");
    }
    if (totalCyclomatic > 50) {
      out.add("Refactor high-complexity modules to improve maintainability");
      out.add("Establish complexity thresholds in CI/CD pipeline");
    }
    if (properties.isRequireTests() && testCoverage < 60) {
      out.add("Increase test coverage to at least 80%");
      out.add("Implement test-driven development (TDD) practices");
    }
    out.add("Track technical debt metrics in sprint retrospectives");
    out.add("Budget 15-20% of development time for technical debt reduction");
    return out;
  }

  private static String oneDecimal(double value) {
    return String.format(Locale.ROOT, "%.1f", value);
  }
}
