package com.aiadvent.techdebt.scoring;

import com.aiadvent.techdebt.model.BenchmarkComparison;
import com.aiadvent.techdebt.model.BenchmarkComparison.Status;
import com.aiadvent.techdebt.model.EnterpriseMetrics;
import com.aiadvent.techdebt.model.EnterpriseMetrics.CoverageBreakdown;
import com.aiadvent.techdebt.model.EnterpriseMetrics.CycleTime;
import com.aiadvent.techdebt.model.EnterpriseMetrics.FocusTime;
import com.aiadvent.techdebt.model.EnterpriseMetrics.VelocityTrend;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.ScanResult;
import com.aiadvent.techdebt.model.ScanResult.Summary;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Industry-style KPIs and benchmark comparisons. Unlike the debt ratio of the scan result, the
 * TDR here assumes {@value #LINES_PER_DAY} lines per eight-hour day.
 */
@Component
public class EnterpriseMetricsCalculator {

  static final double LINES_PER_DAY = 200;
  static final double MINUTES_PER_DAY = 8 * 60;

  public EnterpriseMetrics calculate(ScanResult result) {
    Objects.requireNonNull(result, "result");
    Summary summary = result.summary();
    int totalLines = summary.totalLines();
    double coverage = summary.quality().testCoverage();
    double avgCyclomatic = summary.complexity().avgCyclomatic();

    double tdr = technicalDebtRatio(summary.technicalDebt().totalMinutes(), totalLines);
    double defectDensity = defectDensity(summary.totalIssues(), totalLines);
    double churn = percentage(summary.complexity().highComplexityFiles(), summary.totalFiles());
    CycleTime cycleTime = cycleTime(result.issues());
    int quality =
        codeQualityScore(
            avgCyclomatic,
            coverage,
            summary.quality().codeSmells(),
            summary.quality().securityIssues(),
            summary.totalFiles());
    VelocityTrend velocity = velocity(tdr, defectDensity, quality);
    int satisfaction = teamSatisfaction(quality, coverage, avgCyclomatic);

    return new EnterpriseMetrics(
        tdr,
        defectDensity,
        churn,
        cycleTime,
        tdr < 10 ? "Multiple per day" : tdr < 25 ? "Weekly" : "Monthly",
        cycleTime.average() < 4 ? "<1 day" : cycleTime.average() < 24 ? "1-3 days" : "1-2 weeks",
        Math.min(50, defectDensity * 5),
        cycleTime.median() < 2 ? "<1 hour" : cycleTime.median() < 8 ? "1-8 hours" : "1-2 days",
        velocity,
        new FocusTime(
            Math.max(0, 100 - tdr * 2), (int) Math.min(20, Math.floor(defectDensity * 3))),
        new CoverageBreakdown(coverage, coverage * 0.7, coverage * 0.2, coverage * 0.1),
        quality,
        Math.min(30, churn * 0.5),
        Math.min(100, tdr * 1.5),
        (int) Math.max(0, 10 - Math.floor(tdr / 5)),
        Math.max(0, 100 - summary.criticalIssues() * 5),
        satisfaction,
        result.businessImpact().riskScore(),
        Math.max(0, 100 - tdr * 2),
        Math.max(0, 100 - summary.quality().securityIssues() * 10),
        Math.min(100, summary.criticalIssues() * 3 + summary.quality().securityIssues() * 5));
  }

  public List<BenchmarkComparison> benchmarks(EnterpriseMetrics metrics) {
    Objects.requireNonNull(metrics, "metrics");
    double coverage = metrics.testCoverage().overall();
    return List.of(
        lowerIsBetter("Technical Debt Ratio", metrics.technicalDebtRatio(), 5, 15, 5, 15, 25, 40),
        lowerIsBetter(
            "Defect Density (per 1K LOC)", metrics.defectDensity(), 0.5, 1.0, 0.5, 1.0, 2.0, 3.0),
        higherIsBetter("Test Coverage %", coverage, 80, 70, 80, 70, 60, 40),
        higherIsBetter(
            "Code Quality Score", metrics.codeQualityScore(), 85, 75, 85, 75, 65, 50),
        lowerIsBetter(
            "Maintenance Cost Ratio %", metrics.maintenanceCostRatio(), 20, 30, 20, 30, 40, 50));
  }

  static double technicalDebtRatio(long debtMinutes, long totalLines) {
    double devMinutes = totalLines / LINES_PER_DAY * MINUTES_PER_DAY;
    return devMinutes > 0 ? debtMinutes / devMinutes * 100 : 0.0;
  }

  static double defectDensity(int issues, int totalLines) {
    return totalLines > 0 ? (double) issues / totalLines * 1000 : 0.0;
  }

  static double percentage(int part, int whole) {
    return whole > 0 ? (double) part / whole * 100 : 0.0;
  }

  /** Fix-time estimates in hours keyed by severity. */
  static CycleTime cycleTime(List<Finding> issues) {
    if (issues.isEmpty()) {
      return CycleTime.NONE;
    }
    double[] hours =
        issues.stream()
            .mapToDouble(
                issue ->
                    switch (issue.severity()) {
                      case BLOCKER, CRITICAL -> 8;
                      case MAJOR -> 4;
                      case MINOR -> 2;
                      case INFO -> 0.5;
                    })
            .sorted()
            .toArray();
    double average = Arrays.stream(hours).average().orElse(0);
    double median = hours[hours.length / 2];
    double p95 = hours[(int) Math.floor(hours.length * 0.95)];
    return new CycleTime(average, median, p95);
  }

  static int codeQualityScore(
      double avgComplexity, double coverage, int smells, int securityIssues, int files) {
    int score = 100;
    if (avgComplexity > 20) {
      score -= 30;
    } else if (avgComplexity > 15) {
      score -= 20;
    } else if (avgComplexity > 10) {
      score -= 10;
    }

    if (coverage >= 80) {
      score += 10;
    } else if (coverage < 40) {
      score -= 30;
    } else if (coverage < 60) {
      score -= 20;
    }

    double smellsPerFile = files > 0 ? (double) smells / files : 0;
    if (smellsPerFile > 5) {
      score -= 25;
    } else if (smellsPerFile > 3) {
      score -= 15;
    } else if (smellsPerFile > 1) {
      score -= 5;
    }

    if (securityIssues > 10) {
      score -= 25;
    } else if (securityIssues > 5) {
      score -= 15;
    } else if (securityIssues > 0) {
      score -= 10;
    }
    return Math.max(0, Math.min(100, score));
  }

  static VelocityTrend velocity(double tdr, double defectDensity, int qualityScore) {
    double current = 100;
    if (tdr > 40) {
      current -= 40;
    } else if (tdr > 25) {
      current -= 25;
    } else if (tdr > 10) {
      current -= 10;
    }
    if (defectDensity > 2) {
      current -= 20;
    } else if (defectDensity > 1) {
      current -= 10;
    }
    if (qualityScore < 50) {
      current -= 20;
    } else if (qualityScore < 70) {
      current -= 10;
    }
    current = Math.max(0, current);

    // previous sprint is assumed ten percent faster
    double previous = Math.min(100, current * 1.1);
    double change = previous > 0 ? (current - previous) / previous * 100 : 0.0;
    String level;
    if (current >= 80) {
      level = "Low";
    } else if (current >= 60) {
      level = "Medium";
    } else if (current >= 40) {
      level = "High";
    } else {
      level = "Critical";
    }
    return new VelocityTrend(current, previous, change, level);
  }

  static int teamSatisfaction(int qualityScore, double coverage, double avgComplexity) {
    int satisfaction = qualityScore;
    if (coverage >= 80) {
      satisfaction += 10;
    } else if (coverage < 40) {
      satisfaction -= 15;
    }
    if (avgComplexity > 15) {
      satisfaction -= 15;
    } else if (avgComplexity < 8) {
      satisfaction += 5;
    }
    return Math.max(0, Math.min(100, satisfaction));
  }

  /** Tiers are exclusive upper bounds: below {@code excellent} is Excellent, and so on. */
  private static BenchmarkComparison lowerIsBetter(
      String metric,
      double current,
      double target,
      double industry,
      double excellent,
      double good,
      double fair,
      double poor) {
    Status status;
    if (current < excellent) {
      status = Status.EXCELLENT;
    } else if (current < good) {
      status = Status.GOOD;
    } else if (current < fair) {
      status = Status.FAIR;
    } else if (current < poor) {
      status = Status.POOR;
    } else {
      status = Status.CRITICAL;
    }
    return new BenchmarkComparison(metric, current, target, industry, status, current - target);
  }

  /** Tiers are inclusive lower bounds. */
  private static BenchmarkComparison higherIsBetter(
      String metric,
      double current,
      double target,
      double industry,
      double excellent,
      double good,
      double fair,
      double poor) {
    Status status;
    if (current >= excellent) {
      status = Status.EXCELLENT;
    } else if (current >= good) {
      status = Status.GOOD;
    } else if (current >= fair) {
      status = Status.FAIR;
    } else if (current >= poor) {
      status = Status.POOR;
    } else {
      status = Status.CRITICAL;
    }
    return new BenchmarkComparison(metric, current, target, industry, status, current - target);
  }
}
