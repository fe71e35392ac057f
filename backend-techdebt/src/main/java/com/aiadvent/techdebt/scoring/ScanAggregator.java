package com.aiadvent.techdebt.scoring;

import com.aiadvent.techdebt.model.FileReport;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.ScanResult;
import com.aiadvent.techdebt.model.ScanResult.BusinessImpact;
import com.aiadvent.techdebt.model.ScanResult.ComplexitySummary;
import com.aiadvent.techdebt.model.ScanResult.FileMetric;
import com.aiadvent.techdebt.model.ScanResult.QualitySummary;
import com.aiadvent.techdebt.model.ScanResult.Summary;
import com.aiadvent.techdebt.model.ScanResult.TechnicalDebt;
import com.aiadvent.techdebt.model.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Pure reduction of per-file reports into one {@link ScanResult}. Holds no state between calls;
 * the output depends only on the reports, their order and the test coverage.
 */
@Component
public class ScanAggregator {

  static final int HIGH_COMPLEXITY = 50;

  private final DebtCalculator debtCalculator;
  private final BusinessImpactCalculator businessImpactCalculator;
  private final RemediationPlanner remediationPlanner;

  public ScanAggregator(
      DebtCalculator debtCalculator,
      BusinessImpactCalculator businessImpactCalculator,
      RemediationPlanner remediationPlanner) {
    this.debtCalculator = Objects.requireNonNull(debtCalculator, "debtCalculator");
    this.businessImpactCalculator =
        Objects.requireNonNull(businessImpactCalculator, "businessImpactCalculator");
    this.remediationPlanner = Objects.requireNonNull(remediationPlanner, "remediationPlanner");
  }

  public ScanResult aggregate(List<FileReport> reports, double testCoverage) {
    if (reports == null) {
      throw new IllegalArgumentException("reports must not be null");
    }
    List<Finding> issues = new ArrayList<>();
    List<FileMetric> fileMetrics = new ArrayList<>(reports.size());
    long totalLines = 0;
    long commentLines = 0;
    long totalCyclomatic = 0;
    long totalCognitive = 0;
    long debtMinutes = 0;
    int highComplexityFiles = 0;

    for (FileReport report : reports) {
      totalLines += report.lines();
      commentLines += report.text().commentLines();
      totalCyclomatic += report.complexity().cyclomatic();
      totalCognitive += report.complexity().cognitive();
      if (report.complexity().cyclomatic() > HIGH_COMPLEXITY
          || report.complexity().cognitive() > HIGH_COMPLEXITY) {
        highComplexityFiles++;
      }
      issues.addAll(report.findings());
      int fileDebt = report.debtMinutes();
      debtMinutes += fileDebt;
      fileMetrics.add(
          new FileMetric(
              report.path(), report.lines(), report.complexity(), report.issueCount(), fileDebt));
    }

    int fileCount = reports.size();
    double avgCyclomatic = fileCount > 0 ? (double) totalCyclomatic / fileCount : 0.0;
    double avgCognitive = fileCount > 0 ? (double) totalCognitive / fileCount : 0.0;
    double commentRatio = totalLines > 0 ? (double) commentLines / totalLines : 0.0;

    double debtRatio = debtCalculator.debtRatio(debtMinutes, totalLines);
    String rating = DebtCalculator.rating(debtRatio);
    double maintainability =
        DebtCalculator.maintainabilityIndex(totalLines, totalCyclomatic, commentRatio);

    int critical =
        (int) issues.stream().filter(f -> f.severity().isAtLeast(Severity.CRITICAL)).count();
    int security = (int) issues.stream().filter(Finding::isSecurity).count();
    int smells = issues.size() - security;

    BusinessImpact impact =
        businessImpactCalculator.calculate(
            debtMinutes, debtRatio, rating, issues, totalCyclomatic, smells, testCoverage);

    Summary summary =
        new Summary(
            fileCount,
            (int) totalLines,
            issues.size(),
            critical,
            new TechnicalDebt((int) debtMinutes, debtRatio, rating, maintainability),
            new ComplexitySummary(avgCyclomatic, avgCognitive, highComplexityFiles),
            new QualitySummary(smells, security, testCoverage));

    return new ScanResult(
        summary, impact, issues, fileMetrics, remediationPlanner.plan(fileMetrics, issues));
  }
}
