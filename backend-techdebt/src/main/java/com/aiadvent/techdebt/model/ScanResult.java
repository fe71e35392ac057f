package com.aiadvent.techdebt.model;

import java.util.List;

/**
 * Repository-level outcome of one scan. The record layout mirrors the JSON document the report
 * renderers consume, so component names are part of the contract.
 */
public record ScanResult(
    Summary summary,
    BusinessImpact businessImpact,
    List<Finding> issues,
    List<FileMetric> fileMetrics,
    Trends trends) {

  public ScanResult {
    issues = issues != null ? List.copyOf(issues) : List.of();
    fileMetrics = fileMetrics != null ? List.copyOf(fileMetrics) : List.of();
  }

  public record Summary(
      int totalFiles,
      int totalLines,
      int totalIssues,
      int criticalIssues,
      TechnicalDebt technicalDebt,
      ComplexitySummary complexity,
      QualitySummary quality) {}

  public record TechnicalDebt(
      int totalMinutes, double debtRatio, String sqaleRating, double maintainabilityIndex) {}

  public record ComplexitySummary(
      double avgCyclomatic, double avgCognitive, int highComplexityFiles) {}

  public record QualitySummary(int codeSmells, int securityIssues, double testCoverage) {}

  public record BusinessImpact(
      double financialCost,
      String timeToFix,
      int riskScore,
      String productivityImpact,
      String customerImpact,
      List<String> recommendations) {

    public BusinessImpact {
      recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
  }

  public record FileMetric(
      String file, int lines, ComplexityMetrics complexity, int issues, int debtMinutes) {}

  public record Trends(
      List<WorstFile> worstFiles, List<QuickWin> quickWins, List<String> criticalPath) {

    public Trends {
      worstFiles = worstFiles != null ? List.copyOf(worstFiles) : List.of();
      quickWins = quickWins != null ? List.copyOf(quickWins) : List.of();
      criticalPath = criticalPath != null ? List.copyOf(criticalPath) : List.of();
    }
  }

  public record WorstFile(String file, double score, String reason) {}

  public record QuickWin(String file, int effort, String impact) {}
}
