package com.aiadvent.techdebt.model;

/**
 * Management-facing KPIs derived from a {@link ScanResult}. Delivery and team figures are
 * proxies estimated from code metrics, not measurements.
 */
public record EnterpriseMetrics(
    double technicalDebtRatio,
    double defectDensity,
    double codeChurnRate,
    CycleTime cycleTime,
    String deploymentFrequency,
    String leadTimeForChanges,
    double changeFailureRate,
    String timeToRestoreService,
    VelocityTrend velocityTrend,
    FocusTime focusTime,
    CoverageBreakdown testCoverage,
    int codeQualityScore,
    double duplicationRate,
    double maintenanceCostRatio,
    int featureDeliveryVelocity,
    int customerImpactScore,
    int teamSatisfactionIndex,
    int criticalPathRisk,
    double scalabilityIndex,
    int securityPosture,
    int complianceRisk) {

  /** Estimated hours to fix an issue. */
  public record CycleTime(double average, double median, double p95) {

    public static final CycleTime NONE = new CycleTime(0, 0, 0);
  }

  public record VelocityTrend(double current, double previous, double change, String impactLevel) {}

  public record FocusTime(double percentage, int interruptionRate) {}

  public record CoverageBreakdown(double overall, double unit, double integration, double e2e) {}
}
