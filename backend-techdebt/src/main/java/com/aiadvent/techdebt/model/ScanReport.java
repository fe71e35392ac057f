package com.aiadvent.techdebt.model;

import com.aiadvent.techdebt.authorship.AuthorshipModels.AICodeSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one scan hands to its collaborators. Only {@link #result()} is deterministic; the
 * timestamp lives here so the result itself can be compared across runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanReport(
    ScanResult result,
    AICodeSummary aiSummary,
    EnterpriseMetrics enterpriseMetrics,
    List<BenchmarkComparison> benchmarks,
    List<SkippedFile> skippedFiles,
    List<String> dependencyAuditTools,
    Instant generatedAt) {

  public ScanReport {
    Objects.requireNonNull(result, "result");
    benchmarks = benchmarks != null ? List.copyOf(benchmarks) : List.of();
    skippedFiles = skippedFiles != null ? List.copyOf(skippedFiles) : List.of();
    dependencyAuditTools =
        dependencyAuditTools != null ? List.copyOf(dependencyAuditTools) : List.of();
  }

  public Optional<AICodeSummary> authorshipSummary() {
    return Optional.ofNullable(aiSummary);
  }
}
