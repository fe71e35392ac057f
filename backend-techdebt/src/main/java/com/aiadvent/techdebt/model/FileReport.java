package com.aiadvent.techdebt.model;

import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipAnalysis;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Everything the analyzers produced for one file. */
public record FileReport(
    String path,
    TextMetrics text,
    ComplexityMetrics complexity,
    List<Finding> findings,
    AuthorshipAnalysis authorship) {

  public FileReport {
    Objects.requireNonNull(path, "path");
    text = text != null ? text : TextMetrics.EMPTY;
    complexity = complexity != null ? complexity : ComplexityMetrics.TRIVIAL;
    findings = findings != null ? List.copyOf(findings) : List.of();
  }

  public int lines() {
    return text.totalLines();
  }

  public int issueCount() {
    return findings.size();
  }

  public int debtMinutes() {
    return findings.stream().mapToInt(Finding::effortMinutes).sum();
  }

  public Optional<AuthorshipAnalysis> authorshipAnalysis() {
    return Optional.ofNullable(authorship);
  }
}
