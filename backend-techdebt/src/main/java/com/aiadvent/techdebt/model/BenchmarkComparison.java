package com.aiadvent.techdebt.model;

import com.fasterxml.jackson.annotation.JsonValue;

public record BenchmarkComparison(
    String metric, double current, double target, double industry, Status status, double gap) {

  public enum Status {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    CRITICAL("Critical");

    private final String label;

    Status(String label) {
      this.label = label;
    }

    @JsonValue
    public String label() {
      return label;
    }
  }
}
