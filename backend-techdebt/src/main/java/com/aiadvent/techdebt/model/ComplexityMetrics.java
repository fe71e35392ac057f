package com.aiadvent.techdebt.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"cyclomatic", "cognitive", "functions", "avgComplexityPerFunction"})
public record ComplexityMetrics(
    int cyclomatic, int cognitive, @JsonProperty("functions") int functionCount) {

  public static final ComplexityMetrics TRIVIAL = new ComplexityMetrics(1, 0, 0);

  public ComplexityMetrics {
    cyclomatic = Math.max(1, cyclomatic);
    cognitive = Math.max(0, cognitive);
    functionCount = Math.max(0, functionCount);
  }

  @JsonProperty("avgComplexityPerFunction")
  public double averagePerFunction() {
    return functionCount > 0 ? (double) cyclomatic / functionCount : 0.0;
  }
}
