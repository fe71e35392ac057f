package com.aiadvent.techdebt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Finding severity, declared from most to least severe. */
public enum Severity {
  BLOCKER("CRITICAL - Immediate production risk, potential data breach or system failure"),
  CRITICAL("HIGH - Significant impact on reliability, security, or performance"),
  MAJOR("MEDIUM - Affects maintainability and development velocity"),
  MINOR("LOW - Minor quality improvement, technical excellence"),
  INFO("MINIMAL - Informational, best practice suggestion");

  private final String businessImpact;

  Severity(String businessImpact) {
    this.businessImpact = businessImpact;
  }

  public String businessImpact() {
    return businessImpact;
  }

  public boolean isAtLeast(Severity other) {
    return ordinal() <= other.ordinal();
  }

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Severity fromCode(String code) {
    if (code == null || code.isBlank()) {
      return INFO;
    }
    return Severity.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
