package com.aiadvent.techdebt.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FindingCategory {
  MAINTAINABILITY,
  RELIABILITY,
  SECURITY;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
