package com.aiadvent.techdebt.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FindingKind {
  LONG_METHOD(FindingCategory.MAINTAINABILITY),
  GOD_CLASS(FindingCategory.MAINTAINABILITY),
  MAGIC_NUMBER(FindingCategory.MAINTAINABILITY),
  DEEP_NESTING(FindingCategory.MAINTAINABILITY),
  COMMENTED_CODE(FindingCategory.MAINTAINABILITY),
  CODE_DUPLICATION(FindingCategory.MAINTAINABILITY),
  MISSING_ERROR_HANDLING(FindingCategory.MAINTAINABILITY),

  HARDCODED_SECRET(FindingCategory.SECURITY),
  SQL_INJECTION(FindingCategory.SECURITY),
  XSS_VULNERABILITY(FindingCategory.SECURITY),
  INSECURE_RANDOM(FindingCategory.SECURITY),
  EVAL_USAGE(FindingCategory.SECURITY),
  INSECURE_DEPENDENCY(FindingCategory.SECURITY);

  private final FindingCategory category;

  FindingKind(FindingCategory category) {
    this.category = category;
  }

  public FindingCategory category() {
    return category;
  }

  public boolean isSecurity() {
    return category == FindingCategory.SECURITY;
  }

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
