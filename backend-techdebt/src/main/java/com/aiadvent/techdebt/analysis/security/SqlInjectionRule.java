package com.aiadvent.techdebt.analysis.security;

import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;

/** SQL verb and a concatenation or interpolation marker on the same line. */
final class SqlInjectionRule extends LinePatternRule {

  private static final String SQL_VERB = "\\b(?:SELECT|INSERT|UPDATE|DELETE)\\b";
  private static final String DYNAMIC_STRING = "(?:\\+|\\$\\{|`|String\\.format\\(|\\bf\")";

  SqlInjectionRule() {
    super(
        FindingKind.SQL_INJECTION,
        Severity.BLOCKER,
        "CWE-89",
        30,
        List.of(
            Signature.of(
                SQL_VERB + ".*" + DYNAMIC_STRING + "|" + DYNAMIC_STRING + ".*" + SQL_VERB,
                "Potential SQL injection vulnerability. Use parameterized queries or ORM.")));
  }
}
