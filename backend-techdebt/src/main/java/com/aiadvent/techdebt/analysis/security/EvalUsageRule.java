package com.aiadvent.techdebt.analysis.security;

import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;

final class EvalUsageRule extends LinePatternRule {

  EvalUsageRule() {
    super(
        FindingKind.EVAL_USAGE,
        Severity.CRITICAL,
        "CWE-95",
        20,
        List.of(
            Signature.of(
                "\\beval\\s*\\(",
                "eval() usage detected. This can lead to code injection vulnerabilities."),
            Signature.of(
                "\\bnew\\s+Function\\s*\\(",
                "new Function() usage detected. "
                    + "This can lead to code injection vulnerabilities.")));
  }
}
