package com.aiadvent.techdebt.analysis.security;

import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;
import java.util.regex.Pattern;

final class InsecureRandomRule extends LinePatternRule {

  private static final Pattern SENSITIVE_NAME =
      Pattern.compile("token|key|password|secret", Pattern.CASE_INSENSITIVE);

  InsecureRandomRule() {
    super(
        FindingKind.INSECURE_RANDOM,
        Severity.CRITICAL,
        "CWE-338",
        10,
        List.of(
            Signature.of(
                "Math\\.random\\(\\)",
                "Math.random() is not cryptographically secure. Use crypto.randomBytes() instead."),
            Signature.of(
                "\\bnew\\s+Random\\s*\\(",
                "java.util.Random is not cryptographically secure. Use SecureRandom instead."),
            Signature.of(
                "\\brandom\\.(?:random|randint|choice)\\s*\\(",
                "The random module is not cryptographically secure. Use secrets instead.")));
  }

  @Override
  protected boolean applies(String line) {
    return SENSITIVE_NAME.matcher(line).find();
  }
}
