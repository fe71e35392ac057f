package com.aiadvent.techdebt.analysis.security;

import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;
import java.util.regex.Pattern;

final class HardcodedSecretRule extends LinePatternRule {

  private static final String ADVICE = ". Use environment variables or secure vaults.";

  private static final String LITERAL_ASSIGNMENT = "\\s*[:=]\\s*['\"][^'\"]+['\"]";

  private static final Pattern SECRET_SOURCE =
      Pattern.compile(
          "process\\.env|System\\.getenv|os\\.environ|os\\.getenv"
              + "|getProperty\\(|\\bconfig\\.|@Value");

  HardcodedSecretRule() {
    super(
        FindingKind.HARDCODED_SECRET,
        Severity.BLOCKER,
        "CWE-798",
        15,
        List.of(
            Signature.ignoringCase(
                "(?:password|passwd|pwd)" + LITERAL_ASSIGNMENT,
                "Hardcoded password detected" + ADVICE),
            Signature.ignoringCase(
                "(?:api[_-]?key|apikey)" + LITERAL_ASSIGNMENT,
                "Hardcoded API key detected" + ADVICE),
            Signature.ignoringCase(
                "(?:secret|token)" + LITERAL_ASSIGNMENT,
                "Hardcoded secret/token detected" + ADVICE),
            Signature.of(
                "['\"][A-Za-z0-9]{32,}['\"]", "Potential hardcoded credential detected" + ADVICE)));
  }

  @Override
  protected boolean applies(String line) {
    return !SECRET_SOURCE.matcher(line).find();
  }
}
