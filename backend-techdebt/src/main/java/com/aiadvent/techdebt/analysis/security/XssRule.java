package com.aiadvent.techdebt.analysis.security;

import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;
import java.util.regex.Pattern;

final class XssRule extends LinePatternRule {

  private static final Pattern DYNAMIC_MARKUP = Pattern.compile("\\+|\\$\\{|`");

  XssRule() {
    super(
        FindingKind.XSS_VULNERABILITY,
        Severity.CRITICAL,
        "CWE-79",
        25,
        List.of(
            Signature.of(
                "\\.innerHTML\\b|\\.outerHTML\\b|\\bdocument\\.write(?:ln)?\\s*\\(",
                "Potential XSS vulnerability. Sanitize user input before rendering.")));
  }

  @Override
  protected boolean applies(String line) {
    return DYNAMIC_MARKUP.matcher(line).find();
  }
}
