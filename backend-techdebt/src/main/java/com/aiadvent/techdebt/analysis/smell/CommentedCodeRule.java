package com.aiadvent.techdebt.analysis.smell;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;

final class CommentedCodeRule implements FindingRule {

  static final int THRESHOLD = 10;

  @Override
  public FindingKind kind() {
    return FindingKind.COMMENTED_CODE;
  }

  @Override
  public List<Finding> detect(RuleContext context) {
    int count = 0;
    for (String line : context.lines()) {
      String trimmed = line.trim();
      if ((trimmed.startsWith("//") || trimmed.startsWith("#")) && looksLikeCode(trimmed)) {
        count++;
      }
    }
    if (count <= THRESHOLD) {
      return List.of();
    }
    return List.of(
        Finding.of(
            kind(),
            Severity.MINOR,
            context.path(),
            null,
            "%d lines of commented code detected. Remove dead code or use version control."
                .formatted(count),
            count * 2));
  }

  private static boolean looksLikeCode(String line) {
    return line.indexOf('=') >= 0 || line.indexOf('(') >= 0 || line.indexOf('{') >= 0;
  }
}
