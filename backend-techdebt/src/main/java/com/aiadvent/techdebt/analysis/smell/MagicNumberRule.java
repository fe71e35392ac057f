package com.aiadvent.techdebt.analysis.smell;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.analysis.SourceLines;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

final class MagicNumberRule implements FindingRule {

  static final int MAX_FINDINGS = 10;

  // integer literals other than 0 and 1 that are not the right-hand side of an assignment
  private static final Pattern LITERAL =
      Pattern.compile("(?<![\\w.])(?<!=\\s{0,8})(?:[2-9]|[1-9]\\d+)(?![\\w.])");

  private static final Pattern CONSTANT_DECLARATION =
      Pattern.compile(
          "\\bconst\\s+[A-Z_][A-Z0-9_]*\\b|\\bstatic\\s+final\\b"
              + "|^\\s*[A-Z][A-Z0-9_]*\\s*=|#define\\b");

  @Override
  public FindingKind kind() {
    return FindingKind.MAGIC_NUMBER;
  }

  @Override
  public List<Finding> detect(RuleContext context) {
    List<Finding> findings = new ArrayList<>();
    List<String> lines = context.lines();
    for (int i = 0; i < lines.size() && findings.size() < MAX_FINDINGS; i++) {
      String line = lines.get(i);
      if (SourceLines.isCommentLine(line)
          || line.contains("//")
          || CONSTANT_DECLARATION.matcher(line).find()
          || !LITERAL.matcher(line).find()) {
        continue;
      }
      findings.add(
          Finding.of(
              kind(),
              Severity.MINOR,
              context.path(),
              i + 1,
              "Magic number detected. Consider using named constants for better readability.",
              5));
    }
    return findings;
  }
}
