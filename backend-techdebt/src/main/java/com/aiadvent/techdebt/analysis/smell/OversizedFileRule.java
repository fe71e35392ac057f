package com.aiadvent.techdebt.analysis.smell;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;

/** Reported as {@code god_class}: the file as a whole has too many non-blank lines. */
final class OversizedFileRule implements FindingRule {

  static final int CRITICAL_LINES = 500;
  static final int BLOCKER_LINES = 1000;

  @Override
  public FindingKind kind() {
    return FindingKind.GOD_CLASS;
  }

  @Override
  public List<Finding> detect(RuleContext context) {
    long nonBlank = context.lines().stream().filter(line -> !line.isBlank()).count();
    if (nonBlank <= CRITICAL_LINES) {
      return List.of();
    }
    return List.of(
        Finding.of(
            kind(),
            nonBlank > BLOCKER_LINES ? Severity.BLOCKER : Severity.CRITICAL,
            context.path(),
            null,
            ("File '%s' has %d lines (recommended: < %d lines). "
                    + "Consider splitting into smaller modules.")
                .formatted(context.unit().fileName(), nonBlank, CRITICAL_LINES),
            (int) Math.ceil(nonBlank / 100.0) * 60));
  }
}
