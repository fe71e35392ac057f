package com.aiadvent.techdebt.analysis.smell;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.analysis.SourceLines;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;

/** Peak of the running brace balance, counting every brace on a line. */
final class DeepNestingRule implements FindingRule {

  static final int MINOR_DEPTH = 4;
  static final int MAJOR_DEPTH = 6;

  @Override
  public FindingKind kind() {
    return FindingKind.DEEP_NESTING;
  }

  @Override
  public List<Finding> detect(RuleContext context) {
    int depth = 0;
    int peak = 0;
    int peakLine = 0;
    List<String> lines = context.lines();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      depth += SourceLines.count(line, '{') - SourceLines.count(line, '}');
      if (depth > peak) {
        peak = depth;
        peakLine = i + 1;
      }
    }
    if (peak <= MINOR_DEPTH) {
      return List.of();
    }
    return List.of(
        Finding.of(
            kind(),
            peak > MAJOR_DEPTH ? Severity.MAJOR : Severity.MINOR,
            context.path(),
            peakLine,
            "Deep nesting detected (%d levels). Consider extracting methods or using early returns."
                .formatted(peak),
            peak * 10));
  }
}
