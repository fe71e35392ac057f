package com.aiadvent.techdebt.analysis.smell;

import com.aiadvent.techdebt.analysis.DuplicateWindows;
import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;

final class DuplicationRule implements FindingRule {

  static final int MAJOR_BLOCKS = 5;

  private final int minLength;
  private final double ratioThreshold;

  DuplicationRule(int minLength, double ratioThreshold) {
    this.minLength = Math.max(1, minLength);
    this.ratioThreshold = ratioThreshold;
  }

  @Override
  public FindingKind kind() {
    return FindingKind.CODE_DUPLICATION;
  }

  @Override
  public List<Finding> detect(RuleContext context) {
    DuplicateWindows.Result result = DuplicateWindows.scan(context.lines(), minLength);
    int blocks = result.blocks();
    if (blocks == 0) {
      return List.of();
    }
    String message =
        "%d duplicate code blocks detected. Consider extracting common functionality."
            .formatted(blocks);
    // The share only annotates the message; severity depends on the block count alone.
    if (result.ratio() > ratioThreshold) {
      message += " Duplicated windows cover %d%% of the file."
          .formatted(Math.round(result.ratio() * 100));
    }
    return List.of(
        Finding.of(
            kind(),
            blocks > MAJOR_BLOCKS ? Severity.MAJOR : Severity.MINOR,
            context.path(),
            null,
            message,
            blocks * 30));
  }
}
