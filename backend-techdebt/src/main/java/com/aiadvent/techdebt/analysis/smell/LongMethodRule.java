package com.aiadvent.techdebt.analysis.smell;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.FunctionSpans;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.ArrayList;
import java.util.List;

final class LongMethodRule implements FindingRule {

  static final int MAJOR_LENGTH = 50;
  static final int CRITICAL_LENGTH = 100;

  @Override
  public FindingKind kind() {
    return FindingKind.LONG_METHOD;
  }

  @Override
  public List<Finding> detect(RuleContext context) {
    List<Finding> findings = new ArrayList<>();
    for (FunctionSpans.Span span : FunctionSpans.find(context.lines(), context.profile())) {
      int length = span.length();
      if (length <= MAJOR_LENGTH) {
        continue;
      }
      findings.add(
          Finding.of(
              kind(),
              length > CRITICAL_LENGTH ? Severity.CRITICAL : Severity.MAJOR,
              context.path(),
              span.startLine(),
              "Function '%s' is %d lines long (recommended: < %d lines)"
                  .formatted(span.name(), length, MAJOR_LENGTH),
              (int) Math.ceil(length / 10.0) * 15));
    }
    return findings;
  }
}
