package com.aiadvent.techdebt.analysis.security;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Base for line-scoped weakness checks. Signatures are tried in order and only the first one
 * that matches a line is reported for it.
 */
abstract class LinePatternRule implements FindingRule {

  record Signature(Pattern pattern, String message) {

    static Signature of(String regex, String message) {
      return new Signature(Pattern.compile(regex), message);
    }

    static Signature ignoringCase(String regex, String message) {
      return new Signature(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), message);
    }
  }

  private final FindingKind kind;
  private final Severity severity;
  private final String weaknessId;
  private final int effortMinutes;
  private final List<Signature> signatures;

  LinePatternRule(
      FindingKind kind,
      Severity severity,
      String weaknessId,
      int effortMinutes,
      List<Signature> signatures) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.severity = Objects.requireNonNull(severity, "severity");
    this.weaknessId = weaknessId;
    this.effortMinutes = effortMinutes;
    this.signatures = List.copyOf(signatures);
  }

  @Override
  public FindingKind kind() {
    return kind;
  }

  /** Lines for which this returns {@code false} are skipped before any signature is tried. */
  protected boolean applies(String line) {
    return true;
  }

  @Override
  public List<Finding> detect(RuleContext context) {
    List<Finding> findings = new ArrayList<>();
    List<String> lines = context.lines();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (line.isBlank() || !applies(line)) {
        continue;
      }
      for (Signature signature : signatures) {
        if (signature.pattern().matcher(line).find()) {
          findings.add(
              new Finding(
                  kind,
                  severity,
                  context.path(),
                  i + 1,
                  signature.message(),
                  effortMinutes,
                  weaknessId));
          break;
        }
      }
    }
    return findings;
  }
}
