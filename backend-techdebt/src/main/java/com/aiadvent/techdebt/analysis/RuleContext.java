package com.aiadvent.techdebt.analysis;

import com.aiadvent.techdebt.model.SourceUnit;
import java.util.List;
import java.util.Objects;

/** One file prepared for the rules: its lines are split once and shared read-only. */
public record RuleContext(SourceUnit unit, List<String> lines, LanguageProfile profile) {

  public RuleContext {
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(profile, "profile");
    lines = lines != null ? List.copyOf(lines) : SourceLines.split(unit.content());
  }

  public static RuleContext of(SourceUnit unit, LanguageProfile profile) {
    return new RuleContext(unit, SourceLines.split(unit.content()), profile);
  }

  public String path() {
    return unit.path();
  }

  public String content() {
    return unit.content();
  }
}
