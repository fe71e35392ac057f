package com.aiadvent.techdebt.analysis;

import com.aiadvent.techdebt.model.ComplexityMetrics;
import com.aiadvent.techdebt.model.SourceUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Lexical cyclomatic and cognitive complexity. Scope depth is inferred from whether a line
 * contains an opening or closing brace, so several braces on one line move the depth by one.
 */
@Component
public class ComplexityAnalyzer {

  private final LanguageProfiles languageProfiles;

  public ComplexityAnalyzer(LanguageProfiles languageProfiles) {
    this.languageProfiles = Objects.requireNonNull(languageProfiles, "languageProfiles");
  }

  public ComplexityMetrics analyze(SourceUnit unit) {
    Objects.requireNonNull(unit, "unit");
    return analyze(unit.content(), languageProfiles.resolve(unit));
  }

  public ComplexityMetrics analyze(String content, LanguageProfile profile) {
    Objects.requireNonNull(profile, "profile");
    if (content == null || content.isEmpty()) {
      return ComplexityMetrics.TRIVIAL;
    }
    List<String> lines = SourceLines.split(content);
    int cyclomatic = 1 + profile.countBranches(content);
    int cognitive = cognitive(lines, content, profile);
    int functions = profile.countFunctions(content);
    return new ComplexityMetrics(cyclomatic, cognitive, functions);
  }

  int cognitive(List<String> lines, String content, LanguageProfile profile) {
    int complexity = 0;
    int depth = 0;
    Set<String> declared = new LinkedHashSet<>();
    for (String line : lines) {
      if (line.indexOf('{') >= 0) {
        depth++;
      }
      if (line.indexOf('}') >= 0) {
        depth = Math.max(0, depth - 1);
      }
      if (profile.hasBranch(line)) {
        complexity += 1 + depth;
      }
      String name = profile.declaredFunction(line);
      if (name != null && declared.add(name) && isCalledElsewhere(name, line, content)) {
        complexity++;
      }
    }
    return complexity;
  }

  private static boolean isCalledElsewhere(String name, String declarationLine, String content) {
    Pattern call = Pattern.compile("\\b" + Pattern.quote(name) + "\\s*\\(");
    return occurrences(call, content) > occurrences(call, declarationLine);
  }

  private static int occurrences(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
