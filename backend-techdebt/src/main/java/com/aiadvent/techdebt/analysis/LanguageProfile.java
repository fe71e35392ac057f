package com.aiadvent.techdebt.analysis;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.util.StringUtils;

/**
 * Frozen token table for one language: the branching tokens counted by the complexity metrics,
 * the pattern used to count functions and the pattern that captures a declared function name
 * in group 1.
 */
public record LanguageProfile(
    String tag,
    List<String> branchTokens,
    Pattern functionPattern,
    Pattern declarationPattern,
    Pattern branchPattern) {

  private static final Pattern WORD_TOKEN = Pattern.compile("[A-Za-z_][\\w ]*");
  private static final Pattern NEVER = Pattern.compile("(?!)");

  public LanguageProfile {
    Objects.requireNonNull(tag, "tag");
    branchTokens = branchTokens != null ? List.copyOf(branchTokens) : List.of();
    Objects.requireNonNull(functionPattern, "functionPattern");
    Objects.requireNonNull(declarationPattern, "declarationPattern");
    branchPattern = branchPattern != null ? branchPattern : compileBranchPattern(branchTokens);
  }

  static LanguageProfile of(
      String tag, List<String> branchTokens, String functionRegex, String declarationRegex) {
    return new LanguageProfile(
        tag,
        branchTokens,
        Pattern.compile(functionRegex, Pattern.MULTILINE),
        Pattern.compile(declarationRegex, Pattern.MULTILINE),
        null);
  }

  public LanguageProfile withBranchTokens(List<String> tokens) {
    return new LanguageProfile(tag, tokens, functionPattern, declarationPattern, null);
  }

  public int countBranches(String text) {
    if (!StringUtils.hasLength(text)) {
      return 0;
    }
    Matcher matcher = branchPattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  public boolean hasBranch(String line) {
    return StringUtils.hasLength(line) && branchPattern.matcher(line).find();
  }

  public int countFunctions(String text) {
    if (!StringUtils.hasLength(text)) {
      return 0;
    }
    Matcher matcher = functionPattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  /** Name of the function declared on this line, or {@code null}. */
  public String declaredFunction(String line) {
    if (!StringUtils.hasLength(line)) {
      return null;
    }
    Matcher matcher = declarationPattern.matcher(line);
    return matcher.find() ? matcher.group(1) : null;
  }

  static Pattern compileBranchPattern(List<String> tokens) {
    List<String> alternatives =
        tokens.stream()
            .filter(StringUtils::hasText)
            .map(String::trim)
            .distinct()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(LanguageProfile::tokenRegex)
            .toList();
    if (alternatives.isEmpty()) {
      return NEVER;
    }
    return Pattern.compile(alternatives.stream().collect(Collectors.joining("|")));
  }

  private static String tokenRegex(String token) {
    if ("?".equals(token)) {
      // ternary only: not ?. ?? ?: nor a generic wildcard
      return "(?<![<?])\\?(?![.?:>,)])";
    }
    if (WORD_TOKEN.matcher(token).matches()) {
      String[] words = token.trim().split("\\s+");
      StringBuilder regex = new StringBuilder("\\b");
      for (int i = 0; i < words.length; i++) {
        if (i > 0) {
          regex.append("\\s+");
        }
        regex.append(Pattern.quote(words[i]));
      }
      return regex.append("\\b").toString();
    }
    return Pattern.quote(token);
  }
}
