package com.aiadvent.techdebt.analysis;

import com.aiadvent.techdebt.config.TechDebtProperties;
import com.aiadvent.techdebt.model.SourceUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Language token tables keyed by tag. New languages are added as rows; extensions without a row
 * fall back to the {@code js} row.
 */
@Component
public class LanguageProfiles {

  public static final String DEFAULT_TAG = "js";

  private static final List<String> C_FAMILY_BRANCHES =
      List.of("if", "else if", "for", "while", "case", "catch", "&&", "||", "?");

  private static final String JS_FUNCTIONS =
      "\\bfunction(?:\\s*\\*\\s*|\\s+)\\w+"
          + "|\\b(?:const|let|var)\\s+\\w+\\s*=\\s*(?:async\\s*)?(?:\\([^)\\n]*\\)|\\w+)\\s*=>"
          + "|^[ \\t]*(?:(?:public|private|protected|static|async|get|set)\\s+)*"
          + "(?!(?:if|for|while|switch|catch|return|function|else)\\b)"
          + "\\w+\\s*\\([^)\\n]*\\)\\s*\\{";

  private static final String JS_DECLARATION =
      "\\b(?:function(?:\\s*\\*\\s*|\\s+)"
          + "|(?:const|let|var)\\s+(?=\\w+\\s*=\\s*(?:async\\s*)?(?:\\([^)\\n]*\\)|\\w+)\\s*=>))"
          + "(\\w+)";

  private static final String JAVA_DECLARATION =
      "^[ \\t]*(?:@\\w+\\s+)*"
          + "(?:(?:public|protected|private|static|final|abstract"
          + "|synchronized|native|default)\\s+)+"
          + "(?:<[^>\\n]*>\\s+)?[\\w.]+(?:<[^()\\n]*?>)?(?:\\[\\])*\\s+(\\w+)\\s*\\(";

  private static final Map<String, LanguageProfile> TABLE = buildTable();

  private static final Map<String, String> ALIASES =
      Map.of(
          "jsx", "js",
          "mjs", "js",
          "cjs", "js",
          "tsx", "ts",
          "pyw", "py");

  private final Map<String, LanguageProfile> profiles;
  private final LanguageProfile fallback;

  @Autowired
  public LanguageProfiles(TechDebtProperties properties) {
    this(properties != null ? properties.getComplexityMarkers() : List.of());
  }

  LanguageProfiles(List<String> markerOverride) {
    boolean override =
        markerOverride != null && markerOverride.stream().anyMatch(StringUtils::hasText);
    Map<String, LanguageProfile> resolved = new LinkedHashMap<>();
    TABLE.forEach(
        (tag, profile) ->
            resolved.put(tag, override ? profile.withBranchTokens(markerOverride) : profile));
    this.profiles = Map.copyOf(resolved);
    this.fallback = this.profiles.get(DEFAULT_TAG);
  }

  public static LanguageProfiles defaults() {
    return new LanguageProfiles(List.<String>of());
  }

  public LanguageProfile resolve(SourceUnit unit) {
    return resolve(unit.extension());
  }

  public LanguageProfile resolve(String extension) {
    if (!StringUtils.hasText(extension)) {
      return fallback;
    }
    String key = extension.trim().toLowerCase(Locale.ROOT);
    key = ALIASES.getOrDefault(key, key);
    return profiles.getOrDefault(key, fallback);
  }

  private static Map<String, LanguageProfile> buildTable() {
    Map<String, LanguageProfile> table = new LinkedHashMap<>();
    table.put("js", LanguageProfile.of("js", C_FAMILY_BRANCHES, JS_FUNCTIONS, JS_DECLARATION));
    table.put("ts", LanguageProfile.of("ts", C_FAMILY_BRANCHES, JS_FUNCTIONS, JS_DECLARATION));
    table.put(
        "java", LanguageProfile.of("java", C_FAMILY_BRANCHES, JAVA_DECLARATION, JAVA_DECLARATION));
    table.put(
        "py",
        LanguageProfile.of(
            "py",
            List.of("if", "elif", "for", "while", "except", "and", "or"),
            "\\bdef\\s+\\w+\\s*\\(",
            "\\bdef\\s+(\\w+)"));
    table.put(
        "go",
        LanguageProfile.of(
            "go",
            List.of("if", "else if", "for", "case", "&&", "||"),
            "\\bfunc\\s+(?:\\([^)\\n]*\\)\\s*)?\\w+\\s*\\(",
            "\\bfunc\\s+(?:\\([^)\\n]*\\)\\s*)?(\\w+)\\s*\\("));
    table.put(
        "rs",
        LanguageProfile.of(
            "rs",
            List.of("if", "else if", "for", "while", "match", "&&", "||"),
            "\\bfn\\s+\\w+\\s*\\(",
            "\\bfn\\s+(\\w+)"));
    return Map.copyOf(table);
  }
}
