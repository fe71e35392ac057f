package com.aiadvent.techdebt.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Matches repository-relative paths against {@code .gitignore}-style globs. Later rules win, a
 * leading {@code !} re-includes, a trailing {@code /} matches everything below a directory and a
 * pattern without a slash matches at any depth.
 */
public final class IgnoreGlobMatcher {

  private static final IgnoreGlobMatcher EMPTY = new IgnoreGlobMatcher(List.of());

  private final List<Rule> rules;

  private IgnoreGlobMatcher(List<Rule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static IgnoreGlobMatcher of(List<String> globs) {
    if (globs == null || globs.isEmpty()) {
      return EMPTY;
    }
    List<Rule> rules = new ArrayList<>();
    for (String glob : globs) {
      Rule rule = parse(glob);
      if (rule != null) {
        rules.add(rule);
      }
    }
    return new IgnoreGlobMatcher(rules);
  }

  public boolean isIgnored(String relativePath) {
    if (!StringUtils.hasText(relativePath)) {
      return false;
    }
    String path = relativePath.trim().replace('\\', '/');
    while (path.startsWith("./")) {
      path = path.substring(2);
    }
    boolean ignored = false;
    for (Rule rule : rules) {
      if (rule.pattern().matcher(path).matches()) {
        ignored = !rule.negate();
      }
    }
    return ignored;
  }

  int size() {
    return rules.size();
  }

  private static Rule parse(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty() || trimmed.startsWith("#")) {
      return null;
    }
    boolean negate = trimmed.startsWith("!");
    if (negate) {
      trimmed = trimmed.substring(1).trim();
    }
    trimmed = trimmed.replace('\\', '/');
    boolean directoryPattern = trimmed.endsWith("/");
    if (directoryPattern) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    if (trimmed.startsWith("/")) {
      trimmed = trimmed.substring(1);
    }
    if (!StringUtils.hasText(trimmed)) {
      return null;
    }
    String glob = trimmed;
    if (directoryPattern) {
      glob = glob + "/**";
    }
    if (!glob.startsWith("**/") && !trimmed.contains("/")) {
      glob = "**/" + glob;
    }
    return new Rule(Pattern.compile(globToRegex(glob)), negate);
  }

  static String globToRegex(String glob) {
    StringBuilder regex = new StringBuilder("^");
    for (int i = 0; i < glob.length(); i++) {
      char ch = glob.charAt(i);
      switch (ch) {
        case '*':
          if ((i + 1) < glob.length() && glob.charAt(i + 1) == '*') {
            boolean slashAfter = (i + 2) < glob.length() && glob.charAt(i + 2) == '/';
            boolean slashBefore = i > 0 && glob.charAt(i - 1) == '/';
            if (slashAfter) {
              // "**/" also matches zero directories
              regex.append("(?:.*/)?");
              i += 2;
            } else if (slashBefore && (i + 2) == glob.length()) {
              // trailing "/**" matches the directory itself and everything below it
              regex.setLength(regex.length() - 1);
              regex.append("(?:/.*)?");
              i++;
            } else {
              regex.append(".*");
              i++;
            }
          } else {
            regex.append("[^/]*");
          }
          break;
        case '?':
          regex.append("[^/]");
          break;
        case '.':
          regex.append("\\.");
          break;
        case '/':
          regex.append("/");
          break;
        default:
          regex.append(Pattern.quote(String.valueOf(ch)));
      }
    }
    regex.append("$");
    return regex.toString();
  }

  private record Rule(Pattern pattern, boolean negate) {}
}
