package com.aiadvent.techdebt.scan;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Coverage proxy from a file inventory: test files per source file, as a percentage capped at
 * 100. No test is executed.
 */
@Component
public class TestCoverageEstimator {

  static final Set<String> SOURCE_EXTENSIONS =
      Set.of("js", "ts", "jsx", "tsx", "py", "java", "go", "rs");

  private static final Pattern TEST_FILE_NAME =
      Pattern.compile("(?:^|/)[^/]+\\.(?:spec|test)\\.(?:js|ts|jsx|tsx|py)$");

  public double estimate(Collection<String> paths) {
    if (paths == null || paths.isEmpty()) {
      return 0.0;
    }
    int tests = 0;
    int sources = 0;
    for (String raw : paths) {
      if (raw == null) {
        continue;
      }
      String path = raw.replace('\\', '/');
      boolean test = isTestPath(path);
      if (test) {
        tests++;
      } else if (SOURCE_EXTENSIONS.contains(extension(path))) {
        sources++;
      }
    }
    if (sources == 0) {
      return 0.0;
    }
    return Math.min(100.0, (double) tests / sources * 100);
  }

  static boolean isTestPath(String path) {
    String normalized = "/" + path;
    return normalized.contains("/test/")
        || normalized.contains("/tests/")
        || normalized.contains("/__tests__/")
        || TEST_FILE_NAME.matcher(path).find();
  }

  private static String extension(String path) {
    int slash = path.lastIndexOf('/');
    int dot = path.lastIndexOf('.');
    if (dot <= slash || dot == path.length() - 1) {
      return "";
    }
    return path.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
