package com.aiadvent.techdebt.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exact-text duplicate detection over sliding windows of consecutive non-blank trimmed lines.
 * Used by the duplication smell and by the authorship repetition signal.
 */
public final class DuplicateWindows {

  public static final int WINDOW_SIZE = 6;

  private DuplicateWindows() {}

  /**
   * @param blocks distinct windows seen more than once
   * @param duplicatedWindows window positions whose text occurs elsewhere too
   * @param totalWindows window positions considered
   */
  public record Result(int blocks, int duplicatedWindows, int totalWindows) {

    public static final Result NONE = new Result(0, 0, 0);

    public double ratio() {
      return totalWindows > 0 ? (double) duplicatedWindows / totalWindows : 0.0;
    }
  }

  public static Result scan(List<String> lines, int minLength) {
    List<String> nonBlank = new ArrayList<>();
    for (String line : lines) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        nonBlank.add(trimmed);
      }
    }
    if (nonBlank.size() < WINDOW_SIZE) {
      return Result.NONE;
    }
    Map<String, Integer> occurrences = new LinkedHashMap<>();
    int total = 0;
    for (int i = 0; i + WINDOW_SIZE <= nonBlank.size(); i++) {
      String window = String.join("\n", nonBlank.subList(i, i + WINDOW_SIZE));
      if (window.length() >= minLength) {
        occurrences.merge(window, 1, Integer::sum);
        total++;
      }
    }
    int blocks = 0;
    int duplicated = 0;
    for (int count : occurrences.values()) {
      if (count > 1) {
        blocks++;
        duplicated += count;
      }
    }
    return new Result(blocks, duplicated, total);
  }
}
