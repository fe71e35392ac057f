package com.aiadvent.techdebt.analysis;

import java.util.ArrayList;
import java.util.List;

/** Line splitting shared by every analyzer so that line numbers agree across findings. */
public final class SourceLines {

  private SourceLines() {}

  public static List<String> split(String content) {
    if (content == null || content.isEmpty()) {
      return List.of();
    }
    String[] raw = content.split("\n", -1);
    List<String> lines = new ArrayList<>(raw.length);
    for (String line : raw) {
      lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
    }
    return lines;
  }

  public static boolean isCommentLine(String line) {
    String trimmed = line.trim();
    return trimmed.startsWith("//") || trimmed.startsWith("#") || trimmed.startsWith("*");
  }

  public static int count(String line, char ch) {
    int count = 0;
    for (int i = 0; i < line.length(); i++) {
      if (line.charAt(i) == ch) {
        count++;
      }
    }
    return count;
  }
}
