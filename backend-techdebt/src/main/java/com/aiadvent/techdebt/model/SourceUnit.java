package com.aiadvent.techdebt.model;

import java.util.Locale;
import org.springframework.util.StringUtils;

/** One input file: repository-relative path plus its full text. */
public record SourceUnit(String path, String content) {

  public SourceUnit {
    if (!StringUtils.hasText(path)) {
      throw new IllegalArgumentException("path must not be blank");
    }
    path = normalizePath(path);
  }

  /** Lower-cased extension without the dot, or an empty string. */
  public String extension() {
    String fileName = fileName();
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  public String fileName() {
    int slash = path.lastIndexOf('/');
    return slash >= 0 ? path.substring(slash + 1) : path;
  }

  static String normalizePath(String path) {
    String trimmed = path.trim().replace('\\', '/');
    while (trimmed.startsWith("./")) {
      trimmed = trimmed.substring(2);
    }
    return trimmed;
  }
}
