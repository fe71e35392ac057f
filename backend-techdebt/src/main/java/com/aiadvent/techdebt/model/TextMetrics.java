package com.aiadvent.techdebt.model;

/** Raw line and token counts of one file. */
public record TextMetrics(
    int totalLines,
    int codeLines,
    int commentLines,
    int blankLines,
    int tokenCount,
    int keywordCount) {

  public static final TextMetrics EMPTY = new TextMetrics(0, 0, 0, 0, 0, 0);

  public int nonBlankLines() {
    return totalLines - blankLines;
  }

  public double commentRatio() {
    return totalLines > 0 ? (double) commentLines / totalLines : 0.0;
  }

  public double keywordRatio() {
    return tokenCount > 0 ? (double) keywordCount / tokenCount : 0.0;
  }
}
