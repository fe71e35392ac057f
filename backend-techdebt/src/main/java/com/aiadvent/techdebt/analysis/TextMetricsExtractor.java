package com.aiadvent.techdebt.analysis;

import com.aiadvent.techdebt.model.TextMetrics;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Line and token counts. Comment detection is prefix based ({@code //}, {@code #}, {@code /*},
 * {@code *}), so a string literal line that starts with one of them is counted as a comment.
 */
@Component
public class TextMetricsExtractor {

  static final Pattern KEYWORDS =
      Pattern.compile(
          "\\b(if|else|while|for|switch|case|break|continue|return|function|const|let|var|class"
              + "|import|export|try|catch|finally|throw|async|await|yield|new|this|super|extends"
              + "|implements|interface|type|enum|public|private|protected|static|abstract)\\b");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public TextMetrics extract(String content) {
    return extract(SourceLines.split(content));
  }

  public TextMetrics extract(List<String> lines) {
    if (lines == null || lines.isEmpty()) {
      return TextMetrics.EMPTY;
    }
    int code = 0;
    int comments = 0;
    int blank = 0;
    int tokens = 0;
    int keywords = 0;
    for (String line : lines) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        blank++;
        continue;
      }
      if (SourceLines.isCommentLine(trimmed)) {
        comments++;
      } else {
        code++;
      }
      tokens += WHITESPACE.split(trimmed).length;
      Matcher matcher = KEYWORDS.matcher(line);
      while (matcher.find()) {
        keywords++;
      }
    }
    return new TextMetrics(lines.size(), code, comments, blank, tokens, keywords);
  }
}
