package com.aiadvent.techdebt.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Function extents found by brace balance: a span opens on a declaration line and closes on the
 * first later line where the per-line balance returns to zero. Nested declarations are not
 * tracked separately.
 */
public final class FunctionSpans {

  private FunctionSpans() {}

  /** {@code startLine} is 1-based; {@code length} is the distance to the closing line. */
  public record Span(String name, int startLine, int length) {}

  public static List<Span> find(List<String> lines, LanguageProfile profile) {
    List<Span> spans = new ArrayList<>();
    boolean inFunction = false;
    int start = 0;
    int balance = 0;
    String name = null;
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (!inFunction) {
        String declared = profile.declaredFunction(line);
        if (declared != null) {
          inFunction = true;
          start = i;
          name = declared;
          balance = 0;
        }
      }
      if (inFunction) {
        if (line.indexOf('{') >= 0) {
          balance++;
        }
        if (line.indexOf('}') >= 0) {
          balance--;
        }
        if (balance == 0 && i > start) {
          spans.add(new Span(name, start + 1, i - start));
          inFunction = false;
        }
      }
    }
    return spans;
  }
}
