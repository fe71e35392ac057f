package com.aiadvent.techdebt.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.techdebt.model.TextMetrics;
import org.junit.jupiter.api.Test;

class TextMetricsExtractorTest {

  private final TextMetricsExtractor extractor = new TextMetricsExtractor();

  @Test
  void countsLinesTokensAndKeywords() {
    TextMetrics metrics =
        extractor.extract("// header\nconst x = 1;\n\n  * doc\nif (x) { return x; }\n");

    assertThat(metrics.totalLines()).isEqualTo(6);
    assertThat(metrics.blankLines()).isEqualTo(2);
    assertThat(metrics.commentLines()).isEqualTo(2);
    assertThat(metrics.codeLines()).isEqualTo(2);
    assertThat(metrics.tokenCount()).isEqualTo(14);
    assertThat(metrics.keywordCount()).isEqualTo(3);
    assertThat(metrics.commentRatio()).isEqualTo(2.0 / 6);
  }

  @Test
  void emptyContentHasNoLines() {
    assertThat(extractor.extract("")).isEqualTo(TextMetrics.EMPTY);
    assertThat(extractor.extract((String) null)).isEqualTo(TextMetrics.EMPTY);
    assertThat(TextMetrics.EMPTY.keywordRatio()).isZero();
  }

  @Test
  void stripsCarriageReturns() {
    TextMetrics metrics = extractor.extract("let a = 1;\r\n# note\r\n");

    assertThat(metrics.totalLines()).isEqualTo(3);
    assertThat(metrics.codeLines()).isEqualTo(1);
    assertThat(metrics.commentLines()).isEqualTo(1);
  }

  @Test
  void keywordsNeedWordBoundaries() {
    TextMetrics metrics = extractor.extract("classify(iffy, format)");

    assertThat(metrics.keywordCount()).isZero();
  }

  @Test
  void blockCommentOpenerCountsAsCode() {
    TextMetrics metrics = extractor.extract("/* config */\n * continued\n */");

    assertThat(metrics.commentLines()).isEqualTo(2);
    assertThat(metrics.codeLines()).isEqualTo(1);
    assertThat(SourceLines.isCommentLine("  /** doc")).isFalse();
    assertThat(SourceLines.isCommentLine("   * doc")).isTrue();
  }
}
