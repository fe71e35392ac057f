package com.aiadvent.techdebt.authorship;

import static com.aiadvent.techdebt.TechDebtFixtures.context;
import static com.aiadvent.techdebt.TechDebtFixtures.lines;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.aiadvent.techdebt.analysis.TextMetricsExtractor;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipAnalysis;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipPattern;
import com.aiadvent.techdebt.authorship.AuthorshipModels.PatternSeverity;
import java.util.List;
import org.junit.jupiter.api.Test;

class AuthorshipClassifierTest {

  private final AuthorshipClassifier classifier =
      new AuthorshipClassifier(new TextMetricsExtractor(), 50);

  @Test
  void templateCommentsAreAMachineSignal() {
    String content =
        String.join(
            "\n",
            "// This function loads the list.",
            "function loadList() {",
            "  return fetchList();",
            "}",
            "// This function saves the list.",
            "function saveList(list) {",
            "  return storeList(list);",
            "}",
            "// This function clears the list.",
            "function clearList() {",
            "  return storeList([]);",
            "}",
            "// This function counts the list.",
            "function countList(list) {",
            "  return list.length;",
            "}");

    AuthorshipAnalysis analysis = classifier.classify(context("src/list.js", content));

    assertThat(analysis.patterns())
        .filteredOn(pattern -> pattern.type().equals("generic_comments"))
        .singleElement()
        .satisfies(pattern -> {
          assertThat(pattern.description()).isEqualTo("4 generic template-style comments");
          assertThat(pattern.confidence()).isEqualTo(88);
          assertThat(pattern.severity()).isEqualTo(PatternSeverity.HIGH);
        });
    assertThat(analysis.aiLikelihood() + analysis.humanLikelihood()).isEqualTo(100);
    assertThat(analysis.aiLikelihood()).isGreaterThan(50);
  }

  @Test
  void toolSignaturesAreReportedPerTool() {
    AuthorshipAnalysis analysis =
        classifier.classify(context("gen.js", "// Generated by ChatGPT\nconst a = 1;"));

    assertThat(analysis.patterns())
        .extracting(AuthorshipPattern::type)
        .containsExactly("excessive_comments", "ai_signature", "ai_signature");
    assertThat(analysis.aiLikelihood()).isEqualTo(100);
    assertThat(analysis.humanLikelihood()).isZero();
  }

  @Test
  void toolSignaturesPointAtTheLineThatCarriesThem() {
    AuthorshipAnalysis analysis =
        classifier.classify(context("gen.js", "const a = 1;\n  // Generated by ChatGPT  "));

    assertThat(analysis.patterns())
        .filteredOn(pattern -> pattern.type().equals("ai_signature"))
        .extracting(AuthorshipPattern::line, AuthorshipPattern::snippet)
        .containsExactly(
            tuple(2, "// Generated by ChatGPT"), tuple(2, "// Generated by ChatGPT"));
    assertThat(analysis.patterns())
        .filteredOn(pattern -> pattern.type().equals("excessive_comments"))
        .singleElement()
        .satisfies(pattern -> assertThat(pattern.line()).isNull());
  }

  @Test
  void humanNotesPullTheLikelihoodDown() {
    AuthorshipAnalysis analysis =
        classifier.classify(context("fix.js", "// FIXME: cleanup later\nlet x = 2;"));

    // 25 machine points against 25 human points weighted by 0.7
    assertThat(analysis.aiLikelihood()).isEqualTo(59);
    assertThat(analysis.humanLikelihood()).isEqualTo(41);
    assertThat(analysis.patterns())
        .extracting(AuthorshipPattern::type)
        .containsExactly("excessive_comments");
  }

  @Test
  void emptyFileIsUninformed() {
    AuthorshipAnalysis analysis = classifier.classify(context("empty.js", ""));

    assertThat(analysis.aiLikelihood()).isEqualTo(AuthorshipClassifier.UNINFORMED_LIKELIHOOD);
    assertThat(analysis.patterns()).isEmpty();
    assertThat(analysis.metadata().totalLines()).isZero();
    assertThat(analysis.indicators().commentQuality()).isEqualTo(50);
    assertThat(analysis.indicators().errorHandling()).isZero();
  }

  @Test
  void uniformFourSpaceIndentationIsFlagged() {
    String content = lines(11, i -> i % 2 == 0 ? "    call();" : "call();");

    AuthorshipAnalysis analysis = classifier.classify(context("indent.js", content));

    assertThat(analysis.patterns())
        .extracting(AuthorshipPattern::type)
        .containsExactly("perfect_indentation");
    assertThat(analysis.indicators().styleConsistency()).isEqualTo(90);
    assertThat(analysis.hasPattern("perfect_indentation")).isTrue();
  }

  @Test
  void likelihoodWeighsHumanPointsLess() {
    assertThat(AuthorshipClassifier.likelihood(0, 0)).isEqualTo(50);
    assertThat(AuthorshipClassifier.likelihood(30, 0)).isEqualTo(100);
    assertThat(AuthorshipClassifier.likelihood(0, 20)).isZero();
    assertThat(AuthorshipClassifier.likelihood(45, 40)).isEqualTo(62);
  }

  @Test
  void indicatorsScoreStructureAndErrorHandling() {
    String guarded =
        "try {\n  if (err) {\n    throw new ValidationError('bad');\n  }\n} catch (e) {}";

    assertThat(AuthorshipClassifier.errorHandlingQuality(guarded)).isEqualTo(100);
    assertThat(AuthorshipClassifier.structureQuality("class Cart {}\nexport default Cart;"))
        .isEqualTo(80);
    assertThat(AuthorshipClassifier.indentation(List.of(" odd", "  even")).consistency())
        .isEqualTo(60);
    assertThat(AuthorshipClassifier.namingQuality("const orderTotal = 1;\nconst x = 2;"))
        .isEqualTo(50.0);
  }
}
