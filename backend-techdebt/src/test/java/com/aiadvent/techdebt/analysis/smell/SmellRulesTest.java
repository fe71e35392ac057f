package com.aiadvent.techdebt.analysis.smell;

import static com.aiadvent.techdebt.TechDebtFixtures.context;
import static com.aiadvent.techdebt.TechDebtFixtures.lines;
import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingCategory;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;
import java.util.function.IntFunction;
import org.junit.jupiter.api.Test;

class SmellRulesTest {

  @Test
  void longMethodReportsTheDeclarationLine() {
    String content = "// helpers\nfunction big() {\n" + lines(59, i -> "  step();") + "\n}\n";

    List<Finding> findings = new LongMethodRule().detect(context("src/big.js", content));

    assertThat(findings).singleElement().satisfies(finding -> {
      assertThat(finding.severity()).isEqualTo(Severity.MAJOR);
      assertThat(finding.line()).isEqualTo(2);
      assertThat(finding.effortMinutes()).isEqualTo(90);
      assertThat(finding.message())
          .isEqualTo("Function 'big' is 60 lines long (recommended: < 50 lines)");
    });
  }

  @Test
  void shortFunctionsAreFine() {
    String content = "function small() {\n" + lines(49, i -> "  step();") + "\n}";

    assertThat(new LongMethodRule().detect(context("small.js", content))).isEmpty();
  }

  @Test
  void oversizedFileEscalatesPastAThousandLines() {
    String critical = lines(501, i -> "let v" + i + " = compute();");
    String blocker = lines(1001, i -> "let v" + i + " = compute();\n");

    Finding first = new OversizedFileRule().detect(context("a.js", critical)).get(0);
    Finding second = new OversizedFileRule().detect(context("b.js", blocker)).get(0);

    assertThat(first.severity()).isEqualTo(Severity.CRITICAL);
    assertThat(first.line()).isNull();
    assertThat(first.effortMinutes()).isEqualTo(360);
    assertThat(second.severity()).isEqualTo(Severity.BLOCKER);
    assertThat(second.effortMinutes()).isEqualTo(660);
    assertThat(new OversizedFileRule().detect(context("c.js", lines(500, i -> "x();"))))
        .isEmpty();
  }

  @Test
  void magicNumbersSkipAssignmentsConstantsAndComments() {
    String content =
        String.join(
            "\n",
            "if (retries > 3) {",
            "const timeout = 5000;",
            "const MAX_RETRIES = 3;",
            "private static final int LIMIT = 64;",
            "x = arr[42] // lookup",
            "# 99 bottles",
            "let a = 1;",
            "const version = v1.2;",
            "limit(25);");

    List<Finding> findings = new MagicNumberRule().detect(context("m.js", content));

    assertThat(findings).extracting(Finding::line).containsExactly(1, 9);
    assertThat(findings).allSatisfy(f -> assertThat(f.effortMinutes()).isEqualTo(5));
  }

  @Test
  void magicNumbersAreCappedPerFile() {
    List<Finding> findings =
        new MagicNumberRule().detect(context("m.js", lines(15, i -> "call(42);")));

    assertThat(findings).hasSize(MagicNumberRule.MAX_FINDINGS);
  }

  @Test
  void deepNestingReportsThePeak() {
    String content =
        String.join(
            "\n",
            "function a() {",
            "  if (x) {",
            "    if (y) {",
            "      for (;;) {",
            "        while (z) {",
            "          run();",
            "        }",
            "      }",
            "    }",
            "  }",
            "}");

    List<Finding> findings = new DeepNestingRule().detect(context("n.js", content));

    assertThat(findings).singleElement().satisfies(finding -> {
      assertThat(finding.severity()).isEqualTo(Severity.MINOR);
      assertThat(finding.line()).isEqualTo(5);
      assertThat(finding.effortMinutes()).isEqualTo(50);
    });
  }

  @Test
  void sevenLevelsAreMajor() {
    String content = "{{{{{{{\n}}}}}}}";

    Finding finding = new DeepNestingRule().detect(context("n.js", content)).get(0);

    assertThat(finding.severity()).isEqualTo(Severity.MAJOR);
    assertThat(finding.line()).isEqualTo(1);
  }

  @Test
  void commentedCodeNeedsMoreThanTenLines() {
    CommentedCodeRule rule = new CommentedCodeRule();

    assertThat(rule.detect(context("c.js", lines(10, i -> "// total = sum(" + i + ");"))))
        .isEmpty();
    assertThat(rule.detect(context("c.py", lines(11, i -> "# result = call(" + i + ")"))))
        .singleElement()
        .satisfies(finding -> {
          assertThat(finding.severity()).isEqualTo(Severity.MINOR);
          assertThat(finding.effortMinutes()).isEqualTo(22);
        });
  }

  @Test
  void proseCommentsAreNotCode() {
    assertThat(
            new CommentedCodeRule()
                .detect(context("c.js", lines(20, i -> "// explains step " + i))))
        .isEmpty();
  }

  @Test
  void asyncCallsWithoutHandlersAreReported() {
    MissingErrorHandlingRule rule = new MissingErrorHandlingRule();

    assertThat(rule.detect(context("f.js", "const entry = await fetch(url);")))
        .singleElement()
        .satisfies(finding -> {
          assertThat(finding.severity()).isEqualTo(Severity.MAJOR);
          assertThat(finding.effortMinutes()).isEqualTo(20);
          assertThat(finding.isSecurity()).isFalse();
          assertThat(finding.category()).isEqualTo(FindingCategory.MAINTAINABILITY);
        });
    assertThat(rule.detect(context("g.js", "try {\n  await fetch(url);\n} catch (e) {}")))
        .isEmpty();
    assertThat(rule.detect(context("h.js", "fetch(url).catch(report);"))).isEmpty();
    assertThat(rule.detect(context("i.js", "const total = a + b;"))).isEmpty();
  }

  @Test
  void duplicationSeverityDependsOnTheBlockCountOnly() {
    String five = repeatedBlocks(5);
    String six = repeatedBlocks(6);

    Finding minor = new DuplicationRule(50, 0.0).detect(context("d.js", five)).get(0);
    Finding major = new DuplicationRule(50, 1.0).detect(context("d.js", six)).get(0);

    assertThat(minor.severity()).isEqualTo(Severity.MINOR);
    assertThat(minor.effortMinutes()).isEqualTo(150);
    assertThat(major.severity()).isEqualTo(Severity.MAJOR);
    assertThat(major.effortMinutes()).isEqualTo(180);
  }

  @Test
  void duplicatedShareOnlyAnnotatesTheMessage() {
    String twice = repeatedBlocks(1);

    Finding annotated = new DuplicationRule(50, 0.1).detect(context("d.js", twice)).get(0);
    Finding plain = new DuplicationRule(50, 0.5).detect(context("d.js", twice)).get(0);

    assertThat(annotated.severity()).isEqualTo(Severity.MINOR);
    assertThat(annotated.message()).endsWith("Duplicated windows cover 29% of the file.");
    assertThat(plain.severity()).isEqualTo(Severity.MINOR);
    assertThat(plain.message())
        .isEqualTo("1 duplicate code blocks detected. Consider extracting common functionality.");
    assertThat(new DuplicationRule(50, 0.25).detect(context("d.js", BLOCK.apply(0)))).isEmpty();
  }

  private static final IntFunction<String> BLOCK =
      b ->
          String.join(
              "\n",
              "const total" + b + " = items.length;",
              "let sum" + b + " = 0;",
              "for (const item of items) {",
              "  sum" + b + " += item.price;",
              "}",
              "console.log(sum" + b + " / total" + b + ");");

  /** Each block written twice in a row, so every block is one duplicated window. */
  private static String repeatedBlocks(int count) {
    return lines(count, b -> BLOCK.apply(b) + "\n" + BLOCK.apply(b));
  }
}
