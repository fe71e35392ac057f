package com.aiadvent.techdebt.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.techdebt.model.ComplexityMetrics;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.ScanResult.FileMetric;
import com.aiadvent.techdebt.model.ScanResult.QuickWin;
import com.aiadvent.techdebt.model.ScanResult.WorstFile;
import com.aiadvent.techdebt.model.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class RemediationPlannerTest {

  private final RemediationPlanner planner = new RemediationPlanner();

  @Test
  void largerFileRanksWorseWhenEverythingElseIsEqual() {
    ComplexityMetrics complexity = new ComplexityMetrics(20, 10, 4);
    FileMetric medium = new FileMetric("src/medium.js", 600, complexity, 3, 45);
    FileMetric huge = new FileMetric("src/huge.js", 1200, complexity, 3, 45);

    List<WorstFile> worst = planner.worstFiles(List.of(medium, huge));

    assertThat(worst).extracting(WorstFile::file).containsExactly("src/huge.js", "src/medium.js");
    assertThat(worst.get(0).score()).isEqualTo(71.0);
    assertThat(worst.get(0).reason()).isEqualTo("Large file size");
    assertThat(worst.get(1).score()).isEqualTo(81.0);
  }

  @Test
  void scoreNeverDropsBelowZero() {
    FileMetric awful =
        new FileMetric("src/awful.js", 5000, new ComplexityMetrics(900, 900, 1), 40, 900);

    assertThat(RemediationPlanner.fileScore(awful)).isEqualTo(0.0);
    assertThat(RemediationPlanner.reason(awful)).isEqualTo("High issue count");
  }

  @Test
  void worstFilesKeepInputOrderForTies() {
    List<FileMetric> files =
        IntStream.range(0, 12)
            .mapToObj(i -> new FileMetric("f" + i + ".js", 10, ComplexityMetrics.TRIVIAL, 0, 0))
            .toList();

    assertThat(planner.worstFiles(files))
        .hasSize(RemediationPlanner.WORST_FILES)
        .extracting(WorstFile::file)
        .startsWith("f0.js", "f1.js", "f2.js");
  }

  @Test
  void quickWinsAreCheapCriticalOrMajorFindings() {
    List<Finding> findings = new ArrayList<>();
    findings.add(Finding.of(FindingKind.GOD_CLASS, Severity.CRITICAL, "a.js", null, "big", 360));
    findings.add(Finding.of(FindingKind.MAGIC_NUMBER, Severity.MINOR, "a.js", 3, "magic", 5));
    findings.add(Finding.of(FindingKind.SQL_INJECTION, Severity.BLOCKER, "b.js", 4, "sql", 29));
    findings.add(
        Finding.of(FindingKind.MISSING_ERROR_HANDLING, Severity.MAJOR, "c.js", null, "async", 20));
    for (int i = 0; i < 12; i++) {
      findings.add(Finding.of(FindingKind.EVAL_USAGE, Severity.CRITICAL, "d.js", i, "eval", 20));
    }

    List<QuickWin> wins = planner.quickWins(findings);

    assertThat(wins).hasSize(RemediationPlanner.QUICK_WINS);
    assertThat(wins.get(0))
        .isEqualTo(new QuickWin("c.js", 20, Severity.MAJOR.businessImpact()));
    assertThat(wins.subList(1, 10)).extracting(QuickWin::file).containsOnly("d.js");
  }

  @Test
  void criticalPathSkipsCleanFilesAndOrdersByDebt() {
    List<FileMetric> files =
        List.of(
            metric("clean.js", 0, 0),
            metric("a.js", 2, 40),
            metric("b.js", 1, 90),
            metric("c.js", 1, 40),
            metric("d.js", 3, 10),
            metric("e.js", 1, 5),
            metric("f.js", 1, 60));

    assertThat(planner.criticalPath(files)).containsExactly("b.js", "f.js", "a.js", "c.js", "d.js");
  }

  private static FileMetric metric(String file, int issues, int debt) {
    return new FileMetric(file, 100, ComplexityMetrics.TRIVIAL, issues, debt);
  }
}
