package com.aiadvent.techdebt.scoring;

import com.aiadvent.techdebt.model.ComplexityMetrics;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.ScanResult.FileMetric;
import com.aiadvent.techdebt.model.ScanResult.QuickWin;
import com.aiadvent.techdebt.model.ScanResult.Trends;
import com.aiadvent.techdebt.model.ScanResult.WorstFile;
import com.aiadvent.techdebt.model.Severity;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Ranks files and issues for remediation. All orderings are stable sorts over the input order,
 * so ties never depend on scheduling.
 */
@Component
public class RemediationPlanner {

  static final int WORST_FILES = 10;
  static final int QUICK_WINS = 10;
  static final int CRITICAL_PATH = 5;
  static final int QUICK_WIN_EFFORT = 30;

  public Trends plan(List<FileMetric> files, List<Finding> findings) {
    return new Trends(worstFiles(files), quickWins(findings), criticalPath(files));
  }

  public List<WorstFile> worstFiles(List<FileMetric> files) {
    return files.stream()
        .map(file -> new WorstFile(file.file(), fileScore(file), reason(file)))
        .sorted(Comparator.comparingDouble(WorstFile::score))
        .limit(WORST_FILES)
        .toList();
  }

  public List<QuickWin> quickWins(List<Finding> findings) {
    return findings.stream()
        .filter(f -> f.effortMinutes() < QUICK_WIN_EFFORT)
        .filter(f -> f.severity() == Severity.CRITICAL || f.severity() == Severity.MAJOR)
        .map(f -> new QuickWin(f.file(), f.effortMinutes(), f.businessImpact()))
        .limit(QUICK_WINS)
        .toList();
  }

  public List<String> criticalPath(List<FileMetric> files) {
    return files.stream()
        .filter(file -> file.issues() > 0)
        .sorted(Comparator.comparingInt(FileMetric::debtMinutes).reversed())
        .limit(CRITICAL_PATH)
        .map(FileMetric::file)
        .toList();
  }

  /** 0-100, higher is healthier. */
  static double fileScore(FileMetric file) {
    ComplexityMetrics complexity = file.complexity();
    double score = 100;
    score -= Math.min(complexity.cyclomatic() / 10.0, 30);
    score -= Math.min(complexity.cognitive() / 10.0, 20);
    score -= Math.min(file.issues() * 2, 30);
    if (file.lines() > 500) {
      score -= 10;
    }
    if (file.lines() > 1000) {
      score -= 10;
    }
    return Math.max(0, score);
  }

  static String reason(FileMetric file) {
    if (file.issues() > 5) {
      return "High issue count";
    }
    if (file.complexity().cyclomatic() > 50) {
      return "High complexity";
    }
    if (file.lines() > 1000) {
      return "Large file size";
    }
    return "Multiple factors";
  }
}
