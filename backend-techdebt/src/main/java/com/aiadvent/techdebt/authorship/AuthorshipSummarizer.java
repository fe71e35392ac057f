package com.aiadvent.techdebt.authorship;

import com.aiadvent.techdebt.authorship.AuthorshipModels.AICodeSummary;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipAnalysis;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipPattern;
import com.aiadvent.techdebt.authorship.AuthorshipModels.PatternCount;
import com.aiadvent.techdebt.authorship.AuthorshipModels.RiskAssessment;
import com.aiadvent.techdebt.config.TechDebtProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Rolls per-file authorship analyses up into the repository view. */
@Component
public class AuthorshipSummarizer {

  static final int HUMAN_CEILING = 30;
  static final int TOP_PATTERNS = 5;
  static final double RISK_SHARE = 0.3;

  private static final Set<String> SECURITY_RISK =
      Set.of("missing_edge_cases", "low_complexity_pattern");
  private static final Set<String> MAINTENANCE_RISK =
      Set.of("generic_naming", "repetitive_structures");
  private static final Set<String> QUALITY_RISK = Set.of("boilerplate_code", "excessive_comments");

  private final int aiThreshold;

  @Autowired
  public AuthorshipSummarizer(TechDebtProperties properties) {
    this(properties.getAuthorship().getLikelihoodThreshold());
  }

  AuthorshipSummarizer(int aiThreshold) {
    this.aiThreshold = aiThreshold;
  }

  public AICodeSummary summarize(List<AuthorshipAnalysis> analyses) {
    List<AuthorshipAnalysis> items = analyses != null ? analyses : List.of();
    int totalFiles = items.size();
    int aiFiles = 0;
    int humanFiles = 0;
    int mixedFiles = 0;
    long likelihoodSum = 0;
    long confidenceSum = 0;
    int patternTotal = 0;
    Map<String, Integer> patternCounts = new LinkedHashMap<>();

    for (AuthorshipAnalysis analysis : items) {
      likelihoodSum += analysis.aiLikelihood();
      if (analysis.aiLikelihood() > aiThreshold) {
        aiFiles++;
      } else if (analysis.aiLikelihood() < HUMAN_CEILING) {
        humanFiles++;
      } else {
        mixedFiles++;
      }
      for (AuthorshipPattern pattern : analysis.patterns()) {
        patternCounts.merge(pattern.type(), 1, Integer::sum);
        confidenceSum += pattern.confidence();
        patternTotal++;
      }
    }

    double aiPercentage = totalFiles > 0 ? (double) likelihoodSum / totalFiles : 0.0;
    double confidence = (double) confidenceSum / Math.max(1, patternTotal);

    // stable sort keeps first-seen order among equal counts
    List<PatternCount> topPatterns =
        patternCounts.entrySet().stream()
            .map(entry -> new PatternCount(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparingInt(PatternCount::count).reversed())
            .limit(TOP_PATTERNS)
            .toList();

    RiskAssessment risks =
        new RiskAssessment(
            countFilesWith(items, SECURITY_RISK),
            countFilesWith(items, MAINTENANCE_RISK),
            countFilesWith(items, QUALITY_RISK));

    return new AICodeSummary(
        totalFiles,
        aiFiles,
        humanFiles,
        mixedFiles,
        (int) Math.round(aiPercentage),
        (int) Math.round(confidence),
        topPatterns,
        risks,
        recommendations(aiPercentage, aiFiles, totalFiles, risks));
  }

  private static List<String> recommendations(
      double aiPercentage, int aiFiles, int totalFiles, RiskAssessment risks) {
    List<String> out = new ArrayList<>();
    double riskFloor = totalFiles * RISK_SHARE;
    if (aiPercentage > 50) {
      out.add(
          "High AI-generated code detected (>50%). Conduct thorough code review focusing on"
              + " edge cases and security.");
    }
    if (risks.securityRisks() > riskFloor) {
      out.add(
          "Implement comprehensive error handling and input validation in AI-generated"
              + " sections.");
    }
    if (risks.maintenanceRisks() > riskFloor) {
      out.add(
          "Refactor generic variable names and repetitive structures for better maintainability.");
    }
    if (risks.qualityRisks() > riskFloor) {
      out.add("Review and improve comment quality; remove generic boilerplate comments.");
    }
    if (aiFiles > 0) {
      out.add("Establish code review guidelines specifically for AI-generated code.");
      out.add("Add comprehensive test coverage for AI-generated functions.");
    }
    if (out.isEmpty()) {
      out.add("Code quality looks good! Continue maintaining high standards.");
    }
    return out;
  }

  private static int countFilesWith(List<AuthorshipAnalysis> analyses, Set<String> types) {
    return (int)
        analyses.stream()
            .filter(a -> a.patterns().stream().anyMatch(p -> types.contains(p.type())))
            .count();
  }
}
