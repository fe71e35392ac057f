package com.aiadvent.techdebt.authorship;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

public final class AuthorshipModels {

  private AuthorshipModels() {}

  public enum PatternSeverity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record AuthorshipPattern(
      String type,
      String description,
      PatternSeverity severity,
      int confidence,
      Integer line,
      String snippet) {

    public static AuthorshipPattern of(
        String type, String description, PatternSeverity severity, int confidence) {
      return new AuthorshipPattern(type, description, severity, confidence, null, null);
    }
  }

  public record StaticCodeMetrics(
      int sumCyclomatic,
      double avgCountLineCode,
      int countLineCodeDecl,
      int countDeclFunction,
      int maxNesting,
      int countLineBlank,
      double keywordRatio,
      double operatorRatio) {}

  /** Informational 0-100 scores; none of them feeds the likelihood. */
  public record AuthorshipIndicators(
      int styleConsistency,
      int commentQuality,
      int namingPatterns,
      int codeStructure,
      int errorHandling) {}

  public record LineMetadata(int totalLines, int codeLines, int commentLines, int blankLines) {}

  public record AuthorshipAnalysis(
      String file,
      int aiLikelihood,
      int humanLikelihood,
      List<AuthorshipPattern> patterns,
      StaticCodeMetrics staticMetrics,
      AuthorshipIndicators indicators,
      LineMetadata metadata) {

    public AuthorshipAnalysis {
      patterns = patterns != null ? List.copyOf(patterns) : List.of();
    }

    @JsonIgnore
    public boolean hasPattern(String type) {
      return patterns.stream().anyMatch(pattern -> pattern.type().equals(type));
    }
  }

  public record PatternCount(String pattern, int count) {}

  public record RiskAssessment(int securityRisks, int maintenanceRisks, int qualityRisks) {}

  public record AICodeSummary(
      int totalFiles,
      int aiGeneratedFiles,
      int humanWrittenFiles,
      int mixedFiles,
      int aiCodePercentage,
      int confidenceScore,
      @JsonProperty("topAIPatterns") List<PatternCount> topPatterns,
      RiskAssessment riskAssessment,
      List<String> recommendations) {

    public AICodeSummary {
      topPatterns = topPatterns != null ? List.copyOf(topPatterns) : List.of();
      recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
  }
}
