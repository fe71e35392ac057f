package com.aiadvent.techdebt.scan;

import com.aiadvent.techdebt.analysis.ComplexityAnalyzer;
import com.aiadvent.techdebt.analysis.LanguageProfile;
import com.aiadvent.techdebt.analysis.LanguageProfiles;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.analysis.TextMetricsExtractor;
import com.aiadvent.techdebt.analysis.security.SecurityScanner;
import com.aiadvent.techdebt.analysis.smell.CodeSmellAnalyzer;
import com.aiadvent.techdebt.authorship.AuthorshipClassifier;
import com.aiadvent.techdebt.authorship.AuthorshipModels.AuthorshipAnalysis;
import com.aiadvent.techdebt.config.TechDebtProperties;
import com.aiadvent.techdebt.model.FileReport;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.SourceUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Runs every per-file analyzer over one source unit. Safe to call from several threads. */
@Component
public class FileAnalyzer {

  private final LanguageProfiles languageProfiles;
  private final TextMetricsExtractor textMetricsExtractor;
  private final ComplexityAnalyzer complexityAnalyzer;
  private final CodeSmellAnalyzer codeSmellAnalyzer;
  private final SecurityScanner securityScanner;
  private final AuthorshipClassifier authorshipClassifier;
  private final boolean authorshipEnabled;

  public FileAnalyzer(
      LanguageProfiles languageProfiles,
      TextMetricsExtractor textMetricsExtractor,
      ComplexityAnalyzer complexityAnalyzer,
      CodeSmellAnalyzer codeSmellAnalyzer,
      SecurityScanner securityScanner,
      AuthorshipClassifier authorshipClassifier,
      TechDebtProperties properties) {
    this.languageProfiles = Objects.requireNonNull(languageProfiles, "languageProfiles");
    this.textMetricsExtractor =
        Objects.requireNonNull(textMetricsExtractor, "textMetricsExtractor");
    this.complexityAnalyzer = Objects.requireNonNull(complexityAnalyzer, "complexityAnalyzer");
    this.codeSmellAnalyzer = Objects.requireNonNull(codeSmellAnalyzer, "codeSmellAnalyzer");
    this.securityScanner = Objects.requireNonNull(securityScanner, "securityScanner");
    this.authorshipClassifier =
        Objects.requireNonNull(authorshipClassifier, "authorshipClassifier");
    this.authorshipEnabled = properties.getAuthorship().isEnabled();
  }

  public FileReport analyze(SourceUnit unit) {
    Objects.requireNonNull(unit, "unit");
    if (unit.content() == null) {
      throw new IllegalArgumentException("content of " + unit.path() + " is not readable");
    }
    LanguageProfile profile = languageProfiles.resolve(unit);
    RuleContext context = RuleContext.of(unit, profile);

    List<Finding> findings = new ArrayList<>(codeSmellAnalyzer.analyze(context));
    findings.addAll(securityScanner.scan(context));
    AuthorshipAnalysis authorship =
        authorshipEnabled ? authorshipClassifier.classify(context) : null;

    return new FileReport(
        unit.path(),
        textMetricsExtractor.extract(context.lines()),
        complexityAnalyzer.analyze(unit.content(), profile),
        findings,
        authorship);
  }
}
