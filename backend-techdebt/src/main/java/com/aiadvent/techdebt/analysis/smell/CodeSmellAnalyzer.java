package com.aiadvent.techdebt.analysis.smell;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.config.TechDebtProperties;
import com.aiadvent.techdebt.model.Finding;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs the maintainability and reliability rules in a fixed order, so findings of one file always
 * come out in the same sequence.
 */
@Component
public class CodeSmellAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(CodeSmellAnalyzer.class);

  private final List<FindingRule> rules;

  @Autowired
  public CodeSmellAnalyzer(TechDebtProperties properties) {
    this(defaultRules(Objects.requireNonNull(properties, "properties")));
  }

  CodeSmellAnalyzer(List<FindingRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static List<FindingRule> defaultRules(TechDebtProperties properties) {
    return List.of(
        new LongMethodRule(),
        new OversizedFileRule(),
        new MagicNumberRule(),
        new DeepNestingRule(),
        new CommentedCodeRule(),
        new DuplicationRule(
            properties.getDuplicateMinLength(), properties.getDuplicateRatioThreshold()),
        new MissingErrorHandlingRule());
  }

  public List<FindingRule> rules() {
    return rules;
  }

  public List<Finding> analyze(RuleContext context) {
    Objects.requireNonNull(context, "context");
    if (context.lines().isEmpty()) {
      return List.of();
    }
    List<Finding> findings = new ArrayList<>();
    for (FindingRule rule : rules) {
      try {
        findings.addAll(rule.detect(context));
      } catch (RuntimeException ex) {
        log.warn(
            "techdebt.smell.rule_failed rule={} path={} message={}",
            rule.kind(),
            context.path(),
            ex.getMessage(),
            ex);
      }
    }
    return findings;
  }
}
