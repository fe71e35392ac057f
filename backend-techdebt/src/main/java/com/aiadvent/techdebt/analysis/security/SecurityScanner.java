package com.aiadvent.techdebt.analysis.security;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.model.Finding;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Runs the weakness rules in a fixed order; every finding carries its CWE identifier. */
@Component
public class SecurityScanner {

  private static final Logger log = LoggerFactory.getLogger(SecurityScanner.class);

  private final List<FindingRule> rules;

  public SecurityScanner() {
    this(defaultRules());
  }

  SecurityScanner(List<FindingRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static List<FindingRule> defaultRules() {
    return List.of(
        new HardcodedSecretRule(),
        new SqlInjectionRule(),
        new XssRule(),
        new InsecureRandomRule(),
        new EvalUsageRule(),
        new ProcessExecutionRule());
  }

  public List<FindingRule> rules() {
    return rules;
  }

  public List<Finding> scan(RuleContext context) {
    Objects.requireNonNull(context, "context");
    List<Finding> findings = new ArrayList<>();
    for (FindingRule rule : rules) {
      try {
        findings.addAll(rule.detect(context));
      } catch (RuntimeException ex) {
        log.warn(
            "techdebt.security.rule_failed rule={} path={} message={}",
            rule.kind(),
            context.path(),
            ex.getMessage(),
            ex);
      }
    }
    return findings;
  }
}
