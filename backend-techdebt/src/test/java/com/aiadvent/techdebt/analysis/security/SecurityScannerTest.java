package com.aiadvent.techdebt.analysis.security;

import static com.aiadvent.techdebt.TechDebtFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingCategory;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

class SecurityScannerTest {

  private final SecurityScanner scanner = new SecurityScanner();

  @Test
  void reportsHardcodedPasswordAsBlocker() {
    List<Finding> findings =
        scanner.scan(context("db.js", "const password = \"hunter2secret\";"));

    assertThat(findings).singleElement().satisfies(finding -> {
      assertThat(finding.kind()).isEqualTo(FindingKind.HARDCODED_SECRET);
      assertThat(finding.severity()).isEqualTo(Severity.BLOCKER);
      assertThat(finding.weaknessId()).isEqualTo("CWE-798");
      assertThat(finding.category()).isEqualTo(FindingCategory.SECURITY);
      assertThat(finding.line()).isEqualTo(1);
      assertThat(finding.message())
          .isEqualTo("Hardcoded password detected. Use environment variables or secure vaults.");
    });
  }

  @Test
  void secretsReadFromTheEnvironmentAreFine() {
    assertThat(scanner.scan(context("db.js", "const password = process.env.DB_PASSWORD || '';")))
        .isEmpty();
    assertThat(scanner.scan(context("Db.java", "String apiKey = System.getenv(\"API_KEY\");")))
        .isEmpty();
  }

  @Test
  void reportsOtherCredentialShapes() {
    List<Finding> findings =
        scanner.scan(
            context(
                "settings.py",
                String.join(
                    "\n",
                    "API_KEY: 'abc123'",
                    "auth_token = \"t-1\"",
                    "fingerprint = \"abcdefghijklmnopqrstuvwxyz012345\"")));

    assertThat(findings)
        .extracting(Finding::message)
        .containsExactly(
            "Hardcoded API key detected. Use environment variables or secure vaults.",
            "Hardcoded secret/token detected. Use environment variables or secure vaults.",
            "Potential hardcoded credential detected. Use environment variables or secure vaults.");
  }

  @Test
  void reportsSqlBuiltByConcatenation() {
    String content =
        String.join(
            "\n",
            "const safe = db.query('SELECT * FROM users WHERE id = ?', [id]);",
            "const query = \"SELECT * FROM users WHERE id = \" + userId;",
            "const other = `DELETE FROM carts WHERE owner = ${owner}`;");

    List<Finding> findings = scanner.scan(context("repo.js", content));

    assertThat(findings).extracting(Finding::line).containsExactly(2, 3);
    assertThat(findings)
        .allSatisfy(finding -> {
          assertThat(finding.kind()).isEqualTo(FindingKind.SQL_INJECTION);
          assertThat(finding.effortMinutes()).isEqualTo(30);
          assertThat(finding.weaknessId()).isEqualTo("CWE-89");
        });
  }

  @Test
  void reportsDynamicMarkupOnly() {
    String content =
        String.join(
            "\n",
            "el.innerHTML = safeHtml;",
            "el.innerHTML = \"<b>\" + name + \"</b>\";",
            "document.write(`<p>${text}</p>`);");

    List<Finding> findings = scanner.scan(context("view.js", content));

    assertThat(findings).extracting(Finding::line).containsExactly(2, 3);
    assertThat(findings).extracting(Finding::weaknessId).containsOnly("CWE-79");
  }

  @Test
  void insecureRandomMattersOnlyForSensitiveValues() {
    String content =
        String.join(
            "\n",
            "const jitter = Math.random() * delay;",
            "const resetToken = Math.random().toString(36);",
            "session_key = random.choice(alphabet)");

    List<Finding> findings = scanner.scan(context("auth.js", content));

    assertThat(findings).extracting(Finding::line).containsExactly(2, 3);
    assertThat(findings).extracting(Finding::severity).containsOnly(Severity.CRITICAL);
  }

  @Test
  void reportsDynamicCodeEvaluation() {
    String content = "const result = eval(userInput);\nconst fn = new Function('a', body);";

    List<Finding> findings = scanner.scan(context("run.js", content));

    assertThat(findings).extracting(Finding::kind).containsOnly(FindingKind.EVAL_USAGE);
    assertThat(findings).extracting(Finding::message)
        .containsExactly(
            "eval() usage detected. This can lead to code injection vulnerabilities.",
            "new Function() usage detected. This can lead to code injection vulnerabilities.");
  }

  @Test
  void reportsShellAndDiskAccessOncePerLine() {
    String content =
        String.join(
            "\n",
            "const cp = require('child_process');",
            "import { readFile } from 'fs';",
            "Process p = Runtime.getRuntime().exec(command);",
            "subprocess.run(args)",
            "execSync(cmd);");

    List<Finding> findings = scanner.scan(context("tool.js", content));

    assertThat(findings).hasSize(5);
    assertThat(findings).extracting(Finding::kind).containsOnly(FindingKind.INSECURE_DEPENDENCY);
    assertThat(findings.get(0).message())
        .isEqualTo("child_process usage can be dangerous if not properly sanitized");
    assertThat(findings.get(1).message())
        .isEqualTo("File system access should be carefully controlled");
  }

  @Test
  void rulesRunInAFixedOrder() {
    assertThat(scanner.rules())
        .extracting(rule -> rule.kind())
        .containsExactly(
            FindingKind.HARDCODED_SECRET,
            FindingKind.SQL_INJECTION,
            FindingKind.XSS_VULNERABILITY,
            FindingKind.INSECURE_RANDOM,
            FindingKind.EVAL_USAGE,
            FindingKind.INSECURE_DEPENDENCY);
  }

  @Test
  void failingRuleDoesNotHideOtherWeaknesses() {
    FindingRule broken =
        new FindingRule() {
          @Override
          public FindingKind kind() {
            return FindingKind.SQL_INJECTION;
          }

          @Override
          public List<Finding> detect(RuleContext context) {
            throw new IllegalStateException("pattern table missing");
          }
        };
    SecurityScanner partial = new SecurityScanner(List.of(broken, new EvalUsageRule()));

    assertThat(partial.scan(context("src/run.js", "eval(userInput);")))
        .singleElement()
        .extracting(Finding::kind)
        .isEqualTo(FindingKind.EVAL_USAGE);
  }
}
