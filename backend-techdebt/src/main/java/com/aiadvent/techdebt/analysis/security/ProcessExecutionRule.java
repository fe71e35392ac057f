package com.aiadvent.techdebt.analysis.security;

import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;

/** Reported as {@code insecure_dependency}: imports or calls that reach the shell or disk. */
final class ProcessExecutionRule extends LinePatternRule {

  private static final String COMMAND_INJECTION =
      "Command execution can lead to command injection if not sanitized";

  ProcessExecutionRule() {
    super(
        FindingKind.INSECURE_DEPENDENCY,
        Severity.MAJOR,
        "CWE-78",
        20,
        List.of(
            Signature.of(
                "require\\(\\s*['\"](?:node:)?child_process['\"]\\s*\\)"
                    + "|\\bfrom\\s+['\"](?:node:)?child_process['\"]",
                "child_process usage can be dangerous if not properly sanitized"),
            Signature.of(
                "require\\(\\s*['\"](?:node:)?fs['\"]\\s*\\)|\\bfrom\\s+['\"](?:node:)?fs['\"]",
                "File system access should be carefully controlled"),
            Signature.of(
                "Runtime\\.getRuntime\\(\\)\\.exec\\(|\\bnew\\s+ProcessBuilder\\s*\\(",
                COMMAND_INJECTION),
            Signature.of("\\bos\\.system\\s*\\(|\\bsubprocess\\.\\w+\\s*\\(", COMMAND_INJECTION),
            Signature.of("\\b(?:exec|execSync|spawn|spawnSync)\\s*\\(", COMMAND_INJECTION)));
  }
}
