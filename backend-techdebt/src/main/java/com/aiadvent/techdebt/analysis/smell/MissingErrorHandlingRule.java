package com.aiadvent.techdebt.analysis.smell;

import com.aiadvent.techdebt.analysis.FindingRule;
import com.aiadvent.techdebt.analysis.RuleContext;
import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import com.aiadvent.techdebt.model.Severity;
import java.util.List;
import java.util.regex.Pattern;

/** File-level check: asynchronous or network calls with no error handling token anywhere. */
final class MissingErrorHandlingRule implements FindingRule {

  private static final Pattern ASYNC_CALL =
      Pattern.compile("\\b(?:async|await|Promise|fetch|axios|CompletableFuture|HttpClient)\\b");

  private static final Pattern HANDLER =
      Pattern.compile("\\b(?:try|catch)\\b|\\.then\\(|\\.catch\\(");

  @Override
  public FindingKind kind() {
    return FindingKind.MISSING_ERROR_HANDLING;
  }

  @Override
  public List<Finding> detect(RuleContext context) {
    String content = context.content();
    if (content.isEmpty()
        || !ASYNC_CALL.matcher(content).find()
        || HANDLER.matcher(content).find()) {
      return List.of();
    }
    return List.of(
        Finding.of(
            kind(),
            Severity.MAJOR,
            context.path(),
            null,
            "Async operations detected without proper error handling. "
                + "Add try-catch or .catch() handlers.",
            20));
  }
}
