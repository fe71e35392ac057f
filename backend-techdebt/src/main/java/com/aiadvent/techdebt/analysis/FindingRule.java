package com.aiadvent.techdebt.analysis;

import com.aiadvent.techdebt.model.Finding;
import com.aiadvent.techdebt.model.FindingKind;
import java.util.List;

/** A single lexical check over one file. Implementations are stateless. */
public interface FindingRule {

  FindingKind kind();

  List<Finding> detect(RuleContext context);
}
