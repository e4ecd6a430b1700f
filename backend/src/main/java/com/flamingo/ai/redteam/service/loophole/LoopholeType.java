package com.flamingo.ai.redteam.service.loophole;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of structural defect, each with a fixed severity. */
public enum LoopholeType {
  /** Units that reference each other in a loop. */
  CIRCULAR_DEPENDENCY("circular_dependency", Severity.HIGH),

  /** A unit that cites others but is never cited itself. */
  ORPHANED_SECTION("orphaned_section", Severity.MEDIUM),

  /** A reference to an identifier with no node. */
  DANGLING_REFERENCE("dangling_reference", Severity.MEDIUM),

  /** A handful of sibling targets under one parent path. */
  AMBIGUOUS_REFERENCE("ambiguous_reference", Severity.LOW);

  private final String code;
  private final Severity severity;

  LoopholeType(String code, Severity severity) {
    this.code = code;
    this.severity = severity;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  public Severity getSeverity() {
    return severity;
  }
}
