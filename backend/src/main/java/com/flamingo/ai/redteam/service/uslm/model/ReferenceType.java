package com.flamingo.ai.redteam.service.uslm.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of cross-reference, classified from the target path. */
public enum ReferenceType {
  /** Plain citation of another unit. */
  CITATION("citation"),

  /** Target path contains {@code /amend/}. */
  AMENDMENT("amendment"),

  /** Target path contains {@code /repeal/}. */
  REPEAL("repeal"),

  /** Target path contains {@code /def/}. */
  DEFINITION("definition");

  private final String code;

  ReferenceType(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  /**
   * Classifies a target path. Rules are checked in the order amendment, repeal, definition; the
   * first match wins and anything else is a citation.
   */
  public static ReferenceType classify(String target) {
    if (target == null) {
      return CITATION;
    }
    if (target.contains("/amend/")) {
      return AMENDMENT;
    }
    if (target.contains("/repeal/")) {
      return REPEAL;
    }
    if (target.contains("/def/")) {
      return DEFINITION;
    }
    return CITATION;
  }
}
