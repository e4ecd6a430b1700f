package com.flamingo.ai.redteam.service.loophole;

import com.fasterxml.jackson.annotation.JsonValue;

/** Severity of a finding. */
public enum Severity {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  private final String code;

  Severity(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }
}
