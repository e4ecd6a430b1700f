package com.flamingo.ai.redteam.service.loophole;

import java.util.List;

/**
 * A structural defect reported by {@link LoopholeDetector}.
 *
 * @param type kind of defect
 * @param severity fixed by {@code type}
 * @param description human-readable summary naming the affected identifiers
 * @param affectedNodes identifiers implicated in this finding, in order
 */
public record Finding(
    LoopholeType type, Severity severity, String description, List<String> affectedNodes) {

  public Finding {
    affectedNodes = List.copyOf(affectedNodes);
  }

  public static Finding of(LoopholeType type, String description, List<String> affectedNodes) {
    return new Finding(type, type.getSeverity(), description, affectedNodes);
  }
}
