package com.flamingo.ai.redteam.service.uslm.model;

import java.util.List;

/**
 * Outcome of a structural sanity check.
 *
 * @param valid {@code true} iff {@code errors} is empty
 * @param errors one entry per violated rule
 */
public record ValidationResult(boolean valid, List<String> errors) {

  public ValidationResult {
    errors = List.copyOf(errors);
  }

  public static ValidationResult of(List<String> errors) {
    return new ValidationResult(errors.isEmpty(), errors);
  }
}
