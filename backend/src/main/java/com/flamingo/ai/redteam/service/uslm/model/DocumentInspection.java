package com.flamingo.ai.redteam.service.uslm.model;

import java.util.Objects;

/**
 * A parse and a validation of the same markup.
 *
 * @param document the parsed document, {@code null} when the markup could not be tokenized
 * @param validation structural validation result
 * @param parseError tokenizer message when {@code document} is {@code null}, otherwise {@code null}
 */
public record DocumentInspection(
    UslmDocument document, ValidationResult validation, String parseError) {

  public DocumentInspection {
    Objects.requireNonNull(validation, "validation");
  }

  public static DocumentInspection parsed(UslmDocument document, ValidationResult validation) {
    return new DocumentInspection(Objects.requireNonNull(document, "document"), validation, null);
  }

  public static DocumentInspection failed(ValidationResult validation, String parseError) {
    return new DocumentInspection(null, validation, parseError);
  }

  public boolean isParsed() {
    return document != null;
  }
}
