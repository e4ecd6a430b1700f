package com.flamingo.ai.redteam.service.uslm.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Optional;

/** Type of a USLM document, taken from its root tag. */
public enum DocumentType {
  LAW_DOC("lawDoc"),
  BILL("bill"),
  RESOLUTION("resolution"),
  UNKNOWN("unknown");

  private static final List<DocumentType> ROOTS = List.of(LAW_DOC, BILL, RESOLUTION);

  private final String tagName;

  DocumentType(String tagName) {
    this.tagName = tagName;
  }

  @JsonValue
  public String getTagName() {
    return tagName;
  }

  /** The three recognised root tags, in lookup order. */
  public static List<DocumentType> roots() {
    return ROOTS;
  }

  public static Optional<DocumentType> fromTagName(String tagName) {
    return ROOTS.stream().filter(type -> type.tagName.equals(tagName)).findFirst();
  }
}
