package com.flamingo.ai.redteam.service.uslm.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Optional;

/**
 * The fixed USLM hierarchy, ordered from the outermost level ({@code title}) to the innermost
 * ({@code subitem}), plus {@link #UNKNOWN} for elements that instantiate no hierarchy level.
 */
public enum ElementType {
  TITLE("title"),
  SUBTITLE("subtitle"),
  CHAPTER("chapter"),
  SUBCHAPTER("subchapter"),
  PART("part"),
  SUBPART("subpart"),
  SECTION("section"),
  SUBSECTION("subsection"),
  PARAGRAPH("paragraph"),
  SUBPARAGRAPH("subparagraph"),
  CLAUSE("clause"),
  SUBCLAUSE("subclause"),
  ITEM("item"),
  SUBITEM("subitem"),
  UNKNOWN("unknown");

  private static final List<ElementType> HIERARCHY = List.of(values()).subList(0, 14);

  private final String tagName;

  ElementType(String tagName) {
    this.tagName = tagName;
  }

  @JsonValue
  public String getTagName() {
    return tagName;
  }

  /** Hierarchy levels in document order, excluding {@link #UNKNOWN}. */
  public static List<ElementType> hierarchy() {
    return HIERARCHY;
  }

  /** Resolves a namespace-free tag name to its hierarchy level. */
  public static Optional<ElementType> fromTagName(String tagName) {
    for (ElementType type : HIERARCHY) {
      if (type.tagName.equals(tagName)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
