package com.flamingo.ai.redteam.service.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.redteam.service.uslm.model.ElementType;

/** Granularity of a graph node. */
public enum NodeType {
  TITLE("title"),
  SUBTITLE("subtitle"),
  CHAPTER("chapter"),
  SUBCHAPTER("subchapter"),
  PART("part"),
  SECTION("section");

  private final String code;

  NodeType(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  /** Maps an element type onto a node type, defaulting to {@link #SECTION}. */
  public static NodeType fromElementType(ElementType elementType) {
    if (elementType == null) {
      return SECTION;
    }
    switch (elementType) {
      case TITLE:
        return TITLE;
      case SUBTITLE:
        return SUBTITLE;
      case CHAPTER:
        return CHAPTER;
      case SUBCHAPTER:
        return SUBCHAPTER;
      case PART:
        return PART;
      default:
        return SECTION;
    }
  }
}
