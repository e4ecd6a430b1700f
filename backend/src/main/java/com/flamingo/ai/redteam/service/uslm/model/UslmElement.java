package com.flamingo.ai.redteam.service.uslm.model;

import java.util.List;

/**
 * A node in the element tree of a parsed USLM document. Immutable once built.
 *
 * @param elementType hierarchy level instantiated below this element, or {@code UNKNOWN}
 * @param identifier USLM path, empty for structural wrappers
 * @param number text of the {@code <num>} child, or {@code null}
 * @param heading text of the {@code <heading>} child, or {@code null}
 * @param content text of the {@code <content>} child, or {@code null}
 * @param children nested structural elements in document order
 * @param refs references scoped directly inside this element (not inside its children)
 */
public record UslmElement(
    ElementType elementType,
    String identifier,
    String number,
    String heading,
    String content,
    List<UslmElement> children,
    List<UslmReference> refs) {

  public UslmElement {
    identifier = identifier == null ? "" : identifier;
    children = List.copyOf(children);
    refs = List.copyOf(refs);
  }

  /** Placeholder root used when a document has no recognised root tag. */
  public static UslmElement empty() {
    return new UslmElement(ElementType.UNKNOWN, "", null, null, null, List.of(), List.of());
  }
}
