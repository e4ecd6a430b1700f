package com.flamingo.ai.redteam.service.uslm.model;

/**
 * A cross-reference found while parsing.
 *
 * <p>The target need not resolve to any known unit; dangling targets are expected.
 *
 * @param refType classification of the reference
 * @param target USLM identifier the reference points to
 * @param text display text of the reference, empty when the tag has no text
 */
public record UslmReference(ReferenceType refType, String target, String text) {

  public UslmReference {
    target = target == null ? "" : target;
    text = text == null ? "" : text;
  }

  /** Creates a reference whose type is classified from {@code target}. */
  public static UslmReference of(String target, String text) {
    return new UslmReference(ReferenceType.classify(target), target, text);
  }
}
