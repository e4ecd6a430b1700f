package com.flamingo.ai.redteam.service.uslm.model;

import java.util.List;

/**
 * The output of {@link com.flamingo.ai.redteam.service.uslm.parsing.UslmDocumentParser}.
 *
 * @param docType type taken from the root tag
 * @param identifier identifier attribute of the root, empty when absent
 * @param root root of the element tree
 * @param references every reference in the tree, in document order, not deduplicated
 */
public record UslmDocument(
    DocumentType docType, String identifier, UslmElement root, List<UslmReference> references) {

  public UslmDocument {
    identifier = identifier == null ? "" : identifier;
    references = List.copyOf(references);
  }

  public static UslmDocument unknown() {
    return new UslmDocument(DocumentType.UNKNOWN, "", UslmElement.empty(), List.of());
  }
}
