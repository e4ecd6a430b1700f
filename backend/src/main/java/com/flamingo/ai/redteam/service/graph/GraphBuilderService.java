package com.flamingo.ai.redteam.service.graph;

import com.flamingo.ai.redteam.service.uslm.UslmIdentifiers;
import com.flamingo.ai.redteam.service.uslm.model.UslmDocument;
import com.flamingo.ai.redteam.service.uslm.model.UslmReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Merges parsed documents into a {@link ShadowCodeGraph.Builder}.
 *
 * <p>Every reference in a document becomes an edge whose source is the document's own identifier;
 * references are not attributed to the nested element that contains them.
 */
@Service
@Slf4j
public class GraphBuilderService {

  /**
   * Adds the document root as a node and one edge per reference.
   *
   * <p>Documents without a root identifier (for example those with no recognised root tag) are
   * skipped, since they have no identifier to attribute edges to.
   *
   * @param builder graph under construction
   * @param document parsed document
   */
  public void mergeDocument(ShadowCodeGraph.Builder builder, UslmDocument document) {
    String identifier = document.identifier();
    if (identifier.isBlank()) {
      log.warn(
          "Skipping {} document without identifier ({} references dropped)",
          document.docType().getTagName(),
          document.references().size());
      return;
    }

    builder.addNode(
        new GraphNode(
            identifier,
            UslmIdentifiers.toCitation(identifier),
            NodeType.fromElementType(document.root().elementType())));

    for (UslmReference reference : document.references()) {
      builder.addEdge(
          new GraphEdge(
              identifier,
              reference.target(),
              reference.refType(),
              reference.text().isEmpty() ? null : reference.text()));
    }
    log.debug("Merged {} with {} edges", identifier, document.references().size());
  }
}
