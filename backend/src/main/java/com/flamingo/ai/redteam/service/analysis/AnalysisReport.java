package com.flamingo.ai.redteam.service.analysis;

import com.flamingo.ai.redteam.service.graph.ShadowCodeGraph;
import com.flamingo.ai.redteam.service.loophole.Finding;
import java.util.List;
import java.util.Map;

/**
 * Result of analysing one batch of documents.
 *
 * @param billId caller-supplied bill the batch belongs to, or {@code null}
 * @param documentCount number of documents submitted
 * @param graph sealed graph built from the documents that parsed
 * @param findings detector output in pass order
 * @param failures documents that could not be parsed
 * @param validationErrors structural validation errors keyed by document index; documents that
 *     validate cleanly are absent
 */
public record AnalysisReport(
    String billId,
    int documentCount,
    ShadowCodeGraph graph,
    List<Finding> findings,
    List<DocumentFailure> failures,
    Map<Integer, List<String>> validationErrors) {}
