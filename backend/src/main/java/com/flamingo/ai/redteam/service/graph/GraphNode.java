package com.flamingo.ai.redteam.service.graph;

/**
 * A legislative unit in the shadow graph.
 *
 * @param identifier unique key, a USLM path
 * @param citation human-readable form, e.g. {@code 42 U.S.C. § 1983}
 * @param nodeType granularity of the unit
 */
public record GraphNode(String identifier, String citation, NodeType nodeType) {}
