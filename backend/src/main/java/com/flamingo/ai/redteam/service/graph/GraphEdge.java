package com.flamingo.ai.redteam.service.graph;

import com.flamingo.ai.redteam.service.uslm.model.ReferenceType;

/**
 * A directed cross-reference. {@code to} need not resolve to a node.
 *
 * @param from source identifier
 * @param to target identifier
 * @param refType reference classification
 * @param context reference text, or {@code null}
 */
public record GraphEdge(String from, String to, ReferenceType refType, String context) {}
