package com.flamingo.ai.redteam.service.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only graph of legislative units and the cross-references between them.
 *
 * <p>Nodes are keyed by identifier; edges refer to identifiers, never to node objects, so an edge
 * may point at an identifier with no node. Instances are produced by sealing a {@link Builder} and
 * are safe to query from several threads at once.
 */
public final class ShadowCodeGraph {

  private final Map<String, GraphNode> nodes;
  private final List<GraphEdge> edges;
  private final Map<String, List<GraphEdge>> outgoing;
  private final Map<String, List<GraphEdge>> incoming;

  private ShadowCodeGraph(Map<String, GraphNode> nodes, List<GraphEdge> edges) {
    this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    this.edges = List.copyOf(edges);
    Map<String, List<GraphEdge>> out = new LinkedHashMap<>();
    Map<String, List<GraphEdge>> in = new LinkedHashMap<>();
    for (GraphEdge edge : this.edges) {
      out.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
      in.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
    }
    out.replaceAll((k, v) -> List.copyOf(v));
    in.replaceAll((k, v) -> List.copyOf(v));
    this.outgoing = out;
    this.incoming = in;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<GraphNode> node(String identifier) {
    return Optional.ofNullable(nodes.get(identifier));
  }

  public boolean containsNode(String identifier) {
    return nodes.containsKey(identifier);
  }

  /** All nodes in first-insertion order. */
  public List<GraphNode> nodes() {
    return List.copyOf(nodes.values());
  }

  /** Edges whose source is {@code identifier}, in insertion order. */
  public List<GraphEdge> edgesFrom(String identifier) {
    return outgoing.getOrDefault(identifier, List.of());
  }

  /** Edges whose target is {@code identifier}, in insertion order. */
  public List<GraphEdge> edgesTo(String identifier) {
    return incoming.getOrDefault(identifier, List.of());
  }

  public List<GraphEdge> allEdges() {
    return edges;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  /**
   * Mutable accumulator for a {@link ShadowCodeGraph}.
   *
   * <p>Not thread-safe: a single owner performs every mutation, then calls {@link #seal()}. Any
   * mutation after sealing fails with {@link IllegalStateException}.
   */
  public static final class Builder {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private boolean sealed;

    private Builder() {}

    /** Adds a node; an existing node with the same identifier is replaced. */
    public Builder addNode(GraphNode node) {
      checkOpen();
      nodes.put(node.identifier(), node);
      return this;
    }

    /** Appends an edge. Parallel edges between the same pair are kept. */
    public Builder addEdge(GraphEdge edge) {
      checkOpen();
      edges.add(edge);
      return this;
    }

    public int nodeCount() {
      return nodes.size();
    }

    public int edgeCount() {
      return edges.size();
    }

    public boolean isSealed() {
      return sealed;
    }

    /** Ends the build phase and returns the read-only graph. */
    public ShadowCodeGraph seal() {
      checkOpen();
      sealed = true;
      return new ShadowCodeGraph(nodes, edges);
    }

    private void checkOpen() {
      if (sealed) {
        throw new IllegalStateException("Graph builder has already been sealed");
      }
    }
  }
}
