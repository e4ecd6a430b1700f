package com.flamingo.ai.redteam.service.loophole;

import com.flamingo.ai.redteam.config.RedTeamConfig;
import com.flamingo.ai.redteam.exception.DetectionCancelledException;
import com.flamingo.ai.redteam.service.graph.GraphEdge;
import com.flamingo.ai.redteam.service.graph.GraphNode;
import com.flamingo.ai.redteam.service.graph.ShadowCodeGraph;
import com.flamingo.ai.redteam.service.uslm.UslmIdentifiers;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the structural analyses over a sealed {@link ShadowCodeGraph}.
 *
 * <p>Results are concatenated in a fixed order: circular, orphaned, dangling, ambiguous. The
 * detector never mutates the graph, so concurrent runs over the same graph are safe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoopholeDetector {

  /** Fewest distinct sibling targets that count as ambiguous. */
  static final int MIN_AMBIGUOUS_TARGETS = 2;

  /** Most distinct sibling targets before a group is treated as a deliberate enumeration. */
  static final int MAX_AMBIGUOUS_TARGETS = 4;

  private static final String ARROW = " -> ";

  private final RedTeamConfig config;

  /**
   * Runs all four passes.
   *
   * @param graph sealed graph
   * @return findings in pass order
   * @throws DetectionCancelledException if the calling thread is interrupted mid-run
   */
  public List<Finding> detect(ShadowCodeGraph graph) {
    List<Finding> findings = new ArrayList<>();
    findings.addAll(detectCircularDependencies(graph));
    findings.addAll(detectOrphanedSections(graph));
    findings.addAll(detectDanglingReferences(graph));
    findings.addAll(detectAmbiguousReferences(graph));

    log.info(
        "Detected {} findings over {} nodes and {} edges",
        findings.size(),
        graph.nodeCount(),
        graph.edgeCount());
    if (log.isDebugEnabled()) {
      findings.forEach(
          f -> log.debug("{} [{}]: {}", f.type().getCode(), f.severity(), f.description()));
    }
    return findings;
  }

  /**
   * Depth-first search from every node in insertion order. Reaching a node already on the current
   * path closes a cycle; the finding lists the path from that node's first occurrence, followed by
   * the node again.
   *
   * <p>The walk keeps an explicit stack so corpus-sized graphs do not exhaust the thread stack.
   */
  public List<Finding> detectCircularDependencies(ShadowCodeGraph graph) {
    List<Finding> findings = new ArrayList<>();
    Set<String> done = new HashSet<>();
    Set<String> onStack = new HashSet<>();
    List<String> path = new ArrayList<>();
    Deque<Iterator<GraphEdge>> frames = new ArrayDeque<>();

    for (GraphNode start : graph.nodes()) {
      if (done.contains(start.identifier())) {
        continue;
      }
      enter(graph, start.identifier(), path, onStack, frames);

      while (!frames.isEmpty()) {
        Iterator<GraphEdge> outgoing = frames.peek();
        if (!outgoing.hasNext()) {
          frames.pop();
          String finished = path.remove(path.size() - 1);
          onStack.remove(finished);
          done.add(finished);
          continue;
        }

        String target = outgoing.next().to();
        if (onStack.contains(target)) {
          List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
          cycle.add(target);
          findings.add(
              Finding.of(
                  LoopholeType.CIRCULAR_DEPENDENCY,
                  "Circular dependency: " + String.join(ARROW, cycle),
                  cycle));
        } else if (!done.contains(target)) {
          enter(graph, target, path, onStack, frames);
        }
      }
    }

    if (config.getDetection().isDeduplicateCycles()) {
      return deduplicateByNodeSet(findings);
    }
    return findings;
  }

  /** Nodes with at least one outgoing edge and no incoming edge. */
  public List<Finding> detectOrphanedSections(ShadowCodeGraph graph) {
    Set<String> cited = new HashSet<>();
    for (GraphEdge edge : graph.allEdges()) {
      cited.add(edge.to());
    }

    List<Finding> findings = new ArrayList<>();
    for (GraphNode node : graph.nodes()) {
      String id = node.identifier();
      if (!graph.edgesFrom(id).isEmpty() && !cited.contains(id)) {
        findings.add(
            Finding.of(
                LoopholeType.ORPHANED_SECTION,
                "Orphaned section: "
                    + describe(node)
                    + " cites other provisions but is never cited",
                List.of(id)));
      }
    }
    return findings;
  }

  /** One finding per edge whose target has no node, duplicates included. */
  public List<Finding> detectDanglingReferences(ShadowCodeGraph graph) {
    List<Finding> findings = new ArrayList<>();
    for (GraphEdge edge : graph.allEdges()) {
      if (!graph.containsNode(edge.to())) {
        findings.add(
            Finding.of(
                LoopholeType.DANGLING_REFERENCE,
                "Dangling reference: "
                    + edge.from()
                    + " references "
                    + edge.to()
                    + ", which does not exist in the graph",
                List.of(edge.from(), edge.to())));
      }
    }
    return findings;
  }

  /**
   * Groups edge targets by parent path and flags groups with two to four distinct targets. A single
   * target is unambiguous; five or more is read as an intentional list.
   */
  public List<Finding> detectAmbiguousReferences(ShadowCodeGraph graph) {
    Map<String, Set<String>> groups = new LinkedHashMap<>();
    for (GraphEdge edge : graph.allEdges()) {
      groups
          .computeIfAbsent(UslmIdentifiers.basePath(edge.to()), k -> new LinkedHashSet<>())
          .add(edge.to());
    }

    List<Finding> findings = new ArrayList<>();
    groups.forEach(
        (base, targets) -> {
          if (targets.size() >= MIN_AMBIGUOUS_TARGETS && targets.size() <= MAX_AMBIGUOUS_TARGETS) {
            findings.add(
                Finding.of(
                    LoopholeType.AMBIGUOUS_REFERENCE,
                    "Ambiguous reference: "
                        + targets.size()
                        + " sibling targets under "
                        + base
                        + ": "
                        + String.join(", ", targets),
                    new ArrayList<>(targets)));
          }
        });
    return findings;
  }

  // ---- private helpers ----

  private void enter(
      ShadowCodeGraph graph,
      String id,
      List<String> path,
      Set<String> onStack,
      Deque<Iterator<GraphEdge>> frames) {
    if (Thread.currentThread().isInterrupted()) {
      throw new DetectionCancelledException("Circular dependency search interrupted at " + id);
    }
    path.add(id);
    onStack.add(id);
    frames.push(graph.edgesFrom(id).iterator());
  }

  private List<Finding> deduplicateByNodeSet(List<Finding> findings) {
    Set<Set<String>> seen = new HashSet<>();
    List<Finding> unique = new ArrayList<>();
    for (Finding finding : findings) {
      if (seen.add(new HashSet<>(finding.affectedNodes()))) {
        unique.add(finding);
      }
    }
    log.debug("Cycle deduplication kept {} of {} findings", unique.size(), findings.size());
    return unique;
  }

  private String describe(GraphNode node) {
    if (node.citation() == null
        || node.citation().isBlank()
        || node.citation().equals(node.identifier())) {
      return node.identifier();
    }
    return node.citation() + " (" + node.identifier() + ")";
  }
}
