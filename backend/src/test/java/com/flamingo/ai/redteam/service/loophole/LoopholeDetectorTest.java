package com.flamingo.ai.redteam.service.loophole;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.redteam.config.RedTeamConfig;
import com.flamingo.ai.redteam.exception.DetectionCancelledException;
import com.flamingo.ai.redteam.service.graph.GraphEdge;
import com.flamingo.ai.redteam.service.graph.GraphNode;
import com.flamingo.ai.redteam.service.graph.NodeType;
import com.flamingo.ai.redteam.service.graph.ShadowCodeGraph;
import com.flamingo.ai.redteam.service.uslm.model.ReferenceType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LoopholeDetector Tests")
class LoopholeDetectorTest {

  private RedTeamConfig config;
  private LoopholeDetector detector;

  @BeforeEach
  void setUp() {
    config = new RedTeamConfig();
    detector = new LoopholeDetector(config);
  }

  private static ShadowCodeGraph.Builder graphWithNodes(String... ids) {
    ShadowCodeGraph.Builder builder = ShadowCodeGraph.builder();
    for (String id : ids) {
      builder.addNode(new GraphNode(id, id, NodeType.SECTION));
    }
    return builder;
  }

  private static GraphEdge edge(String from, String to) {
    return new GraphEdge(from, to, ReferenceType.CITATION, null);
  }

  @Nested
  @DisplayName("circular dependencies")
  class Circular {

    @Test
    @DisplayName("should report one high-severity cycle for A -> B -> C -> A")
    void shouldReportThreeNodeCycle() {
      ShadowCodeGraph graph =
          graphWithNodes("A", "B", "C")
              .addEdge(edge("A", "B"))
              .addEdge(edge("B", "C"))
              .addEdge(edge("C", "A"))
              .seal();

      List<Finding> findings = detector.detectCircularDependencies(graph);

      assertThat(findings).hasSize(1);
      Finding finding = findings.get(0);
      assertThat(finding.type()).isEqualTo(LoopholeType.CIRCULAR_DEPENDENCY);
      assertThat(finding.severity()).isEqualTo(Severity.HIGH);
      assertThat(finding.affectedNodes()).containsExactly("A", "B", "C", "A");
      assertThat(finding.description()).contains("A -> B -> C -> A");
    }

    @Test
    @DisplayName("should report only the looping suffix of the path")
    void shouldReportOnlyLoopingSuffix() {
      ShadowCodeGraph graph =
          graphWithNodes("X", "A", "B")
              .addEdge(edge("X", "A"))
              .addEdge(edge("A", "B"))
              .addEdge(edge("B", "A"))
              .seal();

      List<Finding> findings = detector.detectCircularDependencies(graph);

      assertThat(findings).singleElement().extracting(Finding::affectedNodes)
          .isEqualTo(List.of("A", "B", "A"));
    }

    @Test
    @DisplayName("should report self references")
    void shouldReportSelfReference() {
      ShadowCodeGraph graph = graphWithNodes("A").addEdge(edge("A", "A")).seal();

      assertThat(detector.detectCircularDependencies(graph))
          .extracting(Finding::affectedNodes)
          .containsExactly(List.of("A", "A"));
    }

    @Test
    @DisplayName("should return nothing for acyclic graphs")
    void shouldReturnNothing_whenAcyclic() {
      ShadowCodeGraph graph =
          graphWithNodes("A", "B", "C", "D")
              .addEdge(edge("A", "B"))
              .addEdge(edge("A", "C"))
              .addEdge(edge("B", "D"))
              .addEdge(edge("C", "D"))
              .addEdge(edge("D", "/dangling"))
              .seal();

      assertThat(detector.detectCircularDependencies(graph)).isEmpty();
    }

    @Test
    @DisplayName("should follow edges through identifiers that have no node")
    void shouldFollowEdgesThroughUnknownIdentifiers() {
      ShadowCodeGraph graph =
          graphWithNodes("A").addEdge(edge("A", "ghost")).addEdge(edge("ghost", "A")).seal();

      assertThat(detector.detectCircularDependencies(graph))
          .extracting(Finding::affectedNodes)
          .containsExactly(List.of("A", "ghost", "A"));
    }

    @Test
    @DisplayName("should report each closing edge, including parallel ones, by default")
    void shouldReportParallelClosingEdges_byDefault() {
      ShadowCodeGraph graph =
          graphWithNodes("A", "B")
              .addEdge(edge("A", "B"))
              .addEdge(edge("B", "A"))
              .addEdge(edge("B", "A"))
              .seal();

      assertThat(detector.detectCircularDependencies(graph)).hasSize(2);
    }

    @Test
    @DisplayName("should keep one finding per node set when deduplication is enabled")
    void shouldDeduplicateByNodeSet_whenEnabled() {
      config.getDetection().setDeduplicateCycles(true);
      ShadowCodeGraph graph =
          graphWithNodes("A", "B", "C")
              .addEdge(edge("A", "B"))
              .addEdge(edge("B", "A"))
              .addEdge(edge("B", "A"))
              .addEdge(edge("B", "C"))
              .addEdge(edge("C", "B"))
              .seal();

      List<Finding> findings = detector.detectCircularDependencies(graph);

      assertThat(findings)
          .extracting(Finding::affectedNodes)
          .containsExactly(List.of("A", "B", "A"), List.of("B", "C", "B"));
    }

    @Test
    @DisplayName("should stop when the thread is interrupted")
    void shouldStop_whenInterrupted() {
      ShadowCodeGraph graph = graphWithNodes("A", "B").addEdge(edge("A", "B")).seal();

      Thread.currentThread().interrupt();
      try {
        assertThatThrownBy(() -> detector.detectCircularDependencies(graph))
            .isInstanceOf(DetectionCancelledException.class);
      } finally {
        Thread.interrupted();
      }
    }
  }

  @Nested
  @DisplayName("orphaned sections")
  class Orphaned {

    @Test
    @DisplayName("should report node that cites but is never cited")
    void shouldReportOrphan() {
      ShadowCodeGraph graph = graphWithNodes("D", "E").addEdge(edge("D", "E")).seal();

      List<Finding> findings = detector.detectOrphanedSections(graph);

      assertThat(findings).hasSize(1);
      assertThat(findings.get(0).type()).isEqualTo(LoopholeType.ORPHANED_SECTION);
      assertThat(findings.get(0).severity()).isEqualTo(Severity.MEDIUM);
      assertThat(findings.get(0).affectedNodes()).containsExactly("D");
    }

    @Test
    @DisplayName("should not report node once something cites it")
    void shouldNotReport_whenNodeIsCited() {
      ShadowCodeGraph graph =
          graphWithNodes("D", "E").addEdge(edge("D", "E")).addEdge(edge("Z", "D")).seal();

      assertThat(detector.detectOrphanedSections(graph)).isEmpty();
    }

    @Test
    @DisplayName("should not report node without outgoing edges")
    void shouldNotReport_whenNodeHasNoOutgoingEdges() {
      ShadowCodeGraph graph = graphWithNodes("D", "E").seal();

      assertThat(detector.detectOrphanedSections(graph)).isEmpty();
    }

    @Test
    @DisplayName("should count incoming edges from sources that are not nodes")
    void shouldCountIncomingEdgesFromUnknownSources() {
      ShadowCodeGraph graph =
          graphWithNodes("D").addEdge(edge("D", "/x")).addEdge(edge("/outside", "D")).seal();

      assertThat(detector.detectOrphanedSections(graph)).isEmpty();
    }
  }

  @Nested
  @DisplayName("dangling references")
  class Dangling {

    @Test
    @DisplayName("should report edge to unknown identifier")
    void shouldReportDanglingEdge() {
      ShadowCodeGraph graph = graphWithNodes("X").addEdge(edge("X", "/us/usc/t99/s404")).seal();

      List<Finding> findings = detector.detectDanglingReferences(graph);

      assertThat(findings).hasSize(1);
      assertThat(findings.get(0).type()).isEqualTo(LoopholeType.DANGLING_REFERENCE);
      assertThat(findings.get(0).severity()).isEqualTo(Severity.MEDIUM);
      assertThat(findings.get(0).affectedNodes()).containsExactly("X", "/us/usc/t99/s404");
    }

    @Test
    @DisplayName("should report repeated identical dangling edges separately")
    void shouldReportRepeatedDanglingEdges() {
      ShadowCodeGraph graph =
          graphWithNodes("X", "Y")
              .addEdge(edge("X", "/gone"))
              .addEdge(edge("X", "Y"))
              .addEdge(edge("X", "/gone"))
              .seal();

      assertThat(detector.detectDanglingReferences(graph)).hasSize(2);
    }
  }

  @Nested
  @DisplayName("ambiguous references")
  class Ambiguous {

    @Test
    @DisplayName("should report sibling targets under one parent path")
    void shouldReportSiblingTargets() {
      ShadowCodeGraph graph =
          graphWithNodes("P")
              .addEdge(edge("P", "/us/usc/t42/s100"))
              .addEdge(edge("P", "/us/usc/t42/s101"))
              .seal();

      List<Finding> findings = detector.detectAmbiguousReferences(graph);

      assertThat(findings).hasSize(1);
      assertThat(findings.get(0).type()).isEqualTo(LoopholeType.AMBIGUOUS_REFERENCE);
      assertThat(findings.get(0).severity()).isEqualTo(Severity.LOW);
      assertThat(findings.get(0).affectedNodes())
          .containsExactly("/us/usc/t42/s100", "/us/usc/t42/s101");
    }

    @Test
    @DisplayName("should count distinct targets only, in first-seen order")
    void shouldCountDistinctTargets() {
      ShadowCodeGraph graph =
          graphWithNodes("P", "Q")
              .addEdge(edge("P", "/t/b"))
              .addEdge(edge("Q", "/t/a"))
              .addEdge(edge("Q", "/t/b"))
              .addEdge(edge("P", "/u/only"))
              .addEdge(edge("Q", "/u/only"))
              .seal();

      assertThat(detector.detectAmbiguousReferences(graph))
          .extracting(Finding::affectedNodes)
          .containsExactly(List.of("/t/b", "/t/a"));
    }

    @Test
    @DisplayName("should flag four distinct targets but not five")
    void shouldFlagFourButNotFive() {
      ShadowCodeGraph.Builder four = graphWithNodes("P");
      ShadowCodeGraph.Builder five = graphWithNodes("P");
      for (int i = 1; i <= 5; i++) {
        if (i <= 4) {
          four.addEdge(edge("P", "/us/usc/t1/s" + i));
        }
        five.addEdge(edge("P", "/us/usc/t1/s" + i));
      }

      assertThat(detector.detectAmbiguousReferences(four.seal())).hasSize(1);
      assertThat(detector.detectAmbiguousReferences(five.seal())).isEmpty();
    }
  }

  @Test
  @DisplayName("should concatenate passes in fixed order")
  void shouldConcatenatePassesInOrder() {
    ShadowCodeGraph graph =
        graphWithNodes("/a/x", "/a/y", "/b/d")
            .addEdge(edge("/a/x", "/a/y"))
            .addEdge(edge("/a/y", "/a/x"))
            .addEdge(edge("/b/d", "/c/missing"))
            .seal();

    List<Finding> findings = detector.detect(graph);

    assertThat(findings)
        .extracting(Finding::type)
        .containsExactly(
            LoopholeType.CIRCULAR_DEPENDENCY,
            LoopholeType.ORPHANED_SECTION,
            LoopholeType.DANGLING_REFERENCE,
            LoopholeType.AMBIGUOUS_REFERENCE);
  }

  @Test
  @DisplayName("should produce identical results on repeated runs")
  void shouldBeIdempotent() {
    ShadowCodeGraph graph =
        graphWithNodes("A", "B", "/q/r")
            .addEdge(edge("A", "B"))
            .addEdge(edge("B", "A"))
            .addEdge(edge("/q/r", "/q/s"))
            .addEdge(edge("/q/r", "/q/t"))
            .seal();

    assertThat(detector.detect(graph)).isEqualTo(detector.detect(graph));
  }

  @Test
  @DisplayName("should return empty list for empty graph")
  void shouldReturnEmpty_forEmptyGraph() {
    assertThat(detector.detect(ShadowCodeGraph.builder().seal())).isEmpty();
  }
}
