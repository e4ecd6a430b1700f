package com.flamingo.ai.redteam.api.dto.response;

import com.flamingo.ai.redteam.service.analysis.AnalysisReport;
import com.flamingo.ai.redteam.service.analysis.DocumentFailure;
import com.flamingo.ai.redteam.service.graph.GraphEdge;
import com.flamingo.ai.redteam.service.graph.GraphNode;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a batch analysis. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

  private String billId;
  private int documentCount;
  private int nodeCount;
  private int edgeCount;
  private List<GraphNode> nodes;
  private List<GraphEdge> edges;
  private List<LoopholeResponse> findings;
  private List<DocumentFailure> failures;
  private Map<Integer, List<String>> validationErrors;

  /** Creates an AnalysisResponse from an analysis report. */
  public static AnalysisResponse fromReport(AnalysisReport report) {
    return AnalysisResponse.builder()
        .billId(report.billId())
        .documentCount(report.documentCount())
        .nodeCount(report.graph().nodeCount())
        .edgeCount(report.graph().edgeCount())
        .nodes(report.graph().nodes())
        .edges(report.graph().allEdges())
        .findings(
            report.findings().stream()
                .map(finding -> LoopholeResponse.fromFinding(report.billId(), finding))
                .toList())
        .failures(report.failures())
        .validationErrors(report.validationErrors())
        .build();
  }
}
