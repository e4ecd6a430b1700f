package com.flamingo.ai.redteam.api.rest;

import com.flamingo.ai.redteam.api.dto.request.AnalyzeRequest;
import com.flamingo.ai.redteam.api.dto.request.ValidateRequest;
import com.flamingo.ai.redteam.api.dto.response.AnalysisResponse;
import com.flamingo.ai.redteam.service.analysis.AnalysisReport;
import com.flamingo.ai.redteam.service.analysis.LegislativeAnalysisService;
import com.flamingo.ai.redteam.service.uslm.model.ValidationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document analysis. */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

  private final LegislativeAnalysisService analysisService;

  /** Parses a batch of documents, builds the graph and returns the findings. */
  @PostMapping
  public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
    AnalysisReport report = analysisService.analyze(request.getBillId(), request.getDocuments());
    return ResponseEntity.ok(AnalysisResponse.fromReport(report));
  }

  /** Runs the structural sanity checks on one document. */
  @PostMapping("/validate")
  public ResponseEntity<ValidationResult> validate(@Valid @RequestBody ValidateRequest request) {
    return ResponseEntity.ok(analysisService.validate(request.getXml()));
  }
}
