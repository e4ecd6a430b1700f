package com.flamingo.ai.redteam.service.analysis;

import com.flamingo.ai.redteam.service.graph.GraphBuilderService;
import com.flamingo.ai.redteam.service.graph.ShadowCodeGraph;
import com.flamingo.ai.redteam.service.loophole.Finding;
import com.flamingo.ai.redteam.service.loophole.LoopholeDetector;
import com.flamingo.ai.redteam.service.uslm.model.DocumentInspection;
import com.flamingo.ai.redteam.service.uslm.model.UslmDocument;
import com.flamingo.ai.redteam.service.uslm.model.ValidationResult;
import com.flamingo.ai.redteam.service.uslm.parsing.UslmDocumentParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Implementation of {@link LegislativeAnalysisService}.
 *
 * <p>Parsing fans out over the {@code documentParsingExecutor} pool. Merging stays on the calling
 * thread and follows submission order, so the graph builder only ever has one writer and the
 * resulting graph does not depend on which parse finishes first.
 *
 * <p>A document the pool refuses to accept is parsed on the calling thread instead, so a batch
 * larger than the pool's capacity still completes.
 */
@Service
@Slf4j
public class LegislativeAnalysisServiceImpl implements LegislativeAnalysisService {

  private final UslmDocumentParser parser;
  private final GraphBuilderService graphBuilderService;
  private final LoopholeDetector loopholeDetector;
  private final Executor documentParsingExecutor;
  private final MeterRegistry meterRegistry;

  public LegislativeAnalysisServiceImpl(
      UslmDocumentParser parser,
      GraphBuilderService graphBuilderService,
      LoopholeDetector loopholeDetector,
      @Qualifier("documentParsingExecutor") Executor documentParsingExecutor,
      MeterRegistry meterRegistry) {
    this.parser = parser;
    this.graphBuilderService = graphBuilderService;
    this.loopholeDetector = loopholeDetector;
    this.documentParsingExecutor = documentParsingExecutor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "analysis.run", description = "Time to parse, merge and analyse a batch")
  public AnalysisReport analyze(String billId, List<String> xmlDocuments) {
    log.info("Analysing {} documents for bill {}", xmlDocuments.size(), billId);

    List<CompletableFuture<ParseOutcome>> pending = new ArrayList<>();
    for (int i = 0; i < xmlDocuments.size(); i++) {
      int index = i;
      String xml = xmlDocuments.get(i);
      pending.add(submit(index, xml));
    }

    ShadowCodeGraph.Builder builder = ShadowCodeGraph.builder();
    List<DocumentFailure> failures = new ArrayList<>();
    Map<Integer, List<String>> validationErrors = new LinkedHashMap<>();

    for (int i = 0; i < pending.size(); i++) {
      ParseOutcome outcome = await(i, pending.get(i));
      if (!outcome.validationErrors().isEmpty()) {
        validationErrors.put(i, outcome.validationErrors());
      }
      if (outcome.document() != null) {
        graphBuilderService.mergeDocument(builder, outcome.document());
      } else {
        failures.add(new DocumentFailure(i, outcome.errorMessage()));
      }
    }

    ShadowCodeGraph graph = builder.seal();
    List<Finding> findings = loopholeDetector.detect(graph);
    for (Finding finding : findings) {
      meterRegistry.counter("loopholes.detected", "type", finding.type().getCode()).increment();
    }

    log.info(
        "Bill {}: {} nodes, {} edges, {} findings, {} failed documents",
        billId,
        graph.nodeCount(),
        graph.edgeCount(),
        findings.size(),
        failures.size());
    return new AnalysisReport(
        billId, xmlDocuments.size(), graph, findings, failures, validationErrors);
  }

  @Override
  public ValidationResult validate(String xml) {
    return parser.validate(xml);
  }

  // ---- private helpers ----

  private CompletableFuture<ParseOutcome> submit(int index, String xml) {
    try {
      return CompletableFuture.supplyAsync(() -> parseOne(index, xml), documentParsingExecutor);
    } catch (RejectedExecutionException e) {
      log.debug("Parsing pool saturated, parsing document {} on the calling thread", index);
      return CompletableFuture.completedFuture(parseOne(index, xml));
    }
  }

  private ParseOutcome parseOne(int index, String xml) {
    DocumentInspection inspection = parser.inspect(xml);
    List<String> validationErrors = inspection.validation().errors();
    if (inspection.isParsed()) {
      meterRegistry.counter("uslm.documents.parsed").increment();
      return new ParseOutcome(inspection.document(), null, validationErrors);
    }
    meterRegistry.counter("uslm.documents.failed").increment();
    log.warn("Document {} could not be parsed: {}", index, inspection.parseError());
    return new ParseOutcome(null, inspection.parseError(), validationErrors);
  }

  private ParseOutcome await(int index, CompletableFuture<ParseOutcome> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      meterRegistry.counter("uslm.documents.failed").increment();
      log.error("Unexpected failure parsing document {}: {}", index, cause.getMessage(), cause);
      return new ParseOutcome(null, cause.getMessage(), List.of());
    }
  }

  private record ParseOutcome(
      UslmDocument document, String errorMessage, List<String> validationErrors) {}
}
