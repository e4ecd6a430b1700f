package com.flamingo.ai.redteam.service.analysis;

import com.flamingo.ai.redteam.service.uslm.model.ValidationResult;
import java.util.List;

/** Service interface for the parse, merge and detect pipeline. */
public interface LegislativeAnalysisService {

  /**
   * Parses a batch of USLM documents, merges them into one graph and runs loophole detection.
   *
   * <p>A document that fails to parse is reported in {@link AnalysisReport#failures()} and does not
   * abort the batch.
   *
   * @param billId bill the batch belongs to, may be {@code null}
   * @param xmlDocuments raw XML texts
   * @return the analysis report
   */
  AnalysisReport analyze(String billId, List<String> xmlDocuments);

  /**
   * Validates a single document's structure.
   *
   * @param xml raw XML text
   * @return validation result; never throws
   */
  ValidationResult validate(String xml);
}
