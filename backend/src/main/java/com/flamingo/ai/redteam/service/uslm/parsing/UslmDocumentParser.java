package com.flamingo.ai.redteam.service.uslm.parsing;

import com.flamingo.ai.redteam.service.uslm.model.DocumentInspection;
import com.flamingo.ai.redteam.service.uslm.model.UslmDocument;
import com.flamingo.ai.redteam.service.uslm.model.ValidationResult;

/**
 * Parses raw USLM markup into a {@link UslmDocument}.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * parsing threads.
 */
public interface UslmDocumentParser {

  /**
   * Parses one document into its element tree and flattened reference list.
   *
   * <p>Missing but recoverable structure (no recognised root, no namespace) yields a best-effort,
   * possibly empty, document rather than an exception.
   *
   * @param xml raw XML text
   * @return parsed document
   * @throws com.flamingo.ai.redteam.exception.MalformedDocumentException if the markup cannot be
   *     tokenized
   */
  UslmDocument parse(String xml);

  /**
   * Runs structural sanity checks. Never throws.
   *
   * @param xml raw XML text
   * @return one error per violated rule; valid iff there are none
   */
  ValidationResult validate(String xml);

  /**
   * Parses and validates in a single pass over the markup. Never throws.
   *
   * <p>The validation errors equal those of {@link #validate(String)}. The document equals the
   * result of {@link #parse(String)}, or is absent when the markup cannot be tokenized.
   *
   * @param xml raw XML text
   * @return the parsed document (if any) together with its validation result
   */
  DocumentInspection inspect(String xml);
}
