package com.flamingo.ai.redteam.exception;

/**
 * Exception thrown when a document's markup cannot be tokenized at all.
 *
 * <p>Fatal only to the parse call that raised it. Structurally incomplete but well-formed markup
 * never raises this; it is reported by validation instead. Batch analysis records it as a
 * per-document failure, so it never reaches the REST layer.
 */
public class MalformedDocumentException extends RuntimeException {

  public MalformedDocumentException(String message) {
    super(message);
  }

  public MalformedDocumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
