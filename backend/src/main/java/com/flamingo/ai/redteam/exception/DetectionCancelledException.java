package com.flamingo.ai.redteam.exception;

/** Exception thrown when a detection run notices its thread has been interrupted. */
public class DetectionCancelledException extends RuntimeException {

  private final String userMessage;

  public DetectionCancelledException(String message) {
    super(message);
    this.userMessage = "Loophole detection was cancelled. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
