package com.flamingo.ai.redteam.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DETECTION_CANCELLED = "DETECTION_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-facing error message. */
  private final String message;

  /** When the error was handled. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
