package com.flamingo.ai.factcheck.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MALFORMED_REQUEST = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short id that also appears in the server log line for this error. */
  private final String errorId;

  private final String code;

  /** User-facing message. */
  private final String message;

  private final Instant timestamp;

  private final String path;
}
