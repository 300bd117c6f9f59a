package com.flamingo.ai.factcheck.exception;

/** Exception thrown when a language model call fails. */
public class LlmServiceException extends RuntimeException {

  private final String operation;

  public LlmServiceException(String operation, Throwable cause) {
    super(operation + " failed: " + describe(cause), cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }

  public String getUserMessage() {
    return "AI service is temporarily unavailable. Please try again later.";
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown cause";
    }
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }
}
