package com.flamingo.ai.factcheck.exception;

/**
 * Thrown when an evidence provider fails: the vector index, the embedding model used to query it,
 * or the web search API.
 */
public class SearchException extends RuntimeException {

  private final String provider;
  private final String userMessage;

  public SearchException(String provider, String message) {
    super(message);
    this.provider = provider;
    this.userMessage = "Evidence search is temporarily unavailable. Please try again.";
  }

  public SearchException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.userMessage = "Evidence search is temporarily unavailable. Please try again.";
  }

  /** Name of the failing provider, e.g. "elasticsearch" or "tavily". */
  public String getProvider() {
    return provider;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
