package com.flamingo.ai.hybridrag.exception;

/**
 * A passage index could not be queried. Inside the retrieval pipeline this is absorbed by circuit
 * breaker fallbacks; it only reaches the HTTP layer when no fallback applies.
 */
public class SearchException extends RuntimeException {

  private static final String USER_MESSAGE =
      "Passage search is temporarily unavailable. Please try again.";

  private final String index;

  public SearchException(String message) {
    super(message);
    this.index = null;
  }

  public SearchException(String index, String operation, Throwable cause) {
    super(operation + " failed for index " + index, cause);
    this.index = index;
  }

  /** Index that failed, null when unknown. */
  public String getIndex() {
    return index;
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
