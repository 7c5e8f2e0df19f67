package com.flamingo.ai.hybridrag.exception;

/** Exception thrown when query text or result count is structurally invalid. */
public class InvalidQueryException extends RuntimeException {

  private final String userMessage;

  public InvalidQueryException(String message) {
    super(message);
    this.userMessage = message;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
