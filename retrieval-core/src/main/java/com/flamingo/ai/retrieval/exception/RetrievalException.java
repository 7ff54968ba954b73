package com.flamingo.ai.retrieval.exception;

/** Exception thrown when every attempted retrieval path failed for a query. */
public class RetrievalException extends RuntimeException {

  private final String userMessage;

  public RetrievalException(String message) {
    super(message);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public RetrievalException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
