package com.flamingo.ai.retrieval.exception;

/**
 * Exception thrown when an external provider (embedding model, vector index, reranker) cannot be
 * reached or returns an unusable response after bounded retries.
 */
public class ProviderUnavailableException extends RuntimeException {

  private final String provider;
  private final String userMessage;

  public ProviderUnavailableException(String provider, String message) {
    super(message);
    this.provider = provider;
    this.userMessage = "A retrieval service is temporarily unavailable. Please try again later.";
  }

  public ProviderUnavailableException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.userMessage = "A retrieval service is temporarily unavailable. Please try again later.";
  }

  public String getProvider() {
    return provider;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
