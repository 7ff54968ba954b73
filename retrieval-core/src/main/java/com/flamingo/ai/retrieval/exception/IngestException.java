package com.flamingo.ai.retrieval.exception;

/** Exception thrown when chunking, embedding or indexing of one document fails. */
public class IngestException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public IngestException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to index document";
  }

  public IngestException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to index document";
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
