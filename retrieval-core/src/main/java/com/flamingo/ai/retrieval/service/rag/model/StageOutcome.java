package com.flamingo.ai.retrieval.service.rag.model;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Result of one pipeline stage: either a value or the failure that prevented it.
 *
 * @param value stage output, {@code null} on failure
 * @param error unwrapped failure cause, {@code null} on success
 * @param <T> stage output type
 */
public record StageOutcome<T>(T value, Throwable error) {

  public static <T> StageOutcome<T> success(T value) {
    return new StageOutcome<>(value, null);
  }

  public static <T> StageOutcome<T> failure(Throwable error) {
    return new StageOutcome<>(null, unwrap(error));
  }

  /** Adapter for {@code CompletableFuture.handle}. */
  public static <T> StageOutcome<T> of(T value, Throwable error) {
    return error == null ? success(value) : failure(error);
  }

  public boolean succeeded() {
    return error == null;
  }

  public boolean timedOut() {
    return error instanceof TimeoutException;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
