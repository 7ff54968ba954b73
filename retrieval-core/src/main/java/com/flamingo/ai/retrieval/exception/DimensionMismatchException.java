package com.flamingo.ai.retrieval.exception;

/** Exception thrown when a vector's length differs from its collection's dimension. */
public class DimensionMismatchException extends RuntimeException {

  private final String collection;
  private final int expected;
  private final int actual;

  public DimensionMismatchException(String collection, int expected, int actual) {
    super(
        String.format(
            "Vector dimension mismatch for collection '%s': expected %d but got %d",
            collection, expected, actual));
    this.collection = collection;
    this.expected = expected;
    this.actual = actual;
  }

  public String getCollection() {
    return collection;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
