package com.flamingo.ai.retrieval.service.rag.model;

import java.util.Locale;

/** Similarity function of a vector collection. Larger scores always mean more similar. */
public enum DistanceMetric {
  COSINE {
    @Override
    public double similarity(float[] a, float[] b) {
      double dot = 0;
      double normA = 0;
      double normB = 0;
      for (int i = 0; i < a.length; i++) {
        dot += (double) a[i] * b[i];
        normA += (double) a[i] * a[i];
        normB += (double) b[i] * b[i];
      }
      if (normA == 0 || normB == 0) {
        return 0.0;
      }
      return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
  },
  DOT {
    @Override
    public double similarity(float[] a, float[] b) {
      double dot = 0;
      for (int i = 0; i < a.length; i++) {
        dot += (double) a[i] * b[i];
      }
      return dot;
    }
  },
  /** Reported as {@code 1 / (1 + distance)}, so identical vectors score 1.0. */
  EUCLIDEAN {
    @Override
    public double similarity(float[] a, float[] b) {
      double sum = 0;
      for (int i = 0; i < a.length; i++) {
        double d = (double) a[i] - b[i];
        sum += d * d;
      }
      return 1.0 / (1.0 + Math.sqrt(sum));
    }
  };

  /**
   * Scores two vectors of equal length.
   *
   * @param a first vector
   * @param b second vector
   * @return similarity, larger is better
   */
  public abstract double similarity(float[] a, float[] b);

  /**
   * Parses {@code cosine}, {@code dot} or {@code euclidean}.
   *
   * @param name metric name, case-insensitive
   * @return the metric
   */
  public static DistanceMetric fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
