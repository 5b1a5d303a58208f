package com.jobmatch.matcher.service.clustering;

/** Dense vector helpers shared by clustering, classification and ranking. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity in [-1, 1]. A zero vector has similarity 0 with everything.
   *
   * @throws IllegalArgumentException if the vectors differ in dimension
   */
  public static double cosineSimilarity(double[] a, double[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException("Embeddings must have the same dimension");
    }
    double dotProduct = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dotProduct += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  public static double cosineDistance(double[] a, double[] b) {
    return 1.0 - cosineSimilarity(a, b);
  }

  public static double squaredEuclidean(double[] a, double[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double d = a[i] - b[i];
      sum += d * d;
    }
    return sum;
  }

  /** Index of the centroid closest to {@code point} in Euclidean distance, lowest index on ties. */
  public static int nearest(double[] point, double[][] centroids) {
    int best = 0;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int c = 0; c < centroids.length; c++) {
      double distance = squaredEuclidean(point, centroids[c]);
      if (distance < bestDistance) {
        bestDistance = distance;
        best = c;
      }
    }
    return best;
  }

  public static double[][] copy(double[][] matrix) {
    double[][] out = new double[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      out[i] = matrix[i].clone();
    }
    return out;
  }
}
