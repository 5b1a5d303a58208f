package com.jobmatch.matcher.service.clustering;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Kneedle knee detection for a convex, decreasing curve such as within-cluster dispersion against
 * cluster count. Returns the first knee found, scanning left to right, with sensitivity
 * {@code S = 1}.
 */
public final class KneeLocator {

  private static final double SENSITIVITY = 1.0;

  private KneeLocator() {}

  /**
   * @param x strictly increasing candidate counts
   * @param y curve values, one per candidate
   * @return the x value at the knee, or empty if the curve has none
   */
  public static OptionalInt findKnee(int[] x, double[] y) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("x and y must have the same length");
    }
    int n = x.length;
    if (n < 3) {
      return OptionalInt.empty();
    }

    double[] xs = new double[n];
    for (int i = 0; i < n; i++) {
      xs[i] = x[i];
    }
    double[] xNorm = normalize(xs);
    double[] yNorm = normalize(y);
    if (xNorm == null || yNorm == null) {
      return OptionalInt.empty();
    }

    // convex and decreasing: flip the curve into a knee
    double[] difference = new double[n];
    for (int i = 0; i < n; i++) {
      difference[i] = (1.0 - yNorm[i]) - xNorm[i];
    }

    List<Integer> maxima = extrema(difference, true);
    List<Integer> minima = extrema(difference, false);
    if (maxima.isEmpty()) {
      return OptionalInt.empty();
    }

    double meanStep = 0.0;
    for (int i = 1; i < n; i++) {
      meanStep += xNorm[i] - xNorm[i - 1];
    }
    meanStep = Math.abs(meanStep / (n - 1));

    double threshold = 0.0;
    int thresholdIndex = 0;
    for (int i = maxima.get(0); i < n; i++) {
      if (xNorm[i] == 1.0) {
        break;
      }
      if (maxima.contains(i)) {
        threshold = difference[i] - SENSITIVITY * meanStep;
        thresholdIndex = i;
      }
      if (minima.contains(i)) {
        threshold = 0.0;
      }
      if (difference[i + 1] < threshold) {
        return OptionalInt.of(x[thresholdIndex]);
      }
    }
    return OptionalInt.empty();
  }

  private static double[] normalize(double[] values) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double value : values) {
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    double range = max - min;
    if (!(range > 0.0) || Double.isInfinite(range)) {
      return null;
    }
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = (values[i] - min) / range;
    }
    return out;
  }

  /** Relative extrema with clipped neighbours; plateaus count as extrema. */
  private static List<Integer> extrema(double[] values, boolean maxima) {
    List<Integer> indices = new ArrayList<>();
    int last = values.length - 1;
    for (int i = 0; i <= last; i++) {
      double left = values[Math.max(i - 1, 0)];
      double right = values[Math.min(i + 1, last)];
      boolean extremum =
          maxima
              ? values[i] >= left && values[i] >= right
              : values[i] <= left && values[i] <= right;
      if (extremum) {
        indices.add(i);
      }
    }
    return indices;
  }
}
