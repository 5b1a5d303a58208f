package com.jobmatch.matcher.service.ensemble;

import java.util.Arrays;
import java.util.TreeSet;

/** Label bookkeeping shared by the classifier families. */
final class ClassifierSupport {

  private ClassifierSupport() {}

  /** Distinct labels in ascending order. */
  static int[] classes(int[] labels) {
    TreeSet<Integer> distinct = new TreeSet<>();
    for (int label : labels) {
      distinct.add(label);
    }
    return distinct.stream().mapToInt(Integer::intValue).toArray();
  }

  /** Position of each label in {@code classes}. */
  static int[] encode(int[] labels, int[] classes) {
    int[] encoded = new int[labels.length];
    for (int i = 0; i < labels.length; i++) {
      encoded[i] = Arrays.binarySearch(classes, labels[i]);
    }
    return encoded;
  }

  /** Weights inversely proportional to class frequency: {@code n / (classes * count)}. */
  static double[] balancedWeights(int[] encoded, int classCount) {
    double[] counts = new double[classCount];
    for (int label : encoded) {
      counts[label]++;
    }
    double[] weights = new double[encoded.length];
    for (int i = 0; i < encoded.length; i++) {
      weights[i] = encoded.length / (classCount * counts[encoded[i]]);
    }
    return weights;
  }

  /** Index of the largest value, lowest index on ties. */
  static int argmax(double[] values) {
    int best = 0;
    for (int i = 1; i < values.length; i++) {
      if (values[i] > values[best]) {
        best = i;
      }
    }
    return best;
  }

  static double[] softmax(double[] scores) {
    double max = Double.NEGATIVE_INFINITY;
    for (double score : scores) {
      max = Math.max(max, score);
    }
    double[] out = new double[scores.length];
    double sum = 0.0;
    for (int i = 0; i < scores.length; i++) {
      out[i] = Math.exp(scores[i] - max);
      sum += out[i];
    }
    for (int i = 0; i < out.length; i++) {
      out[i] /= sum;
    }
    return out;
  }

  static double dot(double[] weights, double[] vector) {
    double sum = 0.0;
    for (int i = 0; i < vector.length; i++) {
      sum += weights[i] * vector[i];
    }
    return sum;
  }

  static int featureSubsetSize(int dimension) {
    return Math.max(1, (int) Math.sqrt(dimension));
  }
}
