package com.jobmatch.matcher.service.ensemble;

import java.util.Random;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Linear soft-margin SVM trained one-vs-rest with averaged Pegasos. The decision is the class with
 * the largest margin; no probability is produced.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class LinearSvmClassifier implements ClusterClassifier {

  private static final double C = 1.0;

  private int[] classes;
  private double[][] weights;
  private double[] bias;

  private LinearSvmClassifier() {}

  public static LinearSvmClassifier fit(double[][] x, int[] y, long seed) {
    LinearSvmClassifier svm = new LinearSvmClassifier();
    svm.classes = ClassifierSupport.classes(y);
    int[] encoded = ClassifierSupport.encode(y, svm.classes);
    int classCount = svm.classes.length;
    int dimension = x[0].length;
    int n = x.length;

    double lambda = 1.0 / (C * n);
    int iterations = Math.min(100_000, Math.max(1_000, 20 * n));
    Random random = new Random(seed);

    svm.weights = new double[classCount][];
    svm.bias = new double[classCount];
    for (int c = 0; c < classCount; c++) {
      int positives = 0;
      for (int label : encoded) {
        if (label == c) {
          positives++;
        }
      }
      double positiveWeight = positives == 0 ? 0.0 : n / (2.0 * positives);
      double negativeWeight = positives == n ? 0.0 : n / (2.0 * (n - positives));

      double[] w = new double[dimension];
      double b = 0.0;
      double[] averageW = new double[dimension];
      double averageB = 0.0;
      int averaged = 0;
      for (int t = 1; t <= iterations; t++) {
        int i = random.nextInt(n);
        double target = encoded[i] == c ? 1.0 : -1.0;
        double sampleWeight = target > 0 ? positiveWeight : negativeWeight;
        double eta = 1.0 / (lambda * (t + n));
        double margin = target * (ClassifierSupport.dot(w, x[i]) + b);

        double shrink = 1.0 - eta * lambda;
        for (int d = 0; d < dimension; d++) {
          w[d] *= shrink;
        }
        if (margin < 1.0) {
          double step = eta * sampleWeight * target;
          for (int d = 0; d < dimension; d++) {
            w[d] += step * x[i][d];
          }
          b += step;
        }

        if (t > iterations / 2) {
          averaged++;
          for (int d = 0; d < dimension; d++) {
            averageW[d] += (w[d] - averageW[d]) / averaged;
          }
          averageB += (b - averageB) / averaged;
        }
      }
      svm.weights[c] = averageW;
      svm.bias[c] = averageB;
    }
    return svm;
  }

  double[] decisionFunction(double[] vector) {
    double[] scores = new double[classes.length];
    for (int c = 0; c < classes.length; c++) {
      scores[c] = ClassifierSupport.dot(weights[c], vector) + bias[c];
    }
    return scores;
  }

  @Override
  public int predict(double[] vector) {
    return classes[ClassifierSupport.argmax(decisionFunction(vector))];
  }
}
