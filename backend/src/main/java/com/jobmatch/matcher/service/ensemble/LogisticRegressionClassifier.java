package com.jobmatch.matcher.service.ensemble;

import java.util.OptionalDouble;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Multinomial logistic regression with L2 penalty ({@code C = 1}) and balanced class weights,
 * fitted by full-batch gradient descent with a step derived from the loss curvature bound.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class LogisticRegressionClassifier implements ClusterClassifier {

  private static final double C = 1.0;
  private static final int MAX_ITERATIONS = 300;
  private static final double GRADIENT_TOLERANCE = 1e-6;

  private int[] classes;
  private double[][] weights;
  private double[] intercepts;

  private LogisticRegressionClassifier() {}

  public static LogisticRegressionClassifier fit(double[][] x, int[] y) {
    LogisticRegressionClassifier model = new LogisticRegressionClassifier();
    model.classes = ClassifierSupport.classes(y);
    int[] encoded = ClassifierSupport.encode(y, model.classes);
    int classCount = model.classes.length;
    int dimension = x[0].length;
    int n = x.length;
    double[] sampleWeights = ClassifierSupport.balancedWeights(encoded, classCount);

    double curvature = 0.0;
    for (int i = 0; i < n; i++) {
      curvature += sampleWeights[i] * (ClassifierSupport.dot(x[i], x[i]) + 1.0);
    }
    double penalty = 1.0 / (C * n);
    double learningRate = 1.0 / (0.5 * curvature / n + penalty);

    model.weights = new double[classCount][dimension];
    model.intercepts = new double[classCount];
    for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
      double[][] gradW = new double[classCount][dimension];
      double[] gradB = new double[classCount];
      for (int i = 0; i < n; i++) {
        double[] p = ClassifierSupport.softmax(model.scores(x[i]));
        for (int c = 0; c < classCount; c++) {
          double error = sampleWeights[i] * (p[c] - (encoded[i] == c ? 1.0 : 0.0)) / n;
          if (error == 0.0) {
            continue;
          }
          double[] g = gradW[c];
          for (int d = 0; d < dimension; d++) {
            g[d] += error * x[i][d];
          }
          gradB[c] += error;
        }
      }

      double norm = 0.0;
      for (int c = 0; c < classCount; c++) {
        for (int d = 0; d < dimension; d++) {
          double g = gradW[c][d] + penalty * model.weights[c][d];
          model.weights[c][d] -= learningRate * g;
          norm += g * g;
        }
        model.intercepts[c] -= learningRate * gradB[c];
        norm += gradB[c] * gradB[c];
      }
      if (Math.sqrt(norm) < GRADIENT_TOLERANCE) {
        break;
      }
    }
    return model;
  }

  private double[] scores(double[] vector) {
    double[] scores = new double[weights.length];
    for (int c = 0; c < weights.length; c++) {
      scores[c] = ClassifierSupport.dot(weights[c], vector) + intercepts[c];
    }
    return scores;
  }

  double[] probabilities(double[] vector) {
    return ClassifierSupport.softmax(scores(vector));
  }

  @Override
  public int predict(double[] vector) {
    return classes[ClassifierSupport.argmax(probabilities(vector))];
  }

  @Override
  public OptionalDouble predictConfidence(double[] vector) {
    double[] probabilities = probabilities(vector);
    return OptionalDouble.of(probabilities[ClassifierSupport.argmax(probabilities)]);
  }
}
