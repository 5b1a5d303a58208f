package com.jobmatch.matcher.service.ensemble;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Multiclass gradient boosting on the softmax log-loss. Each round fits one shallow regression tree
 * per class to the residuals and replaces leaf values with a Newton step. Splits are searched over
 * a random {@code sqrt(d)} feature subset to keep training time bounded on wide embeddings.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class GradientBoostingClassifier implements ClusterClassifier {

  private static final double LEARNING_RATE = 0.1;
  private static final int MAX_DEPTH = 3;

  private int[] classes;
  private double[] prior;
  private List<List<DecisionTree>> rounds;

  private GradientBoostingClassifier() {}

  public static GradientBoostingClassifier fit(double[][] x, int[] y, int roundCount, long seed) {
    GradientBoostingClassifier model = new GradientBoostingClassifier();
    model.classes = ClassifierSupport.classes(y);
    int[] encoded = ClassifierSupport.encode(y, model.classes);
    int classCount = model.classes.length;
    int n = x.length;
    int maxFeatures = ClassifierSupport.featureSubsetSize(x[0].length);
    Random random = new Random(seed);

    model.prior = new double[classCount];
    for (int label : encoded) {
      model.prior[label] += 1.0;
    }
    for (int c = 0; c < classCount; c++) {
      model.prior[c] = Math.log(model.prior[c] / n);
    }

    double[][] raw = new double[n][];
    for (int i = 0; i < n; i++) {
      raw[i] = model.prior.clone();
    }
    int[] allRows = new int[n];
    for (int i = 0; i < n; i++) {
      allRows[i] = i;
    }

    model.rounds = new ArrayList<>(roundCount);
    for (int round = 0; round < roundCount; round++) {
      double[][] probabilities = new double[n][];
      for (int i = 0; i < n; i++) {
        probabilities[i] = ClassifierSupport.softmax(raw[i]);
      }

      List<DecisionTree> trees = new ArrayList<>(classCount);
      for (int c = 0; c < classCount; c++) {
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
          residuals[i] = (encoded[i] == c ? 1.0 : 0.0) - probabilities[i][c];
        }
        DecisionTree tree =
            DecisionTree.regressor(
                x, residuals, allRows, MAX_DEPTH, maxFeatures, new Random(random.nextLong()));
        newtonStep(tree, x, residuals, classCount);
        for (int i = 0; i < n; i++) {
          raw[i][c] += LEARNING_RATE * tree.output(x[i])[0];
        }
        trees.add(tree);
      }
      model.rounds.add(trees);
    }
    return model;
  }

  private static void newtonStep(
      DecisionTree tree, double[][] x, double[] residuals, int classCount) {
    double[] numerator = new double[tree.nodeCount()];
    double[] denominator = new double[tree.nodeCount()];
    boolean[] reached = new boolean[tree.nodeCount()];
    for (int i = 0; i < x.length; i++) {
      int leaf = tree.leaf(x[i]);
      double r = residuals[i];
      numerator[leaf] += r;
      denominator[leaf] += Math.abs(r) * (1.0 - Math.abs(r));
      reached[leaf] = true;
    }
    double scale = (classCount - 1.0) / classCount;
    for (int node = 0; node < reached.length; node++) {
      if (reached[node]) {
        double value =
            Math.abs(denominator[node]) < 1e-150
                ? 0.0
                : scale * numerator[node] / denominator[node];
        tree.setLeafValue(node, value);
      }
    }
  }

  double[] probabilities(double[] vector) {
    double[] raw = prior.clone();
    for (List<DecisionTree> trees : rounds) {
      for (int c = 0; c < trees.size(); c++) {
        raw[c] += LEARNING_RATE * trees.get(c).output(vector)[0];
      }
    }
    return ClassifierSupport.softmax(raw);
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
