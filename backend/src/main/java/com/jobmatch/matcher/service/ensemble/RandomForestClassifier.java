package com.jobmatch.matcher.service.ensemble;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Bagged Gini trees grown to purity on bootstrap samples, each split drawn from {@code sqrt(d)}
 * random features. Class weights are balanced over the training labels.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class RandomForestClassifier implements ClusterClassifier {

  private int[] classes;
  private List<DecisionTree> trees;

  private RandomForestClassifier() {}

  public static RandomForestClassifier fit(double[][] x, int[] y, int treeCount, long seed) {
    RandomForestClassifier forest = new RandomForestClassifier();
    forest.classes = ClassifierSupport.classes(y);
    int[] encoded = ClassifierSupport.encode(y, forest.classes);
    double[] classWeights = ClassifierSupport.balancedWeights(encoded, forest.classes.length);
    int maxFeatures = ClassifierSupport.featureSubsetSize(x[0].length);

    Random random = new Random(seed);
    forest.trees = new ArrayList<>(treeCount);
    for (int t = 0; t < treeCount; t++) {
      double[] weights = new double[x.length];
      for (int draw = 0; draw < x.length; draw++) {
        int row = random.nextInt(x.length);
        weights[row] += classWeights[row];
      }
      forest.trees.add(
          DecisionTree.classifier(
              x,
              encoded,
              forest.classes.length,
              weights,
              Integer.MAX_VALUE,
              maxFeatures,
              new Random(random.nextLong())));
    }
    return forest;
  }

  double[] probabilities(double[] vector) {
    double[] sum = new double[classes.length];
    for (DecisionTree tree : trees) {
      double[] leaf = tree.output(vector);
      for (int c = 0; c < sum.length; c++) {
        sum[c] += leaf[c];
      }
    }
    for (int c = 0; c < sum.length; c++) {
      sum[c] /= trees.size();
    }
    return sum;
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
