package com.jobmatch.matcher.service.ensemble;

import java.util.Arrays;
import java.util.Comparator;
import java.util.OptionalDouble;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.jobmatch.matcher.service.clustering.VectorMath;

/**
 * Uniform-weight k-nearest-neighbours vote in Euclidean space. The probability of a class is the
 * share of neighbours carrying it.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class KNearestNeighborsClassifier implements ClusterClassifier {

  private int neighbors;
  private int[] classes;
  private double[][] points;
  private int[] labels;

  private KNearestNeighborsClassifier() {}

  public static KNearestNeighborsClassifier fit(double[][] x, int[] y, int neighbors) {
    KNearestNeighborsClassifier model = new KNearestNeighborsClassifier();
    model.classes = ClassifierSupport.classes(y);
    model.labels = ClassifierSupport.encode(y, model.classes);
    model.points = VectorMath.copy(x);
    model.neighbors = Math.max(1, Math.min(neighbors, x.length));
    return model;
  }

  double[] probabilities(double[] vector) {
    Integer[] order = new Integer[points.length];
    double[] distances = new double[points.length];
    for (int i = 0; i < points.length; i++) {
      order[i] = i;
      distances[i] = VectorMath.squaredEuclidean(points[i], vector);
    }
    Arrays.sort(order, Comparator.comparingDouble(i -> distances[i]));

    double[] votes = new double[classes.length];
    for (int i = 0; i < neighbors; i++) {
      votes[labels[order[i]]] += 1.0 / neighbors;
    }
    return votes;
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
