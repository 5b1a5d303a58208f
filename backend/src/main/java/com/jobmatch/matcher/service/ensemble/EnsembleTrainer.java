package com.jobmatch.matcher.service.ensemble;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fits every roster family on a seeded train split and scores each on the holdout rows. When the
 * training rows carry a single label every member degenerates to a {@link ConstantClassifier}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnsembleTrainer {

  private final MatcherProperties properties;

  public ClassifierEnsemble train(double[][] embeddings, int[] labels) {
    if (embeddings.length == 0 || embeddings.length != labels.length) {
      throw new IllegalArgumentException(
          "Need one label per embedding, got "
              + embeddings.length
              + " embeddings and "
              + labels.length
              + " labels");
    }
    MatcherProperties.Ensemble config = properties.getEnsemble();
    Split split = split(embeddings.length, config.getHoldoutFraction(), config.getRandomSeed());

    double[][] trainX = rows(embeddings, split.train);
    int[] trainY = rows(labels, split.train);
    double[][] testX = rows(embeddings, split.test);
    int[] testY = rows(labels, split.test);
    if (split.test.length == 0) {
      testX = trainX;
      testY = trainY;
    }

    int[] classes = ClassifierSupport.classes(trainY);
    List<ScoredClassifier> roster = new ArrayList<>();
    for (ClassifierFamily family : ClassifierFamily.values()) {
      ClusterClassifier classifier =
          classes.length < 2
              ? new ConstantClassifier(classes[0])
              : family.fit(trainX, trainY, config);
      double accuracy = accuracy(classifier, testX, testY);
      log.info("{} holdout accuracy: {}", family.getModelName(), accuracy);
      roster.add(new ScoredClassifier(family.getModelName(), classifier, accuracy));
    }
    return new ClassifierEnsemble(roster);
  }

  /**
   * Seeded shuffle split; the holdout takes {@code ceil(fraction * n)} rows but always leaves at
   * least one training row.
   */
  static Split split(int n, double holdoutFraction, long seed) {
    int[] order = new int[n];
    for (int i = 0; i < n; i++) {
      order[i] = i;
    }
    Random random = new Random(seed);
    for (int i = n - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      int tmp = order[i];
      order[i] = order[j];
      order[j] = tmp;
    }
    int testSize = Math.min((int) Math.ceil(holdoutFraction * n), n - 1);
    int[] test = new int[testSize];
    int[] train = new int[n - testSize];
    System.arraycopy(order, 0, test, 0, testSize);
    System.arraycopy(order, testSize, train, 0, n - testSize);
    return new Split(train, test);
  }

  static double accuracy(ClusterClassifier classifier, double[][] x, int[] y) {
    int correct = 0;
    for (int i = 0; i < x.length; i++) {
      if (classifier.predict(x[i]) == y[i]) {
        correct++;
      }
    }
    return x.length == 0 ? 0.0 : (double) correct / x.length;
  }

  private static double[][] rows(double[][] matrix, int[] indices) {
    double[][] out = new double[indices.length][];
    for (int i = 0; i < indices.length; i++) {
      out[i] = matrix[indices[i]];
    }
    return out;
  }

  private static int[] rows(int[] values, int[] indices) {
    int[] out = new int[indices.length];
    for (int i = 0; i < indices.length; i++) {
      out[i] = values[indices[i]];
    }
    return out;
  }

  static final class Split {
    final int[] train;
    final int[] test;

    Split(int[] train, int[] test) {
      this.train = train;
      this.test = test;
    }
  }
}
