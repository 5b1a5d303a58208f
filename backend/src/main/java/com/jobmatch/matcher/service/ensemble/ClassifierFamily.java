package com.jobmatch.matcher.service.ensemble;

import com.jobmatch.matcher.config.MatcherProperties;

/** The fixed roster, in voting order. The model name doubles as the artifact file stem. */
public enum ClassifierFamily {
  RANDOM_FOREST("RandomForest") {
    @Override
    ClusterClassifier fit(double[][] x, int[] y, MatcherProperties.Ensemble config) {
      return RandomForestClassifier.fit(x, y, config.getForestTrees(), config.getRandomSeed());
    }
  },
  SVM("SVM") {
    @Override
    ClusterClassifier fit(double[][] x, int[] y, MatcherProperties.Ensemble config) {
      return LinearSvmClassifier.fit(x, y, config.getRandomSeed());
    }
  },
  LOGISTIC_REGRESSION("LogisticRegression") {
    @Override
    ClusterClassifier fit(double[][] x, int[] y, MatcherProperties.Ensemble config) {
      return LogisticRegressionClassifier.fit(x, y);
    }
  },
  KNN("KNN") {
    @Override
    ClusterClassifier fit(double[][] x, int[] y, MatcherProperties.Ensemble config) {
      return KNearestNeighborsClassifier.fit(x, y, config.getNeighbors());
    }
  },
  GRADIENT_BOOSTING("GradientBoosting") {
    @Override
    ClusterClassifier fit(double[][] x, int[] y, MatcherProperties.Ensemble config) {
      return GradientBoostingClassifier.fit(
          x, y, config.getBoostingRounds(), config.getRandomSeed());
    }
  };

  private final String modelName;

  ClassifierFamily(String modelName) {
    this.modelName = modelName;
  }

  public String getModelName() {
    return modelName;
  }

  /** Fits this family on training rows holding at least two distinct labels. */
  abstract ClusterClassifier fit(double[][] x, int[] y, MatcherProperties.Ensemble config);
}
