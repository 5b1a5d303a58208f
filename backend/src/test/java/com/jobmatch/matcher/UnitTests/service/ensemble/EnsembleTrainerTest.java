package com.jobmatch.matcher.UnitTests.service.ensemble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.jobmatch.matcher.fixtures.MatcherFixtures;
import com.jobmatch.matcher.service.ensemble.ClassifierEnsemble;
import com.jobmatch.matcher.service.ensemble.ConstantClassifier;
import com.jobmatch.matcher.service.ensemble.EnsembleTrainer;
import com.jobmatch.matcher.service.ensemble.ScoredClassifier;

@DisplayName("EnsembleTrainer Tests")
class EnsembleTrainerTest {

  private EnsembleTrainer trainer;

  @BeforeEach
  void setUp() {
    trainer = new EnsembleTrainer(MatcherFixtures.properties());
  }

  @Nested
  @DisplayName("Roster")
  class Roster {

    @Test
    @DisplayName("Should fit the five families in voting order")
    void shouldFitRosterInOrder() {
      double[][] x = MatcherFixtures.blobs(3, 20, 8, 11L);
      int[] y = MatcherFixtures.blobLabels(3, 20);

      ClassifierEnsemble ensemble = trainer.train(x, y);

      assertThat(ensemble.getMembers().keySet())
          .containsExactly("RandomForest", "SVM", "LogisticRegression", "KNN", "GradientBoosting");
      assertThat(ensemble.size()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should score every member highly on separated groups")
    void shouldScoreHighlyOnSeparatedGroups() {
      double[][] x = MatcherFixtures.blobs(3, 20, 8, 12L);
      int[] y = MatcherFixtures.blobLabels(3, 20);

      ClassifierEnsemble ensemble = trainer.train(x, y);

      assertThat(ensemble.getScores().values())
          .allSatisfy(score -> assertThat(score).isGreaterThan(0.8));
    }

    @Test
    @DisplayName("Should predict the group of a fresh point near its centre")
    void shouldPredictFreshPoint() {
      double[][] x = MatcherFixtures.blobs(3, 20, 8, 13L);
      int[] y = MatcherFixtures.blobLabels(3, 20);
      double[] sample = {0.05, 0.05, 1.05, 0.05, 0.05, 0.05, 0.05, 0.05};

      ClassifierEnsemble ensemble = trainer.train(x, y);

      for (ScoredClassifier member : ensemble.getMembers().values()) {
        assertThat(member.getClassifier().predict(sample)).as(member.getName()).isEqualTo(2);
      }
    }
  }

  @Nested
  @DisplayName("Degenerate input")
  class DegenerateInput {

    @Test
    @DisplayName("Should fall back to constant classifiers when every label is the same")
    void shouldUseConstantClassifiersForSingleLabel() {
      double[][] x = MatcherFixtures.blobs(1, 6, 4, 5L);
      int[] y = new int[6];

      ClassifierEnsemble ensemble = trainer.train(x, y);

      assertThat(ensemble.getMembers().values())
          .allSatisfy(
              member -> {
                assertThat(member.getClassifier()).isInstanceOf(ConstantClassifier.class);
                assertThat(member.getAccuracy()).isEqualTo(1.0);
              });
    }

    @Test
    @DisplayName("Should reject mismatched labels")
    void shouldRejectMismatchedLabels() {
      double[][] x = MatcherFixtures.blobs(2, 3, 4, 5L);

      assertThatThrownBy(() -> trainer.train(x, new int[5]))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject an empty training set")
    void shouldRejectEmptyInput() {
      assertThatThrownBy(() -> trainer.train(new double[0][], new int[0]))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
