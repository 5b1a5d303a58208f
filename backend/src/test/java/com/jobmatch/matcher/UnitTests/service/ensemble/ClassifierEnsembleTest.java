package com.jobmatch.matcher.UnitTests.service.ensemble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.jobmatch.matcher.service.ensemble.ClassifierEnsemble;
import com.jobmatch.matcher.service.ensemble.ConstantClassifier;
import com.jobmatch.matcher.service.ensemble.ScoredClassifier;

@DisplayName("ClassifierEnsemble Tests")
class ClassifierEnsembleTest {

  @Test
  @DisplayName("Should report the most accurate member, earliest on ties")
  void shouldReportBestModel() {
    ClassifierEnsemble ensemble =
        new ClassifierEnsemble(
            List.of(
                scored("RandomForest", 0.8),
                scored("SVM", 0.95),
                scored("KNN", 0.95),
                scored("GradientBoosting", 0.7)));

    assertThat(ensemble.getBestModel()).isEqualTo("SVM");
    assertThat(ensemble.getScores()).containsEntry("KNN", 0.95).hasSize(4);
  }

  @Test
  @DisplayName("Should reject duplicate member names")
  void shouldRejectDuplicates() {
    assertThatThrownBy(
            () -> new ClassifierEnsemble(List.of(scored("SVM", 0.5), scored("SVM", 0.6))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("SVM");
  }

  @Test
  @DisplayName("Should reject an empty roster")
  void shouldRejectEmptyRoster() {
    assertThatThrownBy(() -> new ClassifierEnsemble(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static ScoredClassifier scored(String name, double accuracy) {
    return new ScoredClassifier(name, new ConstantClassifier(0), accuracy);
  }
}
