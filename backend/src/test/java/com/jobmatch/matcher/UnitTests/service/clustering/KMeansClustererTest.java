package com.jobmatch.matcher.UnitTests.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.jobmatch.matcher.fixtures.MatcherFixtures;
import com.jobmatch.matcher.service.clustering.CentroidModel;
import com.jobmatch.matcher.service.clustering.KMeansClusterer;

@DisplayName("KMeansClusterer Tests")
class KMeansClustererTest {

  private KMeansClusterer clusterer;
  private double[][] points;

  @BeforeEach
  void setUp() {
    clusterer = new KMeansClusterer(MatcherFixtures.properties());
    points = MatcherFixtures.blobs(3, 10, 4, 7L);
  }

  @Test
  @DisplayName("Should recover well separated groups")
  void shouldRecoverSeparatedGroups() {
    CentroidModel model = clusterer.fit(points, 3);
    int[] labels = model.getLabels();

    assertThat(model.getClusterCount()).isEqualTo(3);
    assertThat(labels).hasSize(points.length);
    for (int group = 0; group < 3; group++) {
      int first = labels[group * 10];
      for (int i = group * 10; i < group * 10 + 10; i++) {
        assertThat(labels[i]).isEqualTo(first);
      }
    }
    assertThat(labels[0]).isNotEqualTo(labels[10]);
    assertThat(labels[10]).isNotEqualTo(labels[20]);
  }

  @Test
  @DisplayName("Every label lies in [0, k)")
  void labelsInRange() {
    for (int k = 1; k <= 6; k++) {
      CentroidModel model = clusterer.fit(points, k);
      assertThat(IntStream.of(model.getLabels()))
          .allMatch(label -> label >= 0 && label < model.getClusterCount());
    }
  }

  @Test
  @DisplayName("Same seed gives the same model")
  void deterministic() {
    CentroidModel first = clusterer.fit(points, 4);
    CentroidModel second = clusterer.fit(points, 4);

    assertThat(second.getLabels()).containsExactly(first.getLabels());
    assertThat(second.getDispersion()).isEqualTo(first.getDispersion());
  }

  @Test
  @DisplayName("Warm start never increases dispersion")
  void warmStartNeverIncreasesDispersion() {
    CentroidModel previous = clusterer.fit(points, 1);
    for (int k = 2; k <= 8; k++) {
      CentroidModel next = clusterer.fit(points, k, previous);
      assertThat(next.getDispersion()).isLessThanOrEqualTo(previous.getDispersion());
      previous = next;
    }
  }

  @Test
  @DisplayName("Dispersion matches the recomputed value for the centroids")
  void dispersionMatchesCentroids() {
    CentroidModel model = clusterer.fit(points, 3);

    assertThat(KMeansClusterer.dispersion(points, model.getCentroids()))
        .isCloseTo(model.getDispersion(), within(1e-9));
  }

  @Test
  @DisplayName("Rejects empty input and impossible cluster counts")
  void rejectsInvalidInput() {
    assertThatThrownBy(() -> clusterer.fit(new double[0][], 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> clusterer.fit(points, points.length + 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> clusterer.fit(points, 0)).isInstanceOf(IllegalArgumentException.class);
  }
}
