package com.jobmatch.matcher.UnitTests.service.prediction;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.jobmatch.matcher.dto.prediction.RankedPosting;
import com.jobmatch.matcher.fixtures.MatcherFixtures;
import com.jobmatch.matcher.service.artifact.ArtifactBundle;
import com.jobmatch.matcher.service.clustering.CentroidModel;
import com.jobmatch.matcher.service.ensemble.ClassifierEnsemble;
import com.jobmatch.matcher.service.ensemble.ConstantClassifier;
import com.jobmatch.matcher.service.ensemble.ScoredClassifier;
import com.jobmatch.matcher.service.prediction.JobRanker;

@DisplayName("JobRanker Tests")
class JobRankerTest {

  private final JobRanker ranker = new JobRanker();

  @Test
  @DisplayName("Should keep only the requested cluster, best match first")
  void shouldRankWithinCluster() {
    double[][] embeddings = {
      {1.0, 0.0}, {0.6, 0.8}, {0.0, 1.0}, {0.8, 0.6}, {1.0, 0.0}
    };
    ArtifactBundle bundle = bundle(embeddings, new int[] {0, 0, 1, 0, 1});

    List<RankedPosting> ranked = ranker.rank(bundle, new double[] {1.0, 0.0}, 0);

    assertThat(ranked)
        .extracting(posting -> posting.getPosting().getUrl())
        .containsExactly(
            "https://jobs.example.com/0",
            "https://jobs.example.com/3",
            "https://jobs.example.com/1");
    assertThat(ranked).extracting(RankedPosting::getSimilarity).containsExactly(100.0, 80.0, 60.0);
    assertThat(ranked).allSatisfy(posting -> assertThat(posting.getCluster()).isZero());
  }

  @Test
  @DisplayName("Should round scores to two decimals")
  void shouldRoundToTwoDecimals() {
    double[][] embeddings = {{1.0, 2.0, 3.0}};
    ArtifactBundle bundle = bundle(embeddings, new int[] {0});

    double similarity = ranker.rank(bundle, new double[] {3.0, 2.0, 1.0}, 0).get(0).getSimilarity();

    assertThat(similarity).isEqualTo(71.43);
  }

  @Test
  @DisplayName("Should keep corpus order among equal scores")
  void shouldBeStableOnTies() {
    double[][] embeddings = {{0.0, 1.0}, {0.0, 2.0}, {0.0, 3.0}};
    ArtifactBundle bundle = bundle(embeddings, new int[] {0, 0, 0});

    List<RankedPosting> ranked = ranker.rank(bundle, new double[] {0.0, 1.0}, 0);

    assertThat(ranked)
        .extracting(posting -> posting.getPosting().getUrl())
        .containsExactly(
            "https://jobs.example.com/0",
            "https://jobs.example.com/1",
            "https://jobs.example.com/2");
  }

  @Test
  @DisplayName("Should return nothing for a cluster without postings")
  void shouldReturnEmptyForUnknownCluster() {
    ArtifactBundle bundle = bundle(new double[][] {{1.0, 0.0}}, new int[] {0});

    assertThat(ranker.rank(bundle, new double[] {1.0, 0.0}, 1)).isEmpty();
  }

  private static ArtifactBundle bundle(double[][] embeddings, int[] labels) {
    int clusters = 0;
    for (int label : labels) {
      clusters = Math.max(clusters, label + 1);
    }
    double[][] centroids = new double[clusters][embeddings[0].length];
    return ArtifactBundle.builder()
        .platform("linkedin")
        .region("france")
        .centroidModel(new CentroidModel(clusters, centroids, labels, 0.0, 0.0))
        .embeddings(embeddings)
        .postings(MatcherFixtures.cleanedPostings(embeddings.length))
        .ensemble(
            new ClassifierEnsemble(
                List.of(new ScoredClassifier("KNN", new ConstantClassifier(0), 1.0))))
        .build();
  }
}
