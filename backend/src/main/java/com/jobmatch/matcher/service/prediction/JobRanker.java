package com.jobmatch.matcher.service.prediction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import com.jobmatch.matcher.dto.corpus.CleanedPosting;
import com.jobmatch.matcher.dto.prediction.RankedPosting;
import com.jobmatch.matcher.service.artifact.ArtifactBundle;
import com.jobmatch.matcher.service.clustering.VectorMath;

/** Scores the postings of one cluster against a query embedding, best match first. */
@Component
public class JobRanker {

  public List<RankedPosting> rank(ArtifactBundle bundle, double[] query, int cluster) {
    double[][] embeddings = bundle.getEmbeddings();
    int[] labels = bundle.getLabels();
    List<CleanedPosting> postings = bundle.getPostings();

    List<RankedPosting> ranked = new ArrayList<>();
    for (int i = 0; i < postings.size(); i++) {
      if (labels[i] != cluster) {
        continue;
      }
      CleanedPosting posting = postings.get(i);
      ranked.add(
          RankedPosting.builder()
              .posting(posting.getPosting())
              .cleanedSummary(posting.getCleanedSummary())
              .cluster(cluster)
              .similarity(toPercent(VectorMath.cosineSimilarity(query, embeddings[i])))
              .build());
    }
    // stable sort keeps corpus order among equal scores
    ranked.sort(Comparator.comparingDouble(RankedPosting::getSimilarity).reversed());
    return ranked;
  }

  static double toPercent(double cosine) {
    return BigDecimal.valueOf(cosine * 100).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
  }
}
