package com.jobmatch.matcher.service.clustering;

import java.util.List;

import com.jobmatch.matcher.dto.corpus.CleanedPosting;

import lombok.Builder;
import lombok.Getter;

/** Everything one clustering run produces for a corpus, in corpus order. */
@Getter
@Builder
public class ClusterTrainingResult {

  private final List<CleanedPosting> postings;
  private final double[][] embeddings;
  private final CentroidModel model;

  /** Dispersion for candidate counts 1..n, index 0 holding k = 1. */
  private final double[] dispersionCurve;

  private final boolean kneeDetected;

  public int getClusterCount() {
    return model.getClusterCount();
  }

  public int[] getLabels() {
    return model.getLabels();
  }
}
