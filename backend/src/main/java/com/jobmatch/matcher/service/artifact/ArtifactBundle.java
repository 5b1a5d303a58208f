package com.jobmatch.matcher.service.artifact;

import java.util.List;

import com.jobmatch.matcher.dto.corpus.CleanedPosting;
import com.jobmatch.matcher.service.clustering.CentroidModel;
import com.jobmatch.matcher.service.ensemble.ClassifierEnsemble;

import lombok.Builder;
import lombok.Getter;

/**
 * The unit of publication for one platform and region. Postings, embedding rows and labels are
 * positionally aligned.
 */
@Getter
@Builder
public class ArtifactBundle {

  private final String platform;
  private final String region;
  private final CentroidModel centroidModel;
  private final double[][] embeddings;
  private final List<CleanedPosting> postings;
  private final ClassifierEnsemble ensemble;

  public int[] getLabels() {
    return centroidModel.getLabels();
  }

  public double[][] getCentroids() {
    return centroidModel.getCentroids();
  }

  public int size() {
    return postings.size();
  }
}
