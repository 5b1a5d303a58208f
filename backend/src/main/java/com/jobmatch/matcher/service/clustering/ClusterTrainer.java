package com.jobmatch.matcher.service.clustering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.dto.corpus.CleanedPosting;
import com.jobmatch.matcher.dto.corpus.JobPosting;
import com.jobmatch.matcher.exception.EmptyCorpusException;
import com.jobmatch.matcher.service.embedding.EmbeddingGateway;
import com.jobmatch.matcher.service.text.TextNormalizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the cluster count for one corpus with the elbow of the cosine dispersion curve and
 * returns the centroid model fitted at that count.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterTrainer {

  private final TextNormalizer textNormalizer;
  private final EmbeddingGateway embeddingGateway;
  private final KMeansClusterer clusterer;
  private final MatcherProperties properties;

  public ClusterTrainingResult train(List<JobPosting> corpus) {
    List<CleanedPosting> postings = new ArrayList<>();
    for (JobPosting posting : corpus) {
      if (posting.hasSummary()) {
        postings.add(new CleanedPosting(posting, textNormalizer.clean(posting.getSummary())));
      }
    }
    if (postings.isEmpty()) {
      throw new EmptyCorpusException("Corpus has no posting with a summary");
    }
    log.info("Cleaned {} of {} postings", postings.size(), corpus.size());

    List<String> texts = new ArrayList<>(postings.size());
    postings.forEach(p -> texts.add(p.getCleanedSummary()));
    double[][] embeddings = embeddingGateway.embed(texts);

    return cluster(postings, embeddings);
  }

  /** Runs the cluster-count search over embeddings that are already computed. */
  public ClusterTrainingResult cluster(List<CleanedPosting> postings, double[][] embeddings) {
    if (embeddings.length == 0) {
      throw new EmptyCorpusException("Corpus has no posting with a summary");
    }
    MatcherProperties.Clustering config = properties.getClustering();
    int maxClusters = Math.min(config.getMaxClusters(), embeddings.length);

    int[] candidates = new int[maxClusters];
    double[] curve = new double[maxClusters];
    CentroidModel[] models = new CentroidModel[maxClusters];
    CentroidModel previous = null;
    for (int k = 1; k <= maxClusters; k++) {
      CentroidModel model = clusterer.fit(embeddings, k, previous);
      candidates[k - 1] = k;
      curve[k - 1] = model.getDispersion();
      models[k - 1] = model;
      previous = model;
    }
    log.info("Dispersion curve: {}", Arrays.toString(curve));

    OptionalInt knee = KneeLocator.findKnee(candidates, curve);
    int chosen;
    if (knee.isPresent()) {
      chosen = knee.getAsInt();
    } else {
      chosen = Math.min(config.getFallbackClusters(), maxClusters);
      log.warn("No knee in dispersion curve, defaulting to {} clusters", chosen);
    }
    log.info("Optimal cluster count: {}", chosen);

    return ClusterTrainingResult.builder()
        .postings(postings)
        .embeddings(embeddings)
        .model(models[chosen - 1])
        .dispersionCurve(curve)
        .kneeDetected(knee.isPresent())
        .build();
  }
}
