package com.jobmatch.matcher.service.training;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.jobmatch.matcher.config.MatcherProperties;
import com.jobmatch.matcher.dto.corpus.JobPosting;
import com.jobmatch.matcher.dto.training.PairTrainingResult;
import com.jobmatch.matcher.dto.training.TrainingReport;
import com.jobmatch.matcher.exception.TrainingInProgressException;
import com.jobmatch.matcher.service.artifact.ArtifactBundle;
import com.jobmatch.matcher.service.artifact.ArtifactStore;
import com.jobmatch.matcher.service.artifact.PromotionResult;
import com.jobmatch.matcher.service.clustering.ClusterTrainer;
import com.jobmatch.matcher.service.clustering.ClusterTrainingResult;
import com.jobmatch.matcher.service.corpus.CorpusLoader;
import com.jobmatch.matcher.service.ensemble.ClassifierEnsemble;
import com.jobmatch.matcher.service.ensemble.EnsembleTrainer;

import lombok.extern.slf4j.Slf4j;

/**
 * Full-batch retraining: for every configured platform and region, load the corpus, cluster it,
 * fit the classifier roster and stage the bundle, promoting it when auto-promotion is on. Pairs
 * are independent and one failing pair never stops the rest.
 *
 * <p>At most one run is in progress at a time, whether it covers every pair or a single one. The
 * running flag is taken on the caller's thread before any work is handed to the executor.
 */
@Slf4j
@Service
public class ClusteringTrainingService {

  private final CorpusLoader corpusLoader;
  private final ClusterTrainer clusterTrainer;
  private final EnsembleTrainer ensembleTrainer;
  private final ArtifactStore artifactStore;
  private final MatcherProperties properties;
  private final Executor trainingExecutor;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicReference<TrainingReport> lastReport = new AtomicReference<>();

  public ClusteringTrainingService(
      CorpusLoader corpusLoader,
      ClusterTrainer clusterTrainer,
      EnsembleTrainer ensembleTrainer,
      ArtifactStore artifactStore,
      MatcherProperties properties,
      @Qualifier("taskExecutor") Executor trainingExecutor) {
    this.corpusLoader = corpusLoader;
    this.clusterTrainer = clusterTrainer;
    this.ensembleTrainer = ensembleTrainer;
    this.artifactStore = artifactStore;
    this.properties = properties;
    this.trainingExecutor = trainingExecutor;
  }

  public TrainingReport trainAll() {
    acquire();
    try {
      return runAll();
    } finally {
      running.set(false);
    }
  }

  /**
   * Starts a full run on the training executor.
   *
   * @return the pending report, or empty when a run is already in progress
   */
  public Optional<CompletableFuture<TrainingReport>> trainAllInBackground() {
    if (!running.compareAndSet(false, true)) {
      log.warn("Training already in progress, ignoring new request");
      return Optional.empty();
    }
    try {
      return Optional.of(CompletableFuture.supplyAsync(this::runAllAndRelease, trainingExecutor));
    } catch (RejectedExecutionException e) {
      running.set(false);
      throw e;
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public Optional<TrainingReport> getLastReport() {
    return Optional.ofNullable(lastReport.get());
  }

  public PairTrainingResult trainPair(String platform, String region) {
    acquire();
    try {
      return runPair(platform, region);
    } finally {
      running.set(false);
    }
  }

  private void acquire() {
    if (!running.compareAndSet(false, true)) {
      throw new TrainingInProgressException("A training run is already in progress");
    }
  }

  private TrainingReport runAllAndRelease() {
    try {
      return runAll();
    } catch (RuntimeException e) {
      log.error("Background training failed", e);
      throw e;
    } finally {
      running.set(false);
    }
  }

  private TrainingReport runAll() {
    TrainingReport report = TrainingReport.builder().startedAt(Instant.now()).build();
    for (String platform : properties.getPlatforms()) {
      for (String region : properties.getRegions()) {
        report.getResults().put(platform + "_" + region, runPair(platform, region));
      }
    }
    report.setFinishedAt(Instant.now());
    lastReport.set(report);
    log.info("Training run finished, success={}", report.isSuccess());
    return report;
  }

  private PairTrainingResult runPair(String platform, String region) {
    log.info("Processing {} - {}...", platform, region);
    try {
      List<JobPosting> corpus = corpusLoader.load(platform, region);
      ClusterTrainingResult clustering = clusterTrainer.train(corpus);
      ClassifierEnsemble ensemble =
          ensembleTrainer.train(clustering.getEmbeddings(), clustering.getLabels());

      ArtifactBundle bundle =
          ArtifactBundle.builder()
              .platform(platform)
              .region(region)
              .centroidModel(clustering.getModel())
              .embeddings(clustering.getEmbeddings())
              .postings(clustering.getPostings())
              .ensemble(ensemble)
              .build();
      artifactStore.stage(bundle);

      PromotionResult promotion = null;
      boolean success = true;
      if (properties.getTraining().isAutoPromote()) {
        promotion = artifactStore.promote(platform, region);
        success = promotion.isSuccess();
      }

      int clusters = clustering.getClusterCount();
      log.info("Optimal clusters for {} - {}: {}", platform, region, clusters);
      return PairTrainingResult.builder()
          .platform(platform)
          .region(region)
          .success(success)
          .message(
              String.format(
                  "Clustering completed with %d clusters for %s - %s.", clusters, platform, region))
          .optimalClusters(clusters)
          .kneeDetected(clustering.isKneeDetected())
          .bestModel(ensemble.getBestModel())
          .modelScores(ensemble.getScores())
          .postingCount(clustering.getPostings().size())
          .promotion(promotion)
          .build();
    } catch (RuntimeException e) {
      log.error("Training failed for {} - {}", platform, region, e);
      return PairTrainingResult.builder()
          .platform(platform)
          .region(region)
          .success(false)
          .message(String.format("Clustering failed for %s - %s.", platform, region))
          .error(e.getMessage())
          .build();
    }
  }
}
