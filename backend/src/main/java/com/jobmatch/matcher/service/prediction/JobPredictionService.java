package com.jobmatch.matcher.service.prediction;

import java.util.List;

import org.springframework.stereotype.Service;

import com.jobmatch.matcher.dto.prediction.PredictionRequest;
import com.jobmatch.matcher.dto.prediction.PredictionResponse;
import com.jobmatch.matcher.dto.prediction.RankedPosting;
import com.jobmatch.matcher.exception.DuplicatePredictionException;
import com.jobmatch.matcher.exception.EmbeddingException;
import com.jobmatch.matcher.service.artifact.ArtifactBundle;
import com.jobmatch.matcher.service.artifact.ArtifactStore;
import com.jobmatch.matcher.service.embedding.EmbeddingGateway;
import com.jobmatch.matcher.service.ensemble.EnsembleVoter;
import com.jobmatch.matcher.service.ensemble.VoteResult;
import com.jobmatch.matcher.service.text.TextNormalizer;
import com.jobmatch.matcher.service.user.UserProfileService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Matches a candidate profile against the published model of one platform and region.
 *
 * <p>The bundle is reloaded on every request. Any failing stage aborts the request, except a
 * duplicate prediction, which only skips persistence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobPredictionService {

  private final ArtifactStore artifactStore;
  private final TextNormalizer textNormalizer;
  private final EmbeddingGateway embeddingGateway;
  private final EnsembleVoter ensembleVoter;
  private final JobRanker jobRanker;
  private final EligibilityFilter eligibilityFilter;
  private final EnrichmentOrchestrator enrichmentOrchestrator;
  private final UserProfileService userProfileService;

  public PredictionResponse predict(PredictionRequest request) {
    String platform = request.getPlatform();
    String region = request.getRegion();
    if (!userProfileService.exists(request.getUserId())) {
      throw new IllegalArgumentException("Unknown user_id: " + request.getUserId());
    }
    String cleaned = textNormalizer.clean(request.getSummarizedText());
    if (cleaned.isEmpty()) {
      throw new IllegalArgumentException("summarized_text has no content left after cleaning");
    }

    stage(PredictionStage.LOAD_ARTIFACTS, platform, region);
    ArtifactBundle bundle = artifactStore.load(platform, region);

    stage(PredictionStage.EMBED_QUERY, platform, region);
    double[] query = embedQuery(cleaned, bundle);

    stage(PredictionStage.ENSEMBLE_VOTE, platform, region);
    VoteResult vote = ensembleVoter.vote(bundle.getEnsemble(), query);

    stage(PredictionStage.RANK, platform, region);
    List<RankedPosting> ranked = jobRanker.rank(bundle, query, vote.getMajority());

    stage(PredictionStage.FILTER, platform, region);
    EligibilityFilter.Selection selection =
        eligibilityFilter.apply(ranked, request.getEducationLevel(), request.getCityForFilter());
    List<RankedPosting> selected = selection.getPostings();

    stage(PredictionStage.ENRICH, platform, region);
    enrichmentOrchestrator.enrich(selected, cleaned);

    stage(PredictionStage.PERSIST, platform, region);
    try {
      userProfileService.recordPrediction(request, vote.getMajority(), selected);
    } catch (DuplicatePredictionException e) {
      log.warn(
          "Prediction {} already stored for user {}, not persisting again",
          e.getDeduplicationKey(),
          request.getUserId());
    }

    stage(PredictionStage.RESPOND, platform, region);
    return PredictionResponse.builder()
        .majority(vote.getMajority())
        .modelVotes(vote.getVotes())
        .modelConfidences(vote.getConfidences())
        .topSimilarJobs(selected)
        .filterFallback(selection.isFallback())
        .build();
  }

  private double[] embedQuery(String cleaned, ArtifactBundle bundle) {
    double[] query = embeddingGateway.embedOne(cleaned);
    if (query == null || query.length == 0) {
      throw new EmbeddingException("Error generating embeddings.");
    }
    int expected = bundle.getCentroidModel().getDimension();
    if (query.length != expected) {
      throw new EmbeddingException(
          String.format(
              "Query embedding has %d dimensions but the model was trained on %d",
              query.length, expected));
    }
    return query;
  }

  private static void stage(PredictionStage stage, String platform, String region) {
    log.debug("{} for {} - {}", stage, platform, region);
  }
}
