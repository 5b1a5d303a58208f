package com.jobmatch.matcher.dto.prediction;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Winning cluster and the ranked, enriched postings of that cluster")
public class PredictionResponse {

  @JsonProperty("majority")
  private int majority;

  @JsonProperty("model_votes")
  private Map<String, Integer> modelVotes;

  /** Null entries mark models without a confidence estimate. */
  @JsonProperty("model_confidences")
  private Map<String, Double> modelConfidences;

  @JsonProperty("top_similar_jobs")
  private List<RankedPosting> topSimilarJobs;

  /** True when the filters removed every posting and the unfiltered top was returned instead. */
  @JsonProperty("filter_fallback")
  private boolean filterFallback;
}
