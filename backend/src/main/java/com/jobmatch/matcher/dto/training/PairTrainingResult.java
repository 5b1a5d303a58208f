package com.jobmatch.matcher.dto.training;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jobmatch.matcher.service.artifact.PromotionResult;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Training outcome for one platform and region")
public class PairTrainingResult {

  private String platform;
  private String region;
  private boolean success;
  private String message;

  @JsonProperty("optimal_clusters")
  private Integer optimalClusters;

  @JsonProperty("knee_detected")
  private Boolean kneeDetected;

  @JsonProperty("best_model")
  private String bestModel;

  @JsonProperty("model_scores")
  private Map<String, Double> modelScores;

  @JsonProperty("postings")
  private Integer postingCount;

  private PromotionResult promotion;
  private String error;
}
