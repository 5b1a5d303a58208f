package com.jobmatch.matcher.dto.user;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

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
@Schema(description = "Job seeker profile")
public class UserProfile {

  @JsonProperty("id")
  private String id;

  /** Always stored lower-cased. */
  @JsonProperty("email")
  private String email;

  @JsonProperty("cv_resume")
  private String cvResume;

  @Builder.Default
  @JsonProperty("liked_posts")
  private List<LikedPost> likedPosts = new ArrayList<>();

  @Builder.Default
  @JsonProperty("results_prediction")
  private List<PredictionRecord> predictionResults = new ArrayList<>();

  @JsonProperty("created_at")
  private Instant createdAt;
}
