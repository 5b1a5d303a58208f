package com.jobmatch.matcher.dto.training;

import java.time.Instant;
import java.util.LinkedHashMap;
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
@Schema(description = "Outcome of a full training run, keyed <platform>_<region>")
public class TrainingReport {

  @JsonProperty("started_at")
  private Instant startedAt;

  @JsonProperty("finished_at")
  private Instant finishedAt;

  @Builder.Default private Map<String, PairTrainingResult> results = new LinkedHashMap<>();

  /** True when every pair trained successfully. */
  @JsonProperty("success")
  public boolean isSuccess() {
    return !results.isEmpty() && results.values().stream().allMatch(PairTrainingResult::isSuccess);
  }
}
