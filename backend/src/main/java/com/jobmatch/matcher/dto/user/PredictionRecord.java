package com.jobmatch.matcher.dto.user;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jobmatch.matcher.dto.prediction.RankedPosting;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One stored prediction. Records are only ever appended to a profile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Stored prediction result")
public class PredictionRecord {

  /** Platform, region and a hash of the file name or free text the prediction came from. */
  @JsonProperty("deduplication_key")
  private String deduplicationKey;

  @JsonProperty("platform")
  private String platform;

  @JsonProperty("region")
  private String region;

  @JsonProperty("typedeSummary")
  private String summaryType;

  @JsonProperty("filename")
  private String filename;

  @JsonProperty("textSummary")
  private String textSummary;

  /** Display name of the region filter, e.g. "Île-de-France". */
  @JsonProperty("city_for_filter")
  private String cityForFilter;

  @JsonProperty("education_level")
  private String educationLevel;

  @JsonProperty("majority")
  private int majority;

  @JsonProperty("predict_jobs")
  private List<RankedPosting> predictJobs;

  @JsonProperty("added_date")
  private Instant addedDate;
}
