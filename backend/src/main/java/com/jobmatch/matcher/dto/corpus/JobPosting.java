package com.jobmatch.matcher.dto.corpus;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One row of a summarized job-posting corpus. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Job posting")
public class JobPosting {

  /** Value of the level column for postings open to any education level. */
  public static final String NO_LEVEL_REQUIRED = "No level Required";

  @JsonProperty("Url")
  private String url;

  @JsonProperty("Company")
  private String company;

  @JsonProperty("Title")
  private String title;

  @JsonProperty("Location")
  private String location;

  @JsonProperty("Publication Date")
  private String publicationDate;

  @JsonProperty("Summary")
  private String summary;

  @JsonProperty("Summary_fr")
  private String summaryFr;

  @JsonProperty("Level")
  private String level;

  @JsonProperty("Region")
  private String region;

  public boolean hasSummary() {
    return summary != null && !summary.isBlank();
  }
}
