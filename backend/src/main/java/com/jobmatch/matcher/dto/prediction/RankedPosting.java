package com.jobmatch.matcher.dto.prediction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.jobmatch.matcher.dto.corpus.JobPosting;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A posting of the winning cluster with its similarity score and generated enrichment. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Ranked job posting")
public class RankedPosting {

  @JsonUnwrapped private JobPosting posting;

  @JsonProperty("cleaned_summary")
  private String cleanedSummary;

  @JsonProperty("cluster")
  private int cluster;

  /** Cosine similarity scaled to 0-100, two decimals. */
  @JsonProperty("Similarity (%)")
  private double similarity;

  @Builder.Default
  @JsonProperty("cover_letter_en")
  private String coverLetterEn = "";

  @Builder.Default
  @JsonProperty("cover_letter_fr")
  private String coverLetterFr = "";

  @Builder.Default
  @JsonProperty("missing_skills_en")
  private String missingSkillsEn = "";

  @Builder.Default
  @JsonProperty("missing_skills_fr")
  private String missingSkillsFr = "";

  @Builder.Default
  @JsonProperty("matching_skills_en")
  private String matchingSkillsEn = "";

  @Builder.Default
  @JsonProperty("matching_skills_fr")
  private String matchingSkillsFr = "";

  @JsonIgnore
  public String getLevel() {
    return posting == null ? null : posting.getLevel();
  }

  @JsonIgnore
  public String getRegion() {
    return posting == null ? null : posting.getRegion();
  }
}
