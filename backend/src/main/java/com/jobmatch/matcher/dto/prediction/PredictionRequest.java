package com.jobmatch.matcher.dto.prediction;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Candidate profile to match against a published model")
public class PredictionRequest {

  public static final String SUMMARY_TYPE_CV = "cv";
  public static final String SUMMARY_TYPE_PROMPT = "prompt";

  @NotBlank(message = "platform is required")
  @JsonProperty("platform")
  private String platform;

  @Builder.Default
  @JsonProperty("region")
  private String region = "france";

  @NotBlank(message = "summarized_text is required")
  @JsonProperty("summarized_text")
  private String summarizedText;

  @NotBlank(message = "user_id is required")
  @JsonProperty("user_id")
  private String userId;

  @NotBlank(message = "type_summary is required")
  @Pattern(regexp = "cv|prompt", message = "type_summary must be 'cv' or 'prompt'")
  @JsonProperty("type_summary")
  private String typeSummary;

  @JsonProperty("filename")
  private String filename;

  @Pattern(
      regexp = "Bac\\+2|Bac\\+3|Bac\\+4|Master",
      message = "Invalid education level. Valid options are [Bac+2, Bac+3, Bac+4, Master].")
  @JsonProperty("education_level")
  private String educationLevel;

  @Pattern(
      regexp = "ile_de_france|hauts_de_france|Others",
      message =
          "Invalid city for filter. Valid options are [ile_de_france, hauts_de_france, Others].")
  @JsonProperty("city_for_filter")
  private String cityForFilter;
}
