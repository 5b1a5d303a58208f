package com.jobmatch.matcher.dto.user;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.jobmatch.matcher.dto.corpus.JobPosting;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A posting the user bookmarked")
public class LikedPost {

  @JsonUnwrapped private JobPosting posting;

  @JsonProperty("added_date")
  private Instant addedDate;
}
