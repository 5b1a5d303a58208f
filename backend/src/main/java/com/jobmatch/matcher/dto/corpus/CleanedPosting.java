package com.jobmatch.matcher.dto.corpus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A corpus posting together with the normalized text that was embedded for it. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleanedPosting {

  private JobPosting posting;
  private String cleanedSummary;
}
