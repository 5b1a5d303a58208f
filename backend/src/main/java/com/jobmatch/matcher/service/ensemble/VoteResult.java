package com.jobmatch.matcher.service.ensemble;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Outcome of one ensemble vote: the winning cluster plus every member's ballot. */
@Getter
@AllArgsConstructor
public class VoteResult {

  private final int majority;

  /** Predicted cluster per model, in roster order. */
  private final Map<String, Integer> votes;

  /** Probability of the predicted cluster per model; null where the model has none. */
  private final Map<String, Double> confidences;
}
