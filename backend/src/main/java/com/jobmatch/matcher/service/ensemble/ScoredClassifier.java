package com.jobmatch.matcher.service.ensemble;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A fitted roster member with its holdout accuracy. */
@Getter
@AllArgsConstructor
public class ScoredClassifier {

  private final String name;
  private final ClusterClassifier classifier;
  private final double accuracy;
}
