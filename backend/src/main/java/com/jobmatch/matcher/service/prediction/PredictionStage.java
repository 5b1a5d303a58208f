package com.jobmatch.matcher.service.prediction;

/** Steps of one prediction request, in execution order. */
public enum PredictionStage {
  LOAD_ARTIFACTS,
  EMBED_QUERY,
  ENSEMBLE_VOTE,
  RANK,
  FILTER,
  ENRICH,
  PERSIST,
  RESPOND
}
