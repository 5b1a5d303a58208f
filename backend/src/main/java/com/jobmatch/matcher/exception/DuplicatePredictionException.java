package com.jobmatch.matcher.exception;

/** A prediction result with the same de-duplication key is already stored for the user. */
public class DuplicatePredictionException extends RuntimeException {

  private final String deduplicationKey;

  public DuplicatePredictionException(String userId, String deduplicationKey) {
    super("A similar prediction already exists for user " + userId);
    this.deduplicationKey = deduplicationKey;
  }

  public String getDeduplicationKey() {
    return deduplicationKey;
  }
}
