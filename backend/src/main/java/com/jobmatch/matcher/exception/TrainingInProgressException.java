package com.jobmatch.matcher.exception;

/** A training run is already in progress; runs never overlap. */
public class TrainingInProgressException extends RuntimeException {

  public TrainingInProgressException(String message) {
    super(message);
  }
}
