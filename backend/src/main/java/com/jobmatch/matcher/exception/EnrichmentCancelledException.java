package com.jobmatch.matcher.exception;

/** Raised when the thread waiting on an enrichment fan-out is interrupted. */
public class EnrichmentCancelledException extends RuntimeException {

  public EnrichmentCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
