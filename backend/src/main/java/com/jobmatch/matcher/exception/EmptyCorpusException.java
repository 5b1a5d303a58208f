package com.jobmatch.matcher.exception;

/** Thrown when a corpus has no posting with a usable description. */
public class EmptyCorpusException extends RuntimeException {

  public EmptyCorpusException(String message) {
    super(message);
  }
}
