package com.jobmatch.matcher.exception;

public class InvalidCorpusException extends RuntimeException {

  public InvalidCorpusException(String message) {
    super(message);
  }

  public InvalidCorpusException(String message, Throwable cause) {
    super(message, cause);
  }
}
