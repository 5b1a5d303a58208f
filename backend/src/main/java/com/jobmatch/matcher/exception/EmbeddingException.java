package com.jobmatch.matcher.exception;

/** The provider answered but produced no usable embedding. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message) {
    super(message);
  }
}
