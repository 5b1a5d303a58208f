package com.jobmatch.matcher.exception;

public class GenerationProviderException extends RuntimeException {

  public GenerationProviderException(String message) {
    super(message);
  }

  public GenerationProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
