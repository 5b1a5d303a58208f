package com.jobmatch.matcher.exception;

/** Transport, authentication or quota failure reported by an embedding provider. */
public class EmbeddingProviderException extends RuntimeException {

  public EmbeddingProviderException(String message) {
    super(message);
  }

  public EmbeddingProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
