package com.jobmatch.matcher.exception;

/** A canonical artifact bundle, or one of its members, is missing for a platform and region. */
public class ArtifactNotFoundException extends ResourceNotFoundException {

  public ArtifactNotFoundException(String message) {
    super(message);
  }

  public ArtifactNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
