package com.jobmatch.matcher.exception;

/** The object store could not complete a read, write, delete or listing. */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
