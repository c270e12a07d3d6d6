package com.scholary.codeindex.service;

/**
 * Thrown synchronously when a job request is invalid, e.g. the directory does not exist. No job is
 * created.
 */
public class JobValidationException extends RuntimeException {

  public JobValidationException(String message) {
    super(message);
  }

  public JobValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
