package com.scholary.codeindex.worker;

/**
 * Exception thrown when an indexing worker cannot be set up or cannot process a file.
 *
 * <p>Raised from {@link IndexingWorker#initialize()} it fails the whole job. Raised from {@link
 * IndexingWorker#indexFile} it only counts that one file as failed.
 */
public class IndexingWorkerException extends RuntimeException {

  public IndexingWorkerException(String message) {
    super(message);
  }

  public IndexingWorkerException(String message, Throwable cause) {
    super(message, cause);
  }
}
