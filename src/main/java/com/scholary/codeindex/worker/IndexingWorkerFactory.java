package com.scholary.codeindex.worker;

/** Creates a fresh {@link IndexingWorker} for each execution of a job. */
@FunctionalInterface
public interface IndexingWorkerFactory {

  /**
   * @param projectName project the indexed units belong to
   * @return an uninitialized worker
   */
  IndexingWorker create(String projectName);
}
