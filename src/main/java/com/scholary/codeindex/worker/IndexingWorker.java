package com.scholary.codeindex.worker;

import java.nio.file.Path;
import java.util.Set;

/**
 * Per-file semantic unit extractor used by indexing jobs.
 *
 * <p>This abstraction keeps the job orchestration independent of the parser, embedding model and
 * vector store that do the actual work. One worker instance serves one execution of one job and is
 * always closed when the execution ends.
 */
public interface IndexingWorker extends AutoCloseable {

  /**
   * Prepare the worker (load models, open connections). Calling it twice is harmless.
   *
   * @throws IndexingWorkerException if the worker cannot be used; the job fails
   */
  void initialize();

  /**
   * Index a single file.
   *
   * @param file absolute path of a file with one of the {@link #supportedExtensions()}
   * @return what was indexed
   * @throws Exception any failure; counted against this file only
   */
  FileIndexResult indexFile(Path file) throws Exception;

  /** File extensions this worker can process, with the leading dot, e.g. {@code ".java"}. */
  Set<String> supportedExtensions();

  /** Release resources. Must not throw. */
  @Override
  void close();
}
