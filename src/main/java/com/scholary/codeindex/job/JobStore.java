package com.scholary.codeindex.job;

import java.util.List;
import java.util.Optional;

/**
 * Durable registry of indexing jobs and their resumption ledgers.
 *
 * <p>Each operation is atomic for the single job it touches. There is no transaction spanning
 * several jobs.
 */
public interface JobStore {

  /** Create a QUEUED job with an empty ledger. */
  IndexingJob createJob(String projectName, String directoryPath, boolean recursive);

  Optional<IndexingJob> getJob(String jobId);

  /**
   * List jobs, most recently created first. The returned snapshots do not carry the ledger
   * ({@link IndexingJob#indexedFileList()} is empty); use {@link #getJob} or {@link
   * #getIndexedFiles} for it.
   *
   * @param status only jobs in this state, or all when null
   * @param projectName only jobs of this project, or all when null
   * @param limit maximum number of jobs to return
   */
  List<IndexingJob> listJobs(JobStatus status, String projectName, int limit);

  /**
   * Move a job to a new state if the transition is legal from its current state.
   *
   * <p>Entering RUNNING sets {@code startedAt} unless already set. Entering a terminal state sets
   * {@code completedAt}. The error message is only recorded when entering FAILED.
   *
   * @return false if the job does not exist or the transition is not legal
   */
  boolean updateStatus(String jobId, JobStatus newStatus, String errorMessage);

  default boolean updateStatus(String jobId, JobStatus newStatus) {
    return updateStatus(jobId, newStatus, null);
  }

  /**
   * Overwrite the progress counters. Null {@code lastIndexedFile} or {@code totalFiles} leave the
   * stored values unchanged. Status and timestamps are never touched.
   */
  void updateProgress(
      String jobId,
      int indexedFiles,
      int failedFiles,
      int totalUnits,
      String lastIndexedFile,
      Integer totalFiles);

  /** Append a path to the job's ledger. Appending a path already present is a no-op. */
  void addIndexedFile(String jobId, String filePath);

  /** Ledger contents in the order they were appended. Empty for unknown jobs. */
  List<String> getIndexedFiles(String jobId);

  /** @return true if the job existed and was removed together with its ledger */
  boolean deleteJob(String jobId);

  /**
   * Remove terminal jobs whose {@code completedAt} is more than {@code ageDays} days old.
   *
   * @return number of jobs removed
   */
  int cleanOldJobs(int ageDays);
}
