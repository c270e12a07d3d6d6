package com.scholary.codeindex.api;

import com.scholary.codeindex.job.IndexingJob;
import com.scholary.codeindex.job.JobStatus;
import java.time.Instant;

/**
 * Response for job status queries.
 *
 * <p>Shows the persisted state of a job without its ledger, which can hold thousands of paths.
 */
public record JobStatusResponse(
    String jobId,
    String projectName,
    String directory,
    boolean recursive,
    JobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Integer totalFiles,
    int indexedFiles,
    int failedFiles,
    int totalUnits,
    double progressPercent,
    String lastIndexedFile,
    String error) {

  public static JobStatusResponse from(IndexingJob job) {
    return new JobStatusResponse(
        job.id(),
        job.projectName(),
        job.directoryPath(),
        job.recursive(),
        job.status(),
        job.createdAt(),
        job.startedAt(),
        job.completedAt(),
        job.totalFiles(),
        job.indexedFiles(),
        job.failedFiles(),
        job.totalUnits(),
        job.progressPercent(),
        job.lastIndexedFile(),
        job.errorMessage());
  }
}
