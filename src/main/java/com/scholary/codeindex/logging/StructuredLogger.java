package com.scholary.codeindex.logging;

import com.scholary.codeindex.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields in the MDC for the duration of a single log call, so a JSON
 * encoder or a log pipeline can index them.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job status change. */
  public void logJobTransition(String jobId, JobStatus from, JobStatus to) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("fromStatus", String.valueOf(from));
      MDC.put("toStatus", String.valueOf(to));

      logger.info("Job transition: jobId={}, {} -> {}", jobId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log candidate enumeration result. */
  public void logFilesDiscovered(String jobId, int remaining, int alreadyIndexed) {
    try {
      MDC.put("event_type", "files_discovered");
      MDC.put("remainingFiles", String.valueOf(remaining));
      MDC.put("alreadyIndexed", String.valueOf(alreadyIndexed));

      logger.info(
          "Files discovered: jobId={}, toIndex={}, alreadyIndexed={}",
          jobId,
          remaining,
          alreadyIndexed);
    } finally {
      clearEventFields();
    }
  }

  /** Log a successfully processed file. */
  public void logFileIndexed(String jobId, String filePath, int units, boolean skipped, long ms) {
    try {
      MDC.put("event_type", "file_indexed");
      MDC.put("filePath", filePath);
      MDC.put("units", String.valueOf(units));
      MDC.put("skipped", String.valueOf(skipped));
      MDC.put("indexMs", String.valueOf(ms));

      logger.debug(
          "File indexed: jobId={}, file={}, units={}, skipped={}, took={}ms",
          jobId,
          filePath,
          units,
          skipped,
          ms);
    } finally {
      clearEventFields();
    }
  }

  /** Log a per-file failure. The job carries on. */
  public void logFileFailed(String jobId, String filePath, String errorType, String message) {
    try {
      MDC.put("event_type", "file_failed");
      MDC.put("filePath", filePath);
      MDC.put("errorType", errorType);

      logger.warn(
          "File failed: jobId={}, file={}, error={}, message={}",
          jobId,
          filePath,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int indexedFiles, int failedFiles, int totalFiles, int totalUnits) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("indexedFiles", String.valueOf(indexedFiles));
      MDC.put("failedFiles", String.valueOf(failedFiles));
      MDC.put("totalFiles", String.valueOf(totalFiles));
      MDC.put("totalUnits", String.valueOf(totalUnits));

      logger.debug(
          "Job progress: jobId={}, files={}/{}, failed={}, units={}",
          jobId,
          indexedFiles,
          totalFiles,
          failedFiles,
          totalUnits);
    } finally {
      clearEventFields();
    }
  }

  /** Log the end of an execution loop that ran to completion. */
  public void logJobFinished(
      String jobId, int indexedFiles, int failedFiles, int totalUnits, long elapsedMs) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("indexedFiles", String.valueOf(indexedFiles));
      MDC.put("failedFiles", String.valueOf(failedFiles));
      MDC.put("totalUnits", String.valueOf(totalUnits));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Job finished: jobId={}, files={}, units={}, failed={}, elapsed={}ms",
          jobId,
          indexedFiles,
          totalUnits,
          failedFiles,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String projectName, String directory) {
    MDC.put("jobId", jobId);
    MDC.put("projectName", projectName);
    MDC.put("directory", directory);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("projectName");
    MDC.remove("directory");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromStatus");
    MDC.remove("toStatus");
    MDC.remove("remainingFiles");
    MDC.remove("alreadyIndexed");
    MDC.remove("filePath");
    MDC.remove("units");
    MDC.remove("skipped");
    MDC.remove("indexMs");
    MDC.remove("errorType");
    MDC.remove("indexedFiles");
    MDC.remove("failedFiles");
    MDC.remove("totalFiles");
    MDC.remove("totalUnits");
    MDC.remove("elapsedMs");
  }
}
