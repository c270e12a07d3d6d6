package com.scholary.codeindex.job;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of an indexing job as persisted in the {@link JobStore}.
 *
 * <p>Snapshots are immutable; re-read the job from the store to observe later progress.
 *
 * @param indexedFileList absolute paths already processed, in processing order (the resumption
 *     ledger). Empty in list views, which do not load it.
 */
public record IndexingJob(
    String id,
    String projectName,
    String directoryPath,
    boolean recursive,
    JobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Integer totalFiles,
    int indexedFiles,
    int failedFiles,
    int totalUnits,
    String errorMessage,
    String lastIndexedFile,
    List<String> indexedFileList) {

  public IndexingJob {
    indexedFileList = indexedFileList == null ? List.of() : List.copyOf(indexedFileList);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  /** Share of known files already indexed, 0-100. Zero while the total is unknown. */
  public double progressPercent() {
    if (totalFiles == null || totalFiles == 0) {
      return 0.0;
    }
    return indexedFiles * 100.0 / totalFiles;
  }

  /** Files still to process, or zero while the total is unknown. */
  public int remainingFiles() {
    if (totalFiles == null) {
      return 0;
    }
    // The ledger can be one entry ahead of the counter if a run stopped between the two writes.
    int done = Math.max(indexedFiles, indexedFileList.size());
    return Math.max(0, totalFiles - done);
  }
}
