package com.scholary.codeindex.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link JobStore} backed by two relational tables: {@code indexing_jobs} and the append-only
 * ledger {@code indexed_files}.
 *
 * <p>Status changes are conditional updates checked against {@link
 * JobStatus#legalPredecessors()}, so two callers racing on the same job (say, the execution loop
 * completing while a cancel arrives) cannot both win.
 */
@Component
public class JpaJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JpaJobStore.class);

  private final JobEntityRepository jobs;
  private final IndexedFileRepository indexedFiles;
  private final Clock clock;

  public JpaJobStore(JobEntityRepository jobs, IndexedFileRepository indexedFiles, Clock clock) {
    this.jobs = jobs;
    this.indexedFiles = indexedFiles;
    this.clock = clock;
  }

  @Override
  @Transactional
  public IndexingJob createJob(String projectName, String directoryPath, boolean recursive) {
    JobEntity entity =
        new JobEntity(
            UUID.randomUUID().toString(), projectName, directoryPath, recursive, clock.instant());
    jobs.save(entity);
    LOGGER.debug("Created job {} for project {} at {}", entity.getId(), projectName, directoryPath);
    return entity.toSnapshot(List.of());
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<IndexingJob> getJob(String jobId) {
    return jobs.findById(jobId).map(this::snapshot);
  }

  @Override
  @Transactional(readOnly = true)
  public List<IndexingJob> listJobs(JobStatus status, String projectName, int limit) {
    Pageable page = PageRequest.of(0, Math.max(1, limit));
    List<JobEntity> rows;
    if (status != null && projectName != null) {
      rows = jobs.findByStatusAndProjectNameOrderByCreatedAtDesc(status, projectName, page);
    } else if (status != null) {
      rows = jobs.findByStatusOrderByCreatedAtDesc(status, page);
    } else if (projectName != null) {
      rows = jobs.findByProjectNameOrderByCreatedAtDesc(projectName, page);
    } else {
      rows = jobs.findAllByOrderByCreatedAtDesc(page);
    }
    // Ledgers can hold thousands of paths; list views carry counters only.
    return rows.stream().map(entity -> entity.toSnapshot(List.of())).toList();
  }

  @Override
  @Transactional
  public boolean updateStatus(String jobId, JobStatus newStatus, String errorMessage) {
    Instant now = clock.instant();
    int updated;
    if (newStatus == JobStatus.RUNNING) {
      updated = jobs.transitionToRunning(jobId, newStatus, newStatus.legalPredecessors(), now);
    } else if (newStatus == JobStatus.FAILED && errorMessage != null) {
      updated =
          jobs.transitionToFailed(
              jobId, newStatus, newStatus.legalPredecessors(), now, errorMessage);
    } else if (newStatus.isTerminal()) {
      updated = jobs.transitionToTerminal(jobId, newStatus, newStatus.legalPredecessors(), now);
    } else {
      updated = jobs.transition(jobId, newStatus, newStatus.legalPredecessors());
    }

    if (updated == 0) {
      LOGGER.warn(
          "Rejected status change for job {} to {} (current: {})",
          jobId,
          newStatus,
          jobs.findById(jobId).map(j -> j.getStatus().name()).orElse("not found"));
      return false;
    }
    return true;
  }

  @Override
  @Transactional
  public void updateProgress(
      String jobId,
      int indexedFiles,
      int failedFiles,
      int totalUnits,
      String lastIndexedFile,
      Integer totalFiles) {
    int updated = jobs.updateCounters(jobId, indexedFiles, failedFiles, totalUnits);
    if (updated == 0) {
      LOGGER.debug("Progress update for unknown job {} ignored", jobId);
      return;
    }
    if (lastIndexedFile != null) {
      jobs.updateLastIndexedFile(jobId, lastIndexedFile);
    }
    if (totalFiles != null) {
      jobs.updateTotalFiles(jobId, totalFiles);
    }
  }

  @Override
  @Transactional
  public void addIndexedFile(String jobId, String filePath) {
    if (!jobs.existsById(jobId)) {
      LOGGER.debug("Ledger append for unknown job {} ignored", jobId);
      return;
    }
    if (indexedFiles.existsByJobIdAndFilePath(jobId, filePath)) {
      return;
    }
    indexedFiles.save(new IndexedFileEntity(jobId, filePath, clock.instant()));
  }

  @Override
  @Transactional(readOnly = true)
  public List<String> getIndexedFiles(String jobId) {
    return indexedFiles.findFilePathsByJobId(jobId);
  }

  @Override
  @Transactional
  public boolean deleteJob(String jobId) {
    if (!jobs.existsById(jobId)) {
      return false;
    }
    indexedFiles.deleteByJobIdIn(List.of(jobId));
    jobs.deleteById(jobId);
    return true;
  }

  @Override
  @Transactional
  public int cleanOldJobs(int ageDays) {
    Instant cutoff = clock.instant().minus(Duration.ofDays(ageDays));
    List<String> expired = jobs.findIdsCompletedBefore(JobStatus.terminalStates(), cutoff);
    if (expired.isEmpty()) {
      return 0;
    }
    indexedFiles.deleteByJobIdIn(expired);
    jobs.deleteAllByIdInBatch(expired);
    LOGGER.info("Removed {} jobs completed before {}", expired.size(), cutoff);
    return expired.size();
  }

  private IndexingJob snapshot(JobEntity entity) {
    return entity.toSnapshot(indexedFiles.findFilePathsByJobId(entity.getId()));
  }
}
