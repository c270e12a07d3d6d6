package com.scholary.codeindex.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import org.hibernate.annotations.DynamicUpdate;

/**
 * Persistent row for an indexing job.
 *
 * <p>Status and counters are changed through targeted update queries in {@link
 * JobEntityRepository}, never by saving a loaded entity, so that the execution loop and the
 * pause/cancel callers can write the same row without overwriting each other's columns.
 */
@Entity
@Table(
    name = "indexing_jobs",
    indexes = {
      @Index(name = "idx_jobs_status", columnList = "status"),
      @Index(name = "idx_jobs_project", columnList = "project_name"),
      @Index(name = "idx_jobs_created", columnList = "created_at")
    })
@DynamicUpdate
public class JobEntity {

  @Id
  @Column(name = "id", length = 36)
  private String id;

  @Column(name = "project_name", nullable = false)
  private String projectName;

  @Column(name = "directory_path", nullable = false, length = 4096)
  private String directoryPath;

  @Column(name = "recursive_scan", nullable = false)
  private boolean recursive;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private JobStatus status;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "total_files")
  private Integer totalFiles;

  @Column(name = "indexed_files", nullable = false)
  private int indexedFiles;

  @Column(name = "failed_files", nullable = false)
  private int failedFiles;

  @Column(name = "total_units", nullable = false)
  private int totalUnits;

  @Column(name = "error_message", length = 4000)
  private String errorMessage;

  @Column(name = "last_indexed_file", length = 1024)
  private String lastIndexedFile;

  protected JobEntity() {}

  public JobEntity(
      String id, String projectName, String directoryPath, boolean recursive, Instant createdAt) {
    this.id = id;
    this.projectName = projectName;
    this.directoryPath = directoryPath;
    this.recursive = recursive;
    this.createdAt = createdAt;
    this.status = JobStatus.QUEUED;
  }

  public IndexingJob toSnapshot(List<String> indexedFileList) {
    return new IndexingJob(
        id,
        projectName,
        directoryPath,
        recursive,
        status,
        createdAt,
        startedAt,
        completedAt,
        totalFiles,
        indexedFiles,
        failedFiles,
        totalUnits,
        errorMessage,
        lastIndexedFile,
        indexedFileList);
  }

  public String getId() {
    return id;
  }

  public String getProjectName() {
    return projectName;
  }

  public String getDirectoryPath() {
    return directoryPath;
  }

  public boolean isRecursive() {
    return recursive;
  }

  public JobStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Integer getTotalFiles() {
    return totalFiles;
  }

  public int getIndexedFiles() {
    return indexedFiles;
  }

  public int getFailedFiles() {
    return failedFiles;
  }

  public int getTotalUnits() {
    return totalUnits;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public String getLastIndexedFile() {
    return lastIndexedFile;
  }
}
