package com.scholary.codeindex.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

/** One resumption-ledger row: a file a job has already indexed. Rows are only ever inserted. */
@Entity
@Table(
    name = "indexed_files",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_indexed_files_job_path",
            columnNames = {"job_id", "file_path"}),
    indexes = @Index(name = "idx_indexed_files_job", columnList = "job_id"))
public class IndexedFileEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "job_id", nullable = false, length = 36)
  private String jobId;

  @Column(name = "file_path", nullable = false, length = 4096)
  private String filePath;

  @Column(name = "indexed_at", nullable = false)
  private Instant indexedAt;

  protected IndexedFileEntity() {}

  public IndexedFileEntity(String jobId, String filePath, Instant indexedAt) {
    this.jobId = jobId;
    this.filePath = filePath;
    this.indexedAt = indexedAt;
  }

  public Long getId() {
    return id;
  }

  public String getJobId() {
    return jobId;
  }

  public String getFilePath() {
    return filePath;
  }

  public Instant getIndexedAt() {
    return indexedAt;
  }
}
