package com.scholary.codeindex.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Spring Data access to {@link JobEntity} rows.
 *
 * <p>The {@code transition*} queries are compare-and-set updates: they only match while the row is
 * in one of the {@code from} states and return the number of rows changed (0 or 1).
 */
@Repository
public interface JobEntityRepository extends JpaRepository<JobEntity, String> {

  List<JobEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

  List<JobEntity> findByStatusOrderByCreatedAtDesc(JobStatus status, Pageable pageable);

  List<JobEntity> findByProjectNameOrderByCreatedAtDesc(String projectName, Pageable pageable);

  List<JobEntity> findByStatusAndProjectNameOrderByCreatedAtDesc(
      JobStatus status, String projectName, Pageable pageable);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE JobEntity j SET j.status = :status WHERE j.id = :id AND j.status IN :fromStates")
  int transition(
      @Param("id") String id,
      @Param("status") JobStatus status,
      @Param("fromStates") Collection<JobStatus> fromStates);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE JobEntity j SET j.status = :status, j.startedAt = COALESCE(j.startedAt, :now)"
          + " WHERE j.id = :id AND j.status IN :fromStates")
  int transitionToRunning(
      @Param("id") String id,
      @Param("status") JobStatus status,
      @Param("fromStates") Collection<JobStatus> fromStates,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE JobEntity j SET j.status = :status, j.completedAt = :now"
          + " WHERE j.id = :id AND j.status IN :fromStates")
  int transitionToTerminal(
      @Param("id") String id,
      @Param("status") JobStatus status,
      @Param("fromStates") Collection<JobStatus> fromStates,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE JobEntity j SET j.status = :status, j.completedAt = :now,"
          + " j.errorMessage = :errorMessage WHERE j.id = :id AND j.status IN :fromStates")
  int transitionToFailed(
      @Param("id") String id,
      @Param("status") JobStatus status,
      @Param("fromStates") Collection<JobStatus> fromStates,
      @Param("now") Instant now,
      @Param("errorMessage") String errorMessage);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE JobEntity j SET j.indexedFiles = :indexedFiles, j.failedFiles = :failedFiles,"
          + " j.totalUnits = :totalUnits WHERE j.id = :id")
  int updateCounters(
      @Param("id") String id,
      @Param("indexedFiles") int indexedFiles,
      @Param("failedFiles") int failedFiles,
      @Param("totalUnits") int totalUnits);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE JobEntity j SET j.lastIndexedFile = :lastIndexedFile WHERE j.id = :id")
  int updateLastIndexedFile(
      @Param("id") String id, @Param("lastIndexedFile") String lastIndexedFile);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE JobEntity j SET j.totalFiles = :totalFiles WHERE j.id = :id")
  int updateTotalFiles(@Param("id") String id, @Param("totalFiles") int totalFiles);

  @Query(
      "SELECT j.id FROM JobEntity j WHERE j.status IN :statuses AND j.completedAt < :cutoff")
  List<String> findIdsCompletedBefore(
      @Param("statuses") Collection<JobStatus> statuses, @Param("cutoff") Instant cutoff);
}
