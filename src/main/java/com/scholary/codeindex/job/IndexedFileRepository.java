package com.scholary.codeindex.job;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Access to the per-job resumption ledger. */
@Repository
public interface IndexedFileRepository extends JpaRepository<IndexedFileEntity, Long> {

  @Query("SELECT f.filePath FROM IndexedFileEntity f WHERE f.jobId = :jobId ORDER BY f.id")
  List<String> findFilePathsByJobId(@Param("jobId") String jobId);

  boolean existsByJobIdAndFilePath(String jobId, String filePath);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM IndexedFileEntity f WHERE f.jobId IN :jobIds")
  int deleteByJobIdIn(@Param("jobIds") Collection<String> jobIds);
}
