package com.scholary.codeindex.api;

import com.scholary.codeindex.job.IndexingJob;
import com.scholary.codeindex.job.JobStatus;
import com.scholary.codeindex.service.BackgroundIndexer;
import com.scholary.codeindex.service.JobValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for background indexing jobs.
 *
 * <p>Control operations answer 404 for unknown jobs and 409 when the job is not in a state that
 * allows the operation. Jobs always run in the background here.
 */
@RestController
@RequestMapping("/api/indexing/jobs")
@Tag(name = "Indexing Jobs", description = "Start, pause, resume and cancel background indexing")
public class IndexingJobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(IndexingJobController.class);

  private final BackgroundIndexer indexer;
  private final int defaultListLimit;

  public IndexingJobController(
      BackgroundIndexer indexer,
      @Value("${indexing.jobs.default-list-limit:100}") int defaultListLimit) {
    this.indexer = indexer;
    this.defaultListLimit = defaultListLimit;
  }

  @PostMapping
  @Operation(
      summary = "Start an indexing job",
      description =
          "Create a job for a directory and run it in the background. "
              + "Returns 400 if the directory does not exist.")
  public ResponseEntity<JobStatusResponse> start(@Valid @RequestBody StartIndexingRequest request) {
    LOGGER.info(
        "Start request: directory={}, project={}, recursive={}",
        request.directory(),
        request.projectName(),
        request.recursiveOrDefault());

    String jobId =
        indexer.startIndexingJob(
            toPath(request.directory()),
            request.projectName(),
            request.recursiveOrDefault(),
            true);
    return indexer
        .getJobStatus(jobId)
        .map(job -> ResponseEntity.status(HttpStatus.ACCEPTED).body(JobStatusResponse.from(job)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping
  @Operation(summary = "List jobs", description = "Most recently created first")
  public List<JobStatusResponse> list(
      @RequestParam(required = false) JobStatus status,
      @RequestParam(required = false) String project,
      @RequestParam(required = false) Integer limit) {
    int effectiveLimit = limit != null && limit > 0 ? limit : defaultListLimit;
    return indexer.listJobs(status, project, effectiveLimit).stream()
        .map(JobStatusResponse::from)
        .toList();
  }

  @GetMapping("/{jobId}")
  @Operation(summary = "Get job status")
  public ResponseEntity<JobStatusResponse> get(@PathVariable String jobId) {
    return indexer
        .getJobStatus(jobId)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping("/{jobId}/pause")
  @Operation(
      summary = "Pause a running job",
      description = "The job stops after the file it is indexing and can be resumed later")
  public ResponseEntity<JobStatusResponse> pause(@PathVariable String jobId) {
    return control(jobId, indexer::pauseJob);
  }

  @PostMapping("/{jobId}/resume")
  @Operation(
      summary = "Resume a paused job",
      description = "Files already in the job's ledger are not indexed again")
  public ResponseEntity<JobStatusResponse> resume(@PathVariable String jobId) {
    return control(jobId, id -> indexer.resumeJob(id, true));
  }

  @PostMapping("/{jobId}/cancel")
  @Operation(summary = "Cancel a job", description = "Cancelled jobs cannot be resumed")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String jobId) {
    return control(jobId, indexer::cancelJob);
  }

  @DeleteMapping("/{jobId}")
  @Operation(summary = "Delete a finished job", description = "Active jobs cannot be deleted")
  public ResponseEntity<Void> delete(@PathVariable String jobId) {
    if (indexer.getJobStatus(jobId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    if (!indexer.deleteJob(jobId)) {
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }
    return ResponseEntity.noContent().build();
  }

  private static Path toPath(String directory) {
    try {
      return Path.of(directory);
    } catch (InvalidPathException e) {
      throw new JobValidationException("Invalid directory path: " + e.getMessage(), e);
    }
  }

  private ResponseEntity<JobStatusResponse> control(
      String jobId, Predicate<String> operation) {
    if (indexer.getJobStatus(jobId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    if (!operation.test(jobId)) {
      LOGGER.info("Operation rejected for job {}", jobId);
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }
    Optional<IndexingJob> job = indexer.getJobStatus(jobId);
    return job.map(j -> ResponseEntity.ok(JobStatusResponse.from(j)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
