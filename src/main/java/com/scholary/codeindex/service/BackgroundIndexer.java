package com.scholary.codeindex.service;

import com.scholary.codeindex.job.IndexingJob;
import com.scholary.codeindex.job.JobStatus;
import com.scholary.codeindex.job.JobStore;
import com.scholary.codeindex.logging.StructuredLogger;
import com.scholary.codeindex.notification.NotificationDispatcher;
import com.scholary.codeindex.worker.FileIndexResult;
import com.scholary.codeindex.worker.IndexingWorker;
import com.scholary.codeindex.worker.IndexingWorkerFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs indexing jobs in the background and drives their lifecycle.
 *
 * <p>Each job execution is a loop that indexes the files not yet in the job's ledger, persisting
 * progress after every file. That loop is the only writer of the job's counters and ledger.
 * Pause, resume and cancel only change the job status and the job's {@link CancellationSignal},
 * which the loop checks before each file, so stopping takes effect after at most one file.
 *
 * <p>Control operations return {@code false} or an empty Optional for unknown jobs and wrong
 * states. Only an invalid start request throws.
 */
@Service
public class BackgroundIndexer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackgroundIndexer.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final NotificationDispatcher notifications;
  private final IndexingWorkerFactory workerFactory;
  private final Executor executor;
  private final Duration stopTimeout;

  // Process-local; lost on restart.
  private final Map<String, Future<?>> activeTasks = new ConcurrentHashMap<>();
  private final Map<String, CancellationSignal> signals = new ConcurrentHashMap<>();

  public BackgroundIndexer(
      JobStore jobStore,
      NotificationDispatcher notifications,
      IndexingWorkerFactory workerFactory,
      @Qualifier("indexingExecutor") Executor executor,
      @Value("${indexing.jobs.stop-timeout:5s}") Duration stopTimeout) {
    this.jobStore = jobStore;
    this.notifications = notifications;
    this.workerFactory = workerFactory;
    this.executor = executor;
    this.stopTimeout = stopTimeout;
  }

  /**
   * Create an indexing job for a directory and start it.
   *
   * @param directory directory to index
   * @param projectName project name, defaults to the directory name when null or blank
   * @param recursive whether to descend into subdirectories
   * @param background true to return as soon as the job is scheduled, false to run it on the
   *     calling thread and return when it finishes
   * @return the new job id
   * @throws JobValidationException if the directory does not exist or is not a directory
   * @throws JobSchedulingException if the job could not be scheduled
   */
  public String startIndexingJob(
      Path directory, String projectName, boolean recursive, boolean background) {
    Path root = validateDirectory(directory);
    String project = projectName == null || projectName.isBlank() ? baseName(root) : projectName;

    IndexingJob job = jobStore.createJob(project, root.toString(), recursive);
    LOGGER.info("Created indexing job {} for {} ({})", job.id(), project, root);

    CancellationSignal signal = new CancellationSignal();
    signals.put(job.id(), signal);
    if (background) {
      if (!schedule(job.id(), project, signal)) {
        throw new JobSchedulingException(
            job.id(), "Job " + job.id() + " could not be scheduled", null);
      }
      LOGGER.info("Job {} started in background", job.id());
    } else {
      runInline(job.id(), signal);
    }
    return job.id();
  }

  /**
   * Ask a running job to stop after the file it is currently indexing.
   *
   * <p>Waits up to the stop timeout for the loop to exit and proceeds anyway after that.
   *
   * @return false if the job does not exist or is not RUNNING
   */
  public boolean pauseJob(String jobId) {
    Optional<IndexingJob> found = jobStore.getJob(jobId);
    if (found.isEmpty()) {
      LOGGER.warn("Job {} not found", jobId);
      return false;
    }
    IndexingJob job = found.get();
    if (job.status() != JobStatus.RUNNING) {
      LOGGER.warn("Job {} is not running (status: {})", jobId, job.status());
      return false;
    }

    signalFor(jobId).signal();
    if (!jobStore.updateStatus(jobId, JobStatus.PAUSED)) {
      return false;
    }
    structuredLogger.logJobTransition(jobId, JobStatus.RUNNING, JobStatus.PAUSED);

    if (!awaitStop(jobId, false)) {
      LOGGER.warn("Job {} did not pause gracefully within {}, continuing", jobId, stopTimeout);
    }

    IndexingJob paused = jobStore.getJob(jobId).orElse(job);
    notifications.notifyPaused(
        jobId, paused.projectName(), paused.indexedFiles(), orZero(paused.totalFiles()));
    LOGGER.info("Job {} paused at {} files", jobId, paused.indexedFiles());
    return true;
  }

  /**
   * Continue a paused job from its persisted ledger.
   *
   * @param background true to schedule the job, false to run it on the calling thread
   * @return false if the job does not exist, is not PAUSED, its previous execution has not exited
   *     yet, or it could not be scheduled
   */
  public boolean resumeJob(String jobId, boolean background) {
    Optional<IndexingJob> found = jobStore.getJob(jobId);
    if (found.isEmpty()) {
      LOGGER.warn("Job {} not found", jobId);
      return false;
    }
    IndexingJob job = found.get();
    if (job.status() != JobStatus.PAUSED) {
      LOGGER.warn("Job {} is not paused (status: {})", jobId, job.status());
      return false;
    }
    // A second loop must never run alongside one that has not yet observed the pause.
    if (!awaitStop(jobId, false)) {
      LOGGER.warn("Job {} still has a running execution, cannot resume yet", jobId);
      return false;
    }

    CancellationSignal signal = signalFor(jobId);
    signal.clear();
    if (!jobStore.updateStatus(jobId, JobStatus.QUEUED)) {
      return false;
    }
    structuredLogger.logJobTransition(jobId, JobStatus.PAUSED, JobStatus.QUEUED);

    int alreadyIndexed = job.indexedFileList().size();
    notifications.notifyResumed(jobId, job.projectName(), alreadyIndexed, job.remainingFiles());

    if (background) {
      if (!schedule(jobId, job.projectName(), signal)) {
        return false;
      }
      LOGGER.info("Job {} resumed in background", jobId);
    } else {
      runInline(jobId, signal);
    }
    return true;
  }

  /**
   * Stop a job for good. Valid from any non-terminal state.
   *
   * <p>Waits up to the stop timeout for the loop to exit, then interrupts it.
   *
   * @return false if the job does not exist or has already finished
   */
  public boolean cancelJob(String jobId) {
    Optional<IndexingJob> found = jobStore.getJob(jobId);
    if (found.isEmpty()) {
      LOGGER.warn("Job {} not found", jobId);
      return false;
    }
    IndexingJob job = found.get();
    if (job.isTerminal()) {
      LOGGER.warn("Job {} already finished (status: {})", jobId, job.status());
      return false;
    }

    signalFor(jobId).signal();
    if (!jobStore.updateStatus(jobId, JobStatus.CANCELLED)) {
      return false;
    }
    structuredLogger.logJobTransition(jobId, job.status(), JobStatus.CANCELLED);

    if (job.status() == JobStatus.QUEUED) {
      // Still waiting in the executor queue; make sure it never starts.
      Future<?> pending = activeTasks.get(jobId);
      if (pending != null) {
        pending.cancel(false);
      }
    }
    if (!awaitStop(jobId, true)) {
      LOGGER.warn("Job {} did not cancel gracefully within {}, forced", jobId, stopTimeout);
    }
    activeTasks.remove(jobId);
    signals.remove(jobId);

    IndexingJob cancelled = jobStore.getJob(jobId).orElse(job);
    notifications.notifyCancelled(
        jobId, cancelled.projectName(), cancelled.indexedFiles(), cancelled.totalFiles());
    LOGGER.info("Job {} cancelled", jobId);
    return true;
  }

  public Optional<IndexingJob> getJobStatus(String jobId) {
    return jobStore.getJob(jobId);
  }

  public List<IndexingJob> listJobs(JobStatus status, String projectName, int limit) {
    return jobStore.listJobs(status, projectName, limit);
  }

  /**
   * Remove a finished job and its ledger.
   *
   * @return false if the job does not exist or is not in a terminal state
   */
  public boolean deleteJob(String jobId) {
    Optional<IndexingJob> found = jobStore.getJob(jobId);
    if (found.isEmpty()) {
      return false;
    }
    if (!found.get().isTerminal()) {
      LOGGER.warn("Cannot delete active job {} (status: {})", jobId, found.get().status());
      return false;
    }
    boolean deleted = jobStore.deleteJob(jobId);
    signals.remove(jobId);
    activeTasks.remove(jobId);
    return deleted;
  }

  /** Remove finished jobs completed more than {@code ageDays} days ago. */
  public int cleanOldJobs(int ageDays) {
    int removed = jobStore.cleanOldJobs(ageDays);
    if (removed > 0) {
      signals
          .keySet()
          .removeIf(id -> !activeTasks.containsKey(id) && jobStore.getJob(id).isEmpty());
    }
    return removed;
  }

  /** Number of jobs with process-local control state (a stop signal). */
  int trackedJobCount() {
    return signals.size();
  }

  /**
   * Move RUNNING jobs that have no execution in this process to PAUSED, so they can be resumed.
   * Only meaningful at startup, after a crash left records stuck in RUNNING.
   *
   * @return number of jobs demoted
   */
  public int pauseOrphanedJobs() {
    int demoted = 0;
    for (IndexingJob job : jobStore.listJobs(JobStatus.RUNNING, null, Integer.MAX_VALUE)) {
      if (activeTasks.containsKey(job.id())) {
        continue;
      }
      if (jobStore.updateStatus(job.id(), JobStatus.PAUSED)) {
        structuredLogger.logJobTransition(job.id(), JobStatus.RUNNING, JobStatus.PAUSED);
        demoted++;
      }
    }
    return demoted;
  }

  private boolean schedule(String jobId, String projectName, CancellationSignal signal) {
    FutureTask<Void> task = newTask(jobId, signal);
    activeTasks.put(jobId, task);
    try {
      executor.execute(task);
      return true;
    } catch (RejectedExecutionException e) {
      activeTasks.remove(jobId, task);
      signals.remove(jobId, signal);
      String message = "Job could not be scheduled: " + e.getMessage();
      LOGGER.error("Job {} rejected by executor: {}", jobId, e.getMessage());
      if (jobStore.updateStatus(jobId, JobStatus.FAILED, message)) {
        notifications.notifyFailed(jobId, projectName, message, 0, null);
      }
      return false;
    }
  }

  private void runInline(String jobId, CancellationSignal signal) {
    FutureTask<Void> task = newTask(jobId, signal);
    activeTasks.put(jobId, task);
    task.run();
  }

  private FutureTask<Void> newTask(String jobId, CancellationSignal signal) {
    return new FutureTask<>(() -> runJob(jobId, signal), null) {
      @Override
      protected void done() {
        activeTasks.remove(jobId, this);
      }
    };
  }

  /**
   * Wait for the job's current execution, if any, to finish.
   *
   * @return true if there is no execution left, false if it is still running after the timeout
   */
  private boolean awaitStop(String jobId, boolean interruptOnTimeout) {
    Future<?> task = activeTasks.get(jobId);
    if (task == null) {
      return true;
    }
    try {
      task.get(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      if (interruptOnTimeout) {
        task.cancel(true);
      }
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException | CancellationException e) {
      return true;
    }
  }

  private void runJob(String jobId, CancellationSignal signal) {
    Optional<IndexingJob> found = jobStore.getJob(jobId);
    if (found.isEmpty()) {
      LOGGER.error("Job {} not found", jobId);
      signals.remove(jobId, signal);
      return;
    }
    IndexingJob job = found.get();
    StructuredLogger.setJobContext(jobId, job.projectName(), job.directoryPath());

    long startNanos = System.nanoTime();
    int indexedCount = job.indexedFiles();
    int failedCount = job.failedFiles();
    int unitsCount = job.totalUnits();
    Integer totalFiles = job.totalFiles();
    IndexingWorker worker = null;
    boolean finished = false;

    try {
      if (!jobStore.updateStatus(jobId, JobStatus.RUNNING)) {
        LOGGER.info("Job {} not started, it is no longer queued", jobId);
        return;
      }
      structuredLogger.logJobTransition(jobId, job.status(), JobStatus.RUNNING);

      Set<String> alreadyIndexed = new HashSet<>(jobStore.getIndexedFiles(jobId));
      indexedCount = alreadyIndexed.size();

      worker = workerFactory.create(job.projectName());
      worker.initialize();

      Path root = Path.of(job.directoryPath());
      List<Path> files =
          CandidateFiles.collect(
              root, job.recursive(), worker.supportedExtensions(), alreadyIndexed);
      totalFiles = files.size() + alreadyIndexed.size();
      structuredLogger.logFilesDiscovered(jobId, files.size(), alreadyIndexed.size());

      jobStore.updateProgress(jobId, indexedCount, failedCount, unitsCount, null, totalFiles);
      notifications.notifyStarted(jobId, job.projectName(), job.directoryPath(), totalFiles);

      for (Path file : files) {
        if (signal.isSignalled() || Thread.currentThread().isInterrupted()) {
          LOGGER.info("Job {} stopped on request after {} files", jobId, indexedCount);
          return;
        }

        String path = file.toString();
        FileIndexResult result = null;
        long fileStart = System.nanoTime();
        try {
          result = worker.indexFile(file);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          LOGGER.info("Job {} interrupted while indexing {}", jobId, path);
          return;
        } catch (Exception e) {
          failedCount++;
          structuredLogger.logFileFailed(
              jobId, path, e.getClass().getSimpleName(), e.getMessage());
        }

        if (result != null) {
          if (!result.skipped()) {
            jobStore.addIndexedFile(jobId, path);
            indexedCount++;
            unitsCount += result.unitsIndexed();
          }
          structuredLogger.logFileIndexed(
              jobId,
              path,
              result.unitsIndexed(),
              result.skipped(),
              TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - fileStart));
        }

        jobStore.updateProgress(
            jobId,
            indexedCount,
            failedCount,
            unitsCount,
            file.getFileName().toString(),
            null);
        structuredLogger.logJobProgress(jobId, indexedCount, failedCount, totalFiles, unitsCount);
        notifications.notifyProgress(
            jobId,
            job.projectName(),
            indexedCount,
            totalFiles,
            unitsCount,
            file.getFileName().toString());
      }

      if (signal.isSignalled()) {
        LOGGER.info("Job {} stopped on request after its last file", jobId);
        return;
      }

      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      if (!jobStore.updateStatus(jobId, JobStatus.COMPLETED)) {
        LOGGER.info("Job {} finished its files but is no longer running", jobId);
        return;
      }
      finished = true;
      structuredLogger.logJobTransition(jobId, JobStatus.RUNNING, JobStatus.COMPLETED);
      structuredLogger.logJobFinished(jobId, indexedCount, failedCount, unitsCount, elapsedMs);
      notifications.notifyCompleted(
          jobId, job.projectName(), indexedCount, unitsCount, elapsedMs / 1000.0, failedCount);

    } catch (Exception e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
      LOGGER.error("Job {} failed: {}", jobId, message, e);
      if (jobStore.updateStatus(jobId, JobStatus.FAILED, message)) {
        finished = true;
        structuredLogger.logJobTransition(jobId, JobStatus.RUNNING, JobStatus.FAILED);
        notifications.notifyFailed(jobId, job.projectName(), message, indexedCount, totalFiles);
      }
    } finally {
      // Paused jobs keep their signal for resume; cancelJob clears cancelled ones.
      if (finished) {
        signals.remove(jobId, signal);
      }
      closeQuietly(jobId, worker);
      StructuredLogger.clearJobContext();
    }
  }

  private CancellationSignal signalFor(String jobId) {
    return signals.computeIfAbsent(jobId, id -> new CancellationSignal());
  }

  private static void closeQuietly(String jobId, IndexingWorker worker) {
    if (worker == null) {
      return;
    }
    try {
      worker.close();
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to close worker for job {}: {}", jobId, e.getMessage());
    }
  }

  private static Path validateDirectory(Path directory) {
    if (directory == null) {
      throw new JobValidationException("Directory is required");
    }
    Path absolute = directory.toAbsolutePath().normalize();
    if (!Files.exists(absolute)) {
      throw new JobValidationException("Directory does not exist: " + absolute);
    }
    if (!Files.isDirectory(absolute)) {
      throw new JobValidationException("Not a directory: " + absolute);
    }
    try {
      return absolute.toRealPath();
    } catch (IOException e) {
      throw new JobValidationException("Cannot resolve directory: " + absolute, e);
    }
  }

  private static String baseName(Path directory) {
    Path name = directory.getFileName();
    return name != null ? name.toString() : directory.toString();
  }

  private static int orZero(Integer value) {
    return value != null ? value : 0;
  }
}
