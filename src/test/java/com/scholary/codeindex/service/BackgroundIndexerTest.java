package com.scholary.codeindex.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.codeindex.job.IndexedFileRepository;
import com.scholary.codeindex.job.IndexingJob;
import com.scholary.codeindex.job.JobEntityRepository;
import com.scholary.codeindex.job.JobStatus;
import com.scholary.codeindex.job.JpaJobStore;
import com.scholary.codeindex.notification.CallbackNotificationBackend;
import com.scholary.codeindex.notification.NotificationDispatcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs real job executions against the JPA store. Not transactional, so the indexing threads see
 * committed rows.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import(JpaJobStore.class)
class BackgroundIndexerTest {

  @TestConfiguration
  static class ClockConfig {
    @Bean
    Clock clock() {
      return Clock.systemUTC();
    }
  }

  @Autowired private JpaJobStore jpaJobStore;
  @Autowired private JobEntityRepository jobRepository;
  @Autowired private IndexedFileRepository indexedFileRepository;

  @TempDir Path tempDir;

  private Path root;
  private RecordingJobStore store;
  private FakeIndexingWorker.Script script;
  private ThreadPoolTaskExecutor executor;
  private final List<String> notificationTitles = new CopyOnWriteArrayList<>();
  private BackgroundIndexer indexer;

  @BeforeEach
  void setUp() throws IOException {
    indexedFileRepository.deleteAll();
    jobRepository.deleteAll();

    root = tempDir.resolve("demo-project");
    Files.createDirectories(root);
    root = root.toRealPath();

    store = new RecordingJobStore(jpaJobStore);
    script = new FakeIndexingWorker.Script();
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(10);
    executor.setThreadNamePrefix("indexing-test-");
    executor.initialize();
    indexer = newIndexer(executor, Duration.ofSeconds(3));
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void startInline_shouldIndexEveryFileAndComplete() throws IOException {
    writeFiles("a.py", "b.py", "c.py");

    String jobId = indexer.startIndexingJob(root, "demo", true, false);

    IndexingJob job = indexer.getJobStatus(jobId).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.indexedFiles()).isEqualTo(3);
    assertThat(job.totalFiles()).isEqualTo(3);
    assertThat(job.totalUnits()).isEqualTo(6);
    assertThat(job.failedFiles()).isZero();
    assertThat(job.indexedFileList()).hasSize(3);
    assertThat(job.startedAt()).isNotNull();
    assertThat(job.completedAt()).isNotNull();
    assertThat(script.closed.get()).isEqualTo(1);
    assertThat(store.history(jobId))
        .containsExactly(JobStatus.QUEUED, JobStatus.RUNNING, JobStatus.COMPLETED);
    assertThat(notificationTitles)
        .contains("Indexing Started: demo", "Indexing Complete: demo");
  }

  @Test
  void start_shouldDefaultProjectNameToDirectoryName() throws IOException {
    writeFiles("a.py");

    String jobId = indexer.startIndexingJob(root, null, true, false);

    assertThat(indexer.getJobStatus(jobId).orElseThrow().projectName()).isEqualTo("demo-project");
  }

  @Test
  void start_shouldIgnoreUnsupportedAndHiddenFiles() throws IOException {
    writeFiles("a.py", "notes.txt", ".secret.py", ".venv/lib/site.py", "pkg/b.py");

    String nonRecursive = indexer.startIndexingJob(root, "demo", false, false);
    String recursive = indexer.startIndexingJob(root, "demo", true, false);

    assertThat(indexer.getJobStatus(nonRecursive).orElseThrow().indexedFileList())
        .containsExactly(root.resolve("a.py").toString());
    assertThat(indexer.getJobStatus(recursive).orElseThrow().indexedFileList())
        .containsExactly(root.resolve("a.py").toString(), root.resolve("pkg/b.py").toString());
  }

  @Test
  void start_shouldRejectFileInsteadOfDirectory() throws IOException {
    writeFiles("a.py");

    assertThatThrownBy(() -> indexer.startIndexingJob(root.resolve("a.py"), "demo", true, false))
        .isInstanceOf(JobValidationException.class)
        .hasMessageContaining("Not a directory");
    assertThat(indexer.listJobs(null, null, 10)).isEmpty();
  }

  @Test
  void start_shouldRejectMissingDirectory() {
    assertThatThrownBy(
            () -> indexer.startIndexingJob(root.resolve("missing"), "demo", true, true))
        .isInstanceOf(JobValidationException.class)
        .hasMessageContaining("does not exist");
    assertThat(indexer.listJobs(null, null, 10)).isEmpty();
  }

  @Test
  void perFileFailures_shouldBeCountedWithoutFailingTheJob() throws IOException {
    writeFiles("a.py", "b.py", "broken.py", "d.py");
    script.failingNames.add("broken.py");

    String jobId = indexer.startIndexingJob(root, "demo", true, false);

    IndexingJob job = indexer.getJobStatus(jobId).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.failedFiles()).isEqualTo(1);
    assertThat(job.indexedFiles()).isEqualTo(3);
    assertThat(job.indexedFileList()).doesNotContain(root.resolve("broken.py").toString());
  }

  @Test
  void workerInitializationFailure_shouldFailTheJob() throws IOException {
    writeFiles("a.py");
    script.failInitialize = true;

    String jobId = indexer.startIndexingJob(root, "demo", true, false);

    IndexingJob job = indexer.getJobStatus(jobId).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.errorMessage()).isEqualTo("embedding model not available");
    assertThat(script.calls).isEmpty();
    assertThat(script.closed.get()).isEqualTo(1);
    assertThat(notificationTitles).contains("Indexing Failed: demo");
  }

  @Test
  void pauseThenResume_shouldFinishWithoutReindexingAnyFile() throws Exception {
    writeFiles("a.py", "b.py", "c.py", "d.py");
    script.delay = Duration.ofMillis(500);

    String jobId = indexer.startIndexingJob(root, "demo", true, true);
    assertThat(script.firstFileStarted.await(5, TimeUnit.SECONDS)).isTrue();
    Thread.sleep(100);

    assertThat(indexer.pauseJob(jobId)).isTrue();

    IndexingJob paused = indexer.getJobStatus(jobId).orElseThrow();
    assertThat(paused.status()).isEqualTo(JobStatus.PAUSED);
    assertThat(paused.indexedFiles()).isEqualTo(paused.indexedFileList().size());
    assertThat(paused.indexedFiles()).isLessThan(4);
    assertThat(notificationTitles).contains("Indexing Paused: demo");

    script.delay = Duration.ZERO;
    assertThat(indexer.resumeJob(jobId, false)).isTrue();

    IndexingJob done = indexer.getJobStatus(jobId).orElseThrow();
    assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(done.indexedFiles()).isEqualTo(4);
    assertThat(done.totalFiles()).isEqualTo(4);
    assertThat(new HashSet<>(script.calls)).hasSameSizeAs(script.calls);
    assertThat(script.calls).hasSize(4);
    assertThat(script.closed.get()).isEqualTo(2);
    assertThat(store.history(jobId))
        .containsExactly(
            JobStatus.QUEUED,
            JobStatus.RUNNING,
            JobStatus.PAUSED,
            JobStatus.QUEUED,
            JobStatus.RUNNING,
            JobStatus.COMPLETED);
    assertThat(notificationTitles).contains("Indexing Resumed: demo");
  }

  @Test
  void resume_shouldKeepOriginalStartTime() throws Exception {
    writeFiles("a.py", "b.py");
    script.delay = Duration.ofMillis(300);
    String jobId = indexer.startIndexingJob(root, "demo", true, true);
    script.firstFileStarted.await(5, TimeUnit.SECONDS);
    indexer.pauseJob(jobId);
    IndexingJob paused = indexer.getJobStatus(jobId).orElseThrow();

    script.delay = Duration.ZERO;
    indexer.resumeJob(jobId, false);

    assertThat(indexer.getJobStatus(jobId).orElseThrow().startedAt())
        .isEqualTo(paused.startedAt());
  }

  @Test
  void cancel_shouldStopMidRunAndBeFinal() throws Exception {
    writeFiles("a.py", "b.py", "c.py", "d.py", "e.py");
    script.delay = Duration.ofMillis(200);

    String jobId = indexer.startIndexingJob(root, "demo", true, true);
    assertThat(script.firstFileStarted.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(indexer.cancelJob(jobId)).isTrue();

    IndexingJob job = indexer.getJobStatus(jobId).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
    assertThat(job.indexedFiles()).isLessThan(job.totalFiles());
    assertThat(job.completedAt()).isNotNull();
    assertThat(indexer.resumeJob(jobId, false)).isFalse();
    assertThat(indexer.cancelJob(jobId)).isFalse();
    assertThat(notificationTitles).contains("Indexing Cancelled: demo");
    assertLegalHistory(jobId);
  }

  @Test
  void cancel_shouldInterruptExecutionPastTheStopTimeout() throws Exception {
    writeFiles("a.py", "b.py");
    script.delay = Duration.ofSeconds(10);
    BackgroundIndexer impatient = newIndexer(executor, Duration.ofMillis(100));

    String jobId = impatient.startIndexingJob(root, "demo", true, true);
    assertThat(script.firstFileStarted.await(5, TimeUnit.SECONDS)).isTrue();

    long start = System.nanoTime();
    assertThat(impatient.cancelJob(jobId)).isTrue();
    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5_000);

    awaitCondition(() -> script.closed.get() == 1);
    IndexingJob job = impatient.getJobStatus(jobId).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
    assertThat(job.indexedFiles()).isZero();
  }

  @Test
  void cancel_shouldWorkOnPausedJob() throws Exception {
    writeFiles("a.py", "b.py", "c.py");
    script.delay = Duration.ofMillis(200);
    String jobId = indexer.startIndexingJob(root, "demo", true, true);
    script.firstFileStarted.await(5, TimeUnit.SECONDS);
    indexer.pauseJob(jobId);

    assertThat(indexer.cancelJob(jobId)).isTrue();

    assertThat(indexer.getJobStatus(jobId).orElseThrow().status()).isEqualTo(JobStatus.CANCELLED);
    assertLegalHistory(jobId);
  }

  @Test
  void controlOperations_shouldReturnFalseForWrongStates() throws IOException {
    writeFiles("a.py");
    String jobId = indexer.startIndexingJob(root, "demo", true, false);

    assertThat(indexer.pauseJob(jobId)).isFalse();
    assertThat(indexer.resumeJob(jobId, false)).isFalse();
    assertThat(indexer.cancelJob(jobId)).isFalse();

    assertThat(indexer.pauseJob("missing")).isFalse();
    assertThat(indexer.resumeJob("missing", true)).isFalse();
    assertThat(indexer.cancelJob("missing")).isFalse();
    assertThat(indexer.deleteJob("missing")).isFalse();
    assertThat(indexer.getJobStatus("missing")).isEmpty();
  }

  @Test
  void delete_shouldRefuseActiveJobs() throws Exception {
    writeFiles("a.py", "b.py", "c.py");
    script.delay = Duration.ofMillis(200);
    String jobId = indexer.startIndexingJob(root, "demo", true, true);
    script.firstFileStarted.await(5, TimeUnit.SECONDS);
    indexer.pauseJob(jobId);
    IndexingJob before = indexer.getJobStatus(jobId).orElseThrow();

    assertThat(indexer.deleteJob(jobId)).isFalse();

    IndexingJob after = indexer.getJobStatus(jobId).orElseThrow();
    assertThat(after.status()).isEqualTo(JobStatus.PAUSED);
    assertThat(after.indexedFileList()).isEqualTo(before.indexedFileList());

    indexer.cancelJob(jobId);
    assertThat(indexer.deleteJob(jobId)).isTrue();
    assertThat(indexer.getJobStatus(jobId)).isEmpty();
  }

  @Test
  void rejectedByExecutor_shouldFailJobAndThrow() throws IOException {
    writeFiles("a.py");
    Executor full =
        command -> {
          throw new RejectedExecutionException("queue full");
        };
    BackgroundIndexer rejecting = newIndexer(full, Duration.ofSeconds(1));

    assertThatThrownBy(() -> rejecting.startIndexingJob(root, "demo", true, true))
        .isInstanceOf(JobSchedulingException.class);

    List<IndexingJob> jobs = rejecting.listJobs(null, null, 10);
    assertThat(jobs).hasSize(1);
    assertThat(jobs.get(0).status()).isEqualTo(JobStatus.FAILED);
    assertThat(jobs.get(0).errorMessage()).contains("could not be scheduled");
    assertThat(rejecting.trackedJobCount()).isZero();
  }

  @Test
  void backgroundJobs_shouldRunIndependently() throws Exception {
    Path other = Files.createDirectories(tempDir.resolve("other")).toRealPath();
    writeFiles("a.py", "b.py");
    Files.writeString(other.resolve("x.py"), "x = 1");

    String first = indexer.startIndexingJob(root, "demo", true, true);
    String second = indexer.startIndexingJob(other, "other", true, true);

    awaitStatus(first, JobStatus.COMPLETED);
    awaitStatus(second, JobStatus.COMPLETED);
    assertThat(indexer.getJobStatus(first).orElseThrow().indexedFiles()).isEqualTo(2);
    assertThat(indexer.getJobStatus(second).orElseThrow().indexedFiles()).isEqualTo(1);
    assertThat(indexer.listJobs(null, "other", 10)).hasSize(1);
  }

  @Test
  void pauseOrphanedJobs_shouldMakeCrashedJobsResumable() throws IOException {
    writeFiles("a.py", "b.py");
    String jobId = store.createJob("demo", root.toString(), true).id();
    store.updateStatus(jobId, JobStatus.RUNNING);
    store.addIndexedFile(jobId, root.resolve("a.py").toString());

    assertThat(indexer.pauseOrphanedJobs()).isEqualTo(1);
    assertThat(indexer.getJobStatus(jobId).orElseThrow().status()).isEqualTo(JobStatus.PAUSED);

    assertThat(indexer.resumeJob(jobId, false)).isTrue();

    IndexingJob job = indexer.getJobStatus(jobId).orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.indexedFiles()).isEqualTo(2);
    assertThat(script.calls).containsExactly(root.resolve("b.py"));
  }

  @Test
  void controlState_shouldBeReleasedWhenJobsFinish() throws Exception {
    writeFiles("a.py", "b.py", "c.py");
    script.delay = Duration.ofMillis(200);
    String paused = indexer.startIndexingJob(root, "demo", true, true);
    assertThat(script.firstFileStarted.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(indexer.pauseJob(paused)).isTrue();
    assertThat(indexer.trackedJobCount()).isEqualTo(1);

    assertThat(indexer.cancelJob(paused)).isTrue();
    assertThat(indexer.trackedJobCount()).isZero();

    script.delay = Duration.ZERO;
    for (int i = 0; i < 5; i++) {
      indexer.startIndexingJob(root, "demo", true, false);
    }
    script.failInitialize = true;
    indexer.startIndexingJob(root, "demo", true, false);
    assertThat(indexer.trackedJobCount()).isZero();

    indexer.cleanOldJobs(0);
    assertThat(indexer.trackedJobCount()).isZero();
  }

  @Test
  void cancel_shouldNotWaitForJobStillInExecutorQueue() throws Exception {
    writeFiles("a.py", "b.py");
    Path other = Files.createDirectories(tempDir.resolve("other")).toRealPath();
    Files.writeString(other.resolve("x.py"), "x = 1");
    script.delay = Duration.ofSeconds(10);
    ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
    single.setCorePoolSize(1);
    single.setMaxPoolSize(1);
    single.setQueueCapacity(5);
    single.initialize();
    BackgroundIndexer oneAtATime = newIndexer(single, Duration.ofSeconds(3));
    try {
      String busy = oneAtATime.startIndexingJob(root, "demo", true, true);
      assertThat(script.firstFileStarted.await(5, TimeUnit.SECONDS)).isTrue();
      String waiting = oneAtATime.startIndexingJob(other, "other", true, true);

      long start = System.nanoTime();
      assertThat(oneAtATime.cancelJob(waiting)).isTrue();
      assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1_000);

      IndexingJob cancelled = oneAtATime.getJobStatus(waiting).orElseThrow();
      assertThat(cancelled.status()).isEqualTo(JobStatus.CANCELLED);
      assertThat(cancelled.startedAt()).isNull();
      assertThat(script.calls).noneMatch(path -> path.startsWith(other));
      assertLegalHistory(waiting);

      oneAtATime.cancelJob(busy);
    } finally {
      single.shutdown();
    }
  }

  @Test
  void listJobs_shouldNotLoadLedgers() throws IOException {
    writeFiles("a.py", "b.py");
    String jobId = indexer.startIndexingJob(root, "demo", true, false);

    IndexingJob listed = indexer.listJobs(null, null, 10).get(0);

    assertThat(listed.id()).isEqualTo(jobId);
    assertThat(listed.indexedFileList()).isEmpty();
    assertThat(listed.indexedFiles()).isEqualTo(2);
    assertThat(listed.remainingFiles()).isZero();
    assertThat(indexer.getJobStatus(jobId).orElseThrow().indexedFileList()).hasSize(2);
  }

  private BackgroundIndexer newIndexer(Executor jobExecutor, Duration stopTimeout) {
    NotificationDispatcher notifications =
        new NotificationDispatcher(
            List.of(
                new CallbackNotificationBackend(
                    (title, message, level) -> notificationTitles.add(title))),
            Runnable::run,
            Duration.ZERO,
            Duration.ofSeconds(1),
            Clock.systemUTC());
    return new BackgroundIndexer(store, notifications, script, jobExecutor, stopTimeout);
  }

  private void writeFiles(String... names) throws IOException {
    for (String name : names) {
      Path file = root.resolve(name);
      Files.createDirectories(file.getParent());
      Files.writeString(file, "def f():\n    return '" + name + "'\n");
    }
  }

  private void assertLegalHistory(String jobId) {
    List<JobStatus> history = store.history(jobId);
    assertThat(history.get(0)).isEqualTo(JobStatus.QUEUED);
    for (int i = 1; i < history.size(); i++) {
      assertThat(history.get(i - 1).canTransitionTo(history.get(i)))
          .as("%s -> %s", history.get(i - 1), history.get(i))
          .isTrue();
    }
  }

  private void awaitStatus(String jobId, JobStatus status) throws InterruptedException {
    awaitCondition(
        () -> indexer.getJobStatus(jobId).map(j -> j.status() == status).orElse(false));
  }

  private static void awaitCondition(BooleanSupplier condition)
      throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Condition not met within 10s");
      }
      Thread.sleep(20);
    }
  }
}
