package com.scholary.codeindex.notification;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Fans indexing job events out to every registered {@link NotificationBackend}.
 *
 * <p>Backends are called concurrently on the notification executor. The caller waits at most the
 * delivery timeout, and a failing backend never affects the others or the caller.
 *
 * <p>Only progress events are throttled: at most one per job per progress interval. The
 * last-emitted timestamps live in a Caffeine cache so that entries for jobs that never reach a
 * terminal event (e.g. after a crash) eventually expire.
 */
@Component
public class NotificationDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<NotificationBackend> backends;
  private final Executor executor;
  private final Duration progressInterval;
  private final Duration deliveryTimeout;
  private final Clock clock;

  private final Cache<String, Instant> lastProgressAt;
  private final Object throttleLock = new Object();

  public NotificationDispatcher(
      List<NotificationBackend> backends,
      @Qualifier("notificationExecutor") Executor executor,
      @Value("${indexing.notifications.progress-interval:5s}") Duration progressInterval,
      @Value("${indexing.notifications.delivery-timeout:10s}") Duration deliveryTimeout,
      Clock clock) {
    this.backends = new CopyOnWriteArrayList<>(backends);
    this.executor = executor;
    this.progressInterval = progressInterval;
    this.deliveryTimeout = deliveryTimeout;
    this.clock = clock;
    this.lastProgressAt =
        Caffeine.newBuilder().expireAfterAccess(Duration.ofHours(6)).maximumSize(10_000).build();

    LOGGER.info(
        "Notification dispatcher initialized: backends={}, progressInterval={}",
        this.backends.size(),
        progressInterval);
  }

  public void addBackend(NotificationBackend backend) {
    backends.add(backend);
  }

  public void removeBackend(NotificationBackend backend) {
    backends.remove(backend);
  }

  public List<NotificationBackend> getBackends() {
    return List.copyOf(backends);
  }

  public void notifyStarted(
      String jobId, String projectName, String directory, Integer totalFiles) {
    String title = "Indexing Started: " + projectName;
    String message =
        totalFiles != null && totalFiles > 0
            ? String.format("Indexing %,d files from %s", totalFiles, directory)
            : "Indexing files from " + directory;
    message += "\nJob ID: " + jobId;

    dispatch(title, message, NotificationLevel.INFO);
  }

  /**
   * Report progress, subject to per-job throttling.
   *
   * @return true if the event was delivered, false if it was dropped by the throttle
   */
  public boolean notifyProgress(
      String jobId,
      String projectName,
      int indexedFiles,
      int totalFiles,
      int totalUnits,
      String currentFile) {
    if (!acquireProgressSlot(jobId)) {
      return false;
    }

    String title = "Indexing Progress: " + projectName;
    StringBuilder message =
        new StringBuilder(
            String.format(
                "%,d/%,d files (%.1f%%)", indexedFiles, totalFiles, percent(indexedFiles, totalFiles)));
    message.append(String.format("%n%,d semantic units indexed", totalUnits));
    if (currentFile != null) {
      message.append("\nCurrent: ").append(currentFile);
    }

    dispatch(title, message.toString(), NotificationLevel.INFO);
    return true;
  }

  public void notifyCompleted(
      String jobId,
      String projectName,
      int indexedFiles,
      int totalUnits,
      double elapsedSeconds,
      int failedFiles) {
    forgetProgress(jobId);

    String title = "Indexing Complete: " + projectName;
    StringBuilder message = new StringBuilder(String.format("Indexed %,d files", indexedFiles));
    message.append(String.format("%n%,d semantic units", totalUnits));
    message.append(String.format("%nTime: %.1fs", elapsedSeconds));
    if (indexedFiles > 0 && elapsedSeconds > 0) {
      message.append(String.format(" (%.1f files/sec)", indexedFiles / elapsedSeconds));
    }
    if (failedFiles > 0) {
      message.append(String.format("%n%,d files failed", failedFiles));
    }

    dispatch(title, message.toString(), NotificationLevel.SUCCESS);
  }

  public void notifyPaused(String jobId, String projectName, int indexedFiles, int totalFiles) {
    forgetProgress(jobId);

    String title = "Indexing Paused: " + projectName;
    String message =
        String.format(
            "Progress: %,d/%,d files (%.1f%%)%nJob ID: %s",
            indexedFiles, totalFiles, percent(indexedFiles, totalFiles), jobId);

    dispatch(title, message, NotificationLevel.WARNING);
  }

  public void notifyResumed(
      String jobId, String projectName, int indexedFiles, int remainingFiles) {
    String title = "Indexing Resumed: " + projectName;
    String message =
        String.format(
            "Already indexed: %,d files%nRemaining: %,d files%nJob ID: %s",
            indexedFiles, remainingFiles, jobId);

    dispatch(title, message, NotificationLevel.INFO);
  }

  public void notifyFailed(
      String jobId,
      String projectName,
      String errorMessage,
      int indexedFiles,
      Integer totalFiles) {
    forgetProgress(jobId);

    String title = "Indexing Failed: " + projectName;
    StringBuilder message = new StringBuilder("Error: " + errorMessage);
    if (totalFiles != null && totalFiles > 0) {
      message.append(
          String.format(
              "%nProgress before failure: %,d/%,d (%.1f%%)",
              indexedFiles, totalFiles, percent(indexedFiles, totalFiles)));
    } else {
      message.append(String.format("%nFiles indexed before failure: %,d", indexedFiles));
    }
    message.append("\nJob ID: ").append(jobId);

    dispatch(title, message.toString(), NotificationLevel.ERROR);
  }

  public void notifyCancelled(
      String jobId, String projectName, int indexedFiles, Integer totalFiles) {
    forgetProgress(jobId);

    String title = "Indexing Cancelled: " + projectName;
    String message =
        totalFiles != null && totalFiles > 0
            ? String.format(
                "Progress: %,d/%,d files (%.1f%%)",
                indexedFiles, totalFiles, percent(indexedFiles, totalFiles))
            : String.format("Files indexed: %,d", indexedFiles);
    message += "\nJob ID: " + jobId;

    dispatch(title, message, NotificationLevel.WARNING);
  }

  private boolean acquireProgressSlot(String jobId) {
    synchronized (throttleLock) {
      Instant now = clock.instant();
      Instant last = lastProgressAt.getIfPresent(jobId);
      if (last != null && Duration.between(last, now).compareTo(progressInterval) < 0) {
        return false;
      }
      lastProgressAt.put(jobId, now);
      return true;
    }
  }

  private void forgetProgress(String jobId) {
    synchronized (throttleLock) {
      lastProgressAt.invalidate(jobId);
    }
  }

  private void dispatch(String title, String message, NotificationLevel level) {
    List<CompletableFuture<Void>> deliveries = new ArrayList<>();
    for (NotificationBackend backend : backends) {
      try {
        deliveries.add(
            CompletableFuture.runAsync(() -> deliver(backend, title, message, level), executor));
      } catch (RejectedExecutionException e) {
        LOGGER.warn(
            "Notification to {} rejected by executor: {}",
            backend.getClass().getSimpleName(),
            e.getMessage());
      }
    }

    try {
      CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0]))
          .get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOGGER.warn("Notification '{}' not delivered to all backends within {}", title, deliveryTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while delivering notification '{}'", title);
    } catch (ExecutionException e) {
      LOGGER.warn("Notification '{}' delivery failed: {}", title, e.getCause().getMessage());
    }
  }

  private void deliver(
      NotificationBackend backend, String title, String message, NotificationLevel level) {
    try {
      backend.notify(title, message, level);
    } catch (RuntimeException e) {
      LOGGER.error(
          "Notification backend {} failed: {}", backend.getClass().getSimpleName(), e.getMessage(), e);
    }
  }

  private static double percent(int part, int total) {
    return total > 0 ? part * 100.0 / total : 0.0;
  }
}
