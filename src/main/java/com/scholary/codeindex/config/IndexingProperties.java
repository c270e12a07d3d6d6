package com.scholary.codeindex.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for background indexing.
 *
 * <p>Controls executor sizing, job housekeeping, notification throttling and the default worker.
 */
@ConfigurationProperties(prefix = "indexing")
@Validated
public record IndexingProperties(
    @Valid @NotNull ExecutorProperties executor,
    @Valid @NotNull JobsProperties jobs,
    @Valid @NotNull NotificationProperties notifications,
    @Valid @NotNull WorkerProperties worker,
    @Valid @NotNull RecoveryProperties recovery) {

  public record ExecutorProperties(@Positive int threads, @Positive int queueSize) {}

  public record JobsProperties(
      @NotNull Duration stopTimeout,
      @Positive int defaultListLimit,
      @Positive int retentionDays,
      @NotBlank String cleanupCron) {}

  public record NotificationProperties(
      @NotNull Duration progressInterval, @NotNull Duration deliveryTimeout, @Positive int threads) {}

  /** @param supportedExtensions extensions handled by the default worker, e.g. ".java" */
  public record WorkerProperties(@NotEmpty List<String> supportedExtensions) {}

  /** @param demoteRunningOnStartup move jobs left RUNNING by a crash to PAUSED at startup */
  public record RecoveryProperties(boolean demoteRunningOnStartup) {}
}
