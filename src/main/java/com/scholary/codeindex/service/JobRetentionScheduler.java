package com.scholary.codeindex.service;

import com.scholary.codeindex.config.IndexingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically removes finished jobs older than the configured retention. */
@Component
public class JobRetentionScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRetentionScheduler.class);

  private final BackgroundIndexer indexer;
  private final int retentionDays;

  public JobRetentionScheduler(BackgroundIndexer indexer, IndexingProperties properties) {
    this.indexer = indexer;
    this.retentionDays = properties.jobs().retentionDays();
  }

  @Scheduled(cron = "${indexing.jobs.cleanup-cron}")
  public void cleanOldJobs() {
    try {
      int removed = indexer.cleanOldJobs(retentionDays);
      if (removed > 0) {
        LOGGER.info("Retention cleanup removed {} jobs older than {} days", removed, retentionDays);
      }
    } catch (RuntimeException e) {
      LOGGER.error("Retention cleanup failed: {}", e.getMessage(), e);
    }
  }
}
