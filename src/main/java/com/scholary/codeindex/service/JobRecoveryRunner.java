package com.scholary.codeindex.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Moves jobs a previous process left in RUNNING to PAUSED, so they can be resumed from their
 * ledger. Nothing is restarted automatically.
 */
@Component
@ConditionalOnProperty(prefix = "indexing.recovery", name = "demote-running-on-startup")
public class JobRecoveryRunner implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRecoveryRunner.class);

  private final BackgroundIndexer indexer;

  public JobRecoveryRunner(BackgroundIndexer indexer) {
    this.indexer = indexer;
  }

  @Override
  public void run(ApplicationArguments args) {
    int demoted = indexer.pauseOrphanedJobs();
    if (demoted > 0) {
      LOGGER.warn("Paused {} jobs left running by a previous process", demoted);
    }
  }
}
