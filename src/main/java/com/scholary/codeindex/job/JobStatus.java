package com.scholary.codeindex.job;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of an indexing job.
 *
 * <p>Legal edges:
 *
 * <ul>
 *   <li>QUEUED to RUNNING, CANCELLED, or FAILED (the executor refused the job)
 *   <li>RUNNING to PAUSED, COMPLETED, FAILED or CANCELLED
 *   <li>PAUSED to QUEUED (resume) or CANCELLED
 * </ul>
 *
 * <p>COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum JobStatus {
  QUEUED,
  RUNNING,
  PAUSED,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public boolean canTransitionTo(JobStatus target) {
    return target.legalPredecessors().contains(this);
  }

  /** States from which a job may move into this state. */
  public Set<JobStatus> legalPredecessors() {
    switch (this) {
      case RUNNING:
        return EnumSet.of(QUEUED);
      case PAUSED:
        return EnumSet.of(RUNNING);
      case QUEUED:
        return EnumSet.of(PAUSED);
      case COMPLETED:
        return EnumSet.of(RUNNING);
      case FAILED:
        return EnumSet.of(QUEUED, RUNNING);
      case CANCELLED:
        return EnumSet.of(QUEUED, RUNNING, PAUSED);
      default:
        return Collections.emptySet();
    }
  }

  public static Set<JobStatus> terminalStates() {
    return EnumSet.of(COMPLETED, FAILED, CANCELLED);
  }
}
