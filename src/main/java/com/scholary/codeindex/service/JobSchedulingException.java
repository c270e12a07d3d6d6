package com.scholary.codeindex.service;

/**
 * Thrown when the indexing executor refuses a new job, typically because its queue is full. The
 * job has already been marked FAILED when this is thrown.
 */
public class JobSchedulingException extends RuntimeException {

  private final String jobId;

  public JobSchedulingException(String jobId, String message, Throwable cause) {
    super(message, cause);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
