package com.scholary.codeindex.service;

import java.time.Duration;

/**
 * Per-job stop request observed cooperatively by the execution loop.
 *
 * <p>Process-local and never persisted. Pause and cancel set it; resume clears it once the previous
 * execution has exited.
 */
public final class CancellationSignal {

  private boolean signalled;

  public synchronized void signal() {
    signalled = true;
    notifyAll();
  }

  public synchronized void clear() {
    signalled = false;
  }

  public synchronized boolean isSignalled() {
    return signalled;
  }

  /**
   * Block until the signal is set or the timeout elapses.
   *
   * @return true if the signal was set
   * @throws InterruptedException if interrupted while waiting
   */
  public synchronized boolean awaitSignal(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!signalled) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return false;
      }
      long millis = remaining / 1_000_000L;
      int nanos = (int) (remaining % 1_000_000L);
      wait(millis, nanos);
    }
    return true;
  }
}
