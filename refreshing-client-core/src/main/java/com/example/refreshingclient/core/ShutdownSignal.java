package com.example.refreshingclient.core;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation token shared between a {@link RefreshScheduler} and the host that owns its
 * lifetime. Once signalled it stays signalled.
 */
public final class ShutdownSignal {

  private final CountDownLatch latch = new CountDownLatch(1);

  public void signal() {
    latch.countDown();
  }

  public boolean isSignalled() {
    return latch.getCount() == 0;
  }

  /**
   * Waits until the signal arrives or the timeout elapses, whichever comes first.
   *
   * <p>Timeouts too long to express in nanoseconds wait until the signal arrives.
   *
   * @param timeout maximum time to wait
   * @return true if the signal arrived, false if the timeout elapsed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(final Duration timeout) throws InterruptedException {
    return latch.await(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
  }

  static long saturatedNanos(final Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (final ArithmeticException overflow) {
      return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }
}
