package com.example.refreshingclient.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Background task that renews the credential before it expires.
 *
 * <p>Each cycle waits a fraction of the remaining validity (see {@link #nextInterval(Duration)}),
 * then runs {@link CredentialFetcher#fetch()}. A failed fetch is logged and retried on the next
 * cycle; callers still recover through {@link RetryingInvoker} in the meantime.
 *
 * <p>The task stops when the {@link ShutdownSignal} arrives, which interrupts the current wait, or
 * when {@link #close()} has been called, which is observed after the next fetch.
 */
public final class RefreshScheduler {

  private static final Logger logger = System.getLogger(RefreshScheduler.class.getName());

  private static final Duration ONE_MINUTE = Duration.ofMinutes(1);
  private static final Duration TEN_MINUTES = Duration.ofMinutes(10);
  private static final Duration ONE_HOUR = Duration.ofHours(1);
  private static final Duration NEAR_EXPIRY_INTERVAL = Duration.ofSeconds(30);

  private final CredentialFetcher fetcher;
  private final ShutdownSignal shutdownSignal;
  private final Clock clock;
  private final UnaryOperator<Duration> intervalPolicy;
  private final ExecutorService executor;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private volatile boolean closed;

  public RefreshScheduler(
      final CredentialFetcher fetcher,
      final ShutdownSignal shutdownSignal,
      final Clock clock,
      final String name) {
    this(fetcher, shutdownSignal, clock, name, RefreshScheduler::nextInterval);
  }

  RefreshScheduler(
      final CredentialFetcher fetcher,
      final ShutdownSignal shutdownSignal,
      final Clock clock,
      final String name,
      final UnaryOperator<Duration> intervalPolicy) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.intervalPolicy = Objects.requireNonNull(intervalPolicy, "intervalPolicy");
    this.executor =
        Executors.newSingleThreadExecutor(
            r -> {
              var t = new Thread(r, "CredentialRefresh-" + name);
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Maps the remaining validity of the credential to the wait before the next fetch.
   *
   * <ul>
   *   <li>less than 1 minute: 30 seconds
   *   <li>less than 10 minutes: 70% of the remaining time
   *   <li>less than 1 hour: 60% of the remaining time
   *   <li>otherwise: 50% of the remaining time
   * </ul>
   *
   * @param timeToExpiry remaining validity, negative once expired
   * @return wait before the next fetch
   */
  public static Duration nextInterval(final Duration timeToExpiry) {
    if (timeToExpiry.compareTo(ONE_MINUTE) < 0) return NEAR_EXPIRY_INTERVAL;
    if (timeToExpiry.compareTo(TEN_MINUTES) < 0) return timeToExpiry.dividedBy(10).multipliedBy(7);
    if (timeToExpiry.compareTo(ONE_HOUR) < 0) return timeToExpiry.dividedBy(10).multipliedBy(6);
    return timeToExpiry.dividedBy(10).multipliedBy(5);
  }

  /**
   * Starts the background task. May be called once.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true))
      throw new IllegalStateException("RefreshScheduler already started");
    executor.execute(this::run);
    executor.shutdown();
  }

  /** Sets the terminal flag; the task exits after its next fetch. */
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  public boolean isRunning() {
    return started.get() && !executor.isTerminated();
  }

  /**
   * Waits for the background task to exit.
   *
   * @param timeout maximum time to wait
   * @return true if the task has exited
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(final Duration timeout) throws InterruptedException {
    return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void run() {
    logger.log(INFO, "Credential refresh task started");
    try {
      while (true) {
        final var interval =
            intervalPolicy.apply(fetcher.state().timeToExpiry(clock.instant()));
        logger.log(DEBUG, "Next credential fetch in {0}", interval);

        if (shutdownSignal.await(interval)) {
          logger.log(INFO, "Shutdown signal received, stopping credential refresh task");
          return;
        }

        try {
          fetcher.fetch();
          logger.log(DEBUG, "Scheduled credential fetch done");
        } catch (final CredentialRefreshException | RuntimeException e) {
          logger.log(WARNING, "Scheduled credential fetch failed: {0}", e.getMessage());
        }

        if (closed) {
          logger.log(INFO, "Closed, stopping credential refresh task");
          return;
        }
      }
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      logger.log(INFO, "Credential refresh task interrupted");
    }
  }
}
