package com.example.refreshingclient.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared record of the current credential's expiry and of the refresh history.
 *
 * <p>All fields are guarded by a single lock that is held only for the read or update itself,
 * never across a sleep or an issuer call. Instances start with {@code expiresAt} and {@code
 * lastFetchAt} at the epoch, so the first fetch is never debounced.
 *
 * <p>Invariants:
 *
 * <ul>
 *   <li>{@code consecutiveFailures == 0} if and only if {@code currentBackoff} is zero
 *   <li>a non-zero {@code currentBackoff} lies within {@code [backoffMin, backoffMax]}
 *   <li>{@code expiresAt} never moves earlier and only changes on a successful fetch
 * </ul>
 */
public final class CredentialState {

  private final ReentrantLock lock = new ReentrantLock();

  private Instant expiresAt = Instant.EPOCH;
  private Instant lastFetchAt = Instant.EPOCH;
  private int consecutiveFailures;
  private Duration currentBackoff = Duration.ZERO;

  /**
   * Point-in-time copy of the state.
   *
   * @param expiresAt expiry of the current credential
   * @param lastFetchAt start of the last admitted fetch attempt
   * @param consecutiveFailures failed attempts since the last success
   * @param currentBackoff throttle delay applied before the next attempt
   */
  public record Snapshot(
      Instant expiresAt, Instant lastFetchAt, int consecutiveFailures, Duration currentBackoff) {}

  /**
   * Admits a fetch attempt unless the previous one started less than {@code minFetchInterval}
   * ago. An admitted attempt records {@code now} as the last fetch time.
   *
   * @param now current time
   * @param minFetchInterval debounce window
   * @return the throttle delay to apply before calling the issuer, or empty if debounced
   */
  Optional<Duration> tryBeginFetch(final Instant now, final Duration minFetchInterval) {
    lock.lock();
    try {
      if (Duration.between(lastFetchAt, now).compareTo(minFetchInterval) < 0) {
        return Optional.empty();
      }
      lastFetchAt = now;
      return Optional.of(currentBackoff);
    } finally {
      lock.unlock();
    }
  }

  void recordSuccess(final Instant issuedExpiry) {
    lock.lock();
    try {
      consecutiveFailures = 0;
      currentBackoff = Duration.ZERO;
      if (issuedExpiry.isAfter(expiresAt)) expiresAt = issuedExpiry;
    } finally {
      lock.unlock();
    }
  }

  void recordFailure(final Duration backoffMin, final Duration backoffMax) {
    lock.lock();
    try {
      consecutiveFailures++;
      currentBackoff = clamp(currentBackoff.multipliedBy(2), backoffMin, backoffMax);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Time left until the current credential expires; negative once expired.
   *
   * @param now current time
   * @return remaining validity
   */
  public Duration timeToExpiry(final Instant now) {
    lock.lock();
    try {
      return Duration.between(now, expiresAt);
    } finally {
      lock.unlock();
    }
  }

  public Snapshot snapshot() {
    lock.lock();
    try {
      return new Snapshot(expiresAt, lastFetchAt, consecutiveFailures, currentBackoff);
    } finally {
      lock.unlock();
    }
  }

  static Duration clamp(final Duration value, final Duration min, final Duration max) {
    if (value.compareTo(min) < 0) return min;
    if (value.compareTo(max) > 0) return max;
    return value;
  }
}
