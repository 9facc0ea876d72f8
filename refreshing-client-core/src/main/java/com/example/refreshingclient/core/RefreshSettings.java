package com.example.refreshingclient.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Static configuration of the refresh layer.
 *
 * <p>Values can be supplied via system properties or environment variables through {@link
 * #fromSystem()}:
 *
 * <ul>
 *   <li>refresh.max.try.times / REFRESH_MAX_TRY_TIMES
 *   <li>refresh.min.fetch.interval.millis / REFRESH_MIN_FETCH_INTERVAL_MILLIS
 *   <li>refresh.backoff.min.millis / REFRESH_BACKOFF_MIN_MILLIS
 *   <li>refresh.backoff.max.millis / REFRESH_BACKOFF_MAX_MILLIS
 * </ul>
 *
 * @param maxTryTimes attempts per operation including the first, must be >= 1
 * @param minFetchInterval debounce window between two issuer calls, must be non-negative
 * @param backoffMin smallest throttle delay after a failed fetch, must be positive
 * @param backoffMax largest throttle delay after failed fetches, must be >= backoffMin
 */
public record RefreshSettings(
    int maxTryTimes, Duration minFetchInterval, Duration backoffMin, Duration backoffMax) {

  public static final int DEFAULT_MAX_TRY_TIMES = 3;
  public static final Duration DEFAULT_MIN_FETCH_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_BACKOFF_MIN = Duration.ofSeconds(1);
  public static final Duration DEFAULT_BACKOFF_MAX = Duration.ofSeconds(60);

  public RefreshSettings {
    if (maxTryTimes < 1) throw new IllegalArgumentException("maxTryTimes must be >= 1");
    if (minFetchInterval == null || minFetchInterval.isNegative())
      throw new IllegalArgumentException("minFetchInterval must be non-negative");
    if (backoffMin == null || backoffMin.isNegative() || backoffMin.isZero())
      throw new IllegalArgumentException("backoffMin must be positive");
    if (backoffMax == null || backoffMax.compareTo(backoffMin) < 0)
      throw new IllegalArgumentException("backoffMax must be >= backoffMin");
  }

  /**
   * Returns the built-in defaults: 3 attempts, 1 second debounce, backoff between 1 and 60
   * seconds.
   *
   * @return default settings
   */
  public static RefreshSettings defaults() {
    return new RefreshSettings(
        DEFAULT_MAX_TRY_TIMES, DEFAULT_MIN_FETCH_INTERVAL, DEFAULT_BACKOFF_MIN, DEFAULT_BACKOFF_MAX);
  }

  /**
   * Reads settings from system properties, then environment variables, falling back to {@link
   * #defaults()} for missing, blank or unparsable values.
   *
   * @return settings from the environment
   */
  public static RefreshSettings fromSystem() {
    return new RefreshSettings(
        readLong("refresh.max.try.times", "REFRESH_MAX_TRY_TIMES")
            .filter(val -> val <= Integer.MAX_VALUE)
            .map(Long::intValue)
            .orElse(DEFAULT_MAX_TRY_TIMES),
        readLong("refresh.min.fetch.interval.millis", "REFRESH_MIN_FETCH_INTERVAL_MILLIS")
            .map(Duration::ofMillis)
            .orElse(DEFAULT_MIN_FETCH_INTERVAL),
        readLong("refresh.backoff.min.millis", "REFRESH_BACKOFF_MIN_MILLIS")
            .map(Duration::ofMillis)
            .orElse(DEFAULT_BACKOFF_MIN),
        readLong("refresh.backoff.max.millis", "REFRESH_BACKOFF_MAX_MILLIS")
            .map(Duration::ofMillis)
            .orElse(DEFAULT_BACKOFF_MAX));
  }

  private static Optional<Long> readLong(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            });
  }
}
