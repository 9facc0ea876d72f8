package com.example.refreshingclient.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Performs single credential refresh attempts on behalf of the scheduler and of callers whose
 * operation was rejected.
 *
 * <p>Attempts are debounced by {@link RefreshSettings#minFetchInterval()}: an attempt started less
 * than that interval after the previous one fails fast with {@link HighFrequencyFetchException}.
 * After failures, the calling thread is throttled by the current backoff before the issuer is
 * called again. The state lock is never held while sleeping or while the issuer runs.
 */
public class CredentialFetcher {

  private static final Logger logger = System.getLogger(CredentialFetcher.class.getName());

  /** Blocks the calling thread; replaced in tests. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final CredentialState state;
  private final CredentialIssuer issuer;
  private final RemoteClient client;
  private final RefreshSettings settings;
  private final Clock clock;
  private final Sleeper sleeper;

  public CredentialFetcher(
      final CredentialState state,
      final CredentialIssuer issuer,
      final RemoteClient client,
      final RefreshSettings settings,
      final Clock clock) {
    this(state, issuer, client, settings, clock, d -> Thread.sleep(d.toMillis()));
  }

  CredentialFetcher(
      final CredentialState state,
      final CredentialIssuer issuer,
      final RemoteClient client,
      final RefreshSettings settings,
      final Clock clock,
      final Sleeper sleeper) {
    this.state = Objects.requireNonNull(state, "state");
    this.issuer = Objects.requireNonNull(issuer, "issuer");
    this.client = Objects.requireNonNull(client, "client");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Obtains a new credential and installs it into the underlying client.
   *
   * @throws HighFrequencyFetchException if the previous attempt started less than the minimum
   *     fetch interval ago
   * @throws CredentialFetchException if the issuer failed or the throttle delay was interrupted
   */
  public void fetch() throws CredentialRefreshException {
    final var admitted = state.tryBeginFetch(clock.instant(), settings.minFetchInterval());
    if (admitted.isEmpty()) {
      logger.log(DEBUG, "Credential fetch skipped, previous attempt is too recent");
      throw new HighFrequencyFetchException("Credential fetch frequency is too high");
    }

    final var throttle = admitted.get();
    if (!throttle.isZero()) {
      logger.log(DEBUG, "Throttling credential fetch for {0} after failures", throttle);
      try {
        sleeper.sleep(throttle);
      } catch (final InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw new CredentialFetchException("Interrupted before fetching credential", ie);
      }
    }

    final Credential credential;
    try {
      credential = issuer.issue();
      Objects.requireNonNull(credential, "issuer returned no credential");
    } catch (final Exception e) {
      state.recordFailure(settings.backoffMin(), settings.backoffMax());
      logger.log(WARNING, "Failed to fetch credential", e);
      throw new CredentialFetchException("Failed to fetch credential: " + e.getMessage(), e);
    }

    state.recordSuccess(credential.expiresAt());
    install(credential);
    logger.log(
        INFO,
        "Fetched credential {0}, expires at {1}",
        credential.accessKeyId(),
        credential.expiresAt());
  }

  public CredentialState state() {
    return state;
  }

  private void install(final Credential credential) {
    try {
      client.resetAccessKeyToken(
          credential.accessKeyId(), credential.accessKeySecret(), credential.securityToken());
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failed to install fetched credential into client", e);
    }
  }
}
