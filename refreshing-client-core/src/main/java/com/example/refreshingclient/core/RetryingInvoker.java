package com.example.refreshingclient.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.util.Objects;

/**
 * Runs remote operations and recovers from credential rejections.
 *
 * <p>When an attempt fails with an error the {@link AuthErrorDetector} classifies as a credential
 * rejection, a refresh is forced through {@link CredentialFetcher#fetch()} and the operation is
 * attempted again, up to {@code maxTryTimes} attempts in total. Every rejection triggers a refresh,
 * including the last one. Any other failure is rethrown immediately. If the refresh itself fails,
 * the operation's own failure is rethrown with the refresh failure attached as a suppressed
 * exception.
 *
 * <pre>{@code
 * var invoker = new RetryingInvoker(fetcher, AuthErrorDetector.defaultDetector(), 3);
 * var projects = invoker.invoke(() -> client.listProjects());
 * }</pre>
 */
public final class RetryingInvoker {

  private static final Logger logger = System.getLogger(RetryingInvoker.class.getName());

  private final CredentialFetcher fetcher;
  private final AuthErrorDetector detector;
  private final int maxTryTimes;

  public RetryingInvoker(
      final CredentialFetcher fetcher, final AuthErrorDetector detector, final int maxTryTimes) {
    if (maxTryTimes < 1) throw new IllegalArgumentException("maxTryTimes must be >= 1");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.maxTryTimes = maxTryTimes;
  }

  /**
   * Executes the operation, refreshing the credential and retrying on credential rejections.
   *
   * @param call operation to execute; executed once per attempt
   * @param <T> result type
   * @param <E> checked exception type of the operation
   * @return the operation result
   * @throws E the operation's failure when it is not a credential rejection, when the refresh
   *     failed, or when all attempts were rejected
   */
  public <T, E extends Exception> T invoke(final RemoteCall<T, E> call) throws E {
    Exception failure = null;
    for (var attempt = 1; attempt <= maxTryTimes; attempt++) {
      try {
        return call.call();
      } catch (final Exception e) {
        failure = e;
      }

      if (!detector.isAuthError(failure)) throw RetryingInvoker.<E>rethrow(failure);

      logger.log(DEBUG, "Credential rejected on attempt {0}, refreshing", attempt);
      try {
        fetcher.fetch();
      } catch (final CredentialRefreshException fetchError) {
        logger.log(
            WARNING,
            "Operation error: {0}, credential refresh error: {1}",
            failure.getMessage(),
            fetchError.getMessage());
        failure.addSuppressed(fetchError);
        throw RetryingInvoker.<E>rethrow(failure);
      }
    }

    logger.log(WARNING, "Credential still rejected after {0} attempts", maxTryTimes);
    throw RetryingInvoker.<E>rethrow(failure);
  }

  public int maxTryTimes() {
    return maxTryTimes;
  }

  /** Only {@code E} or unchecked exceptions can reach here, as enforced by {@link RemoteCall}. */
  @SuppressWarnings("unchecked")
  private static <E extends Exception> E rethrow(final Exception failure) throws E {
    if (failure instanceof RuntimeException runtime) throw runtime;
    throw (E) failure;
  }
}
