package com.example.refreshingclient.core.reactive;

import com.example.refreshingclient.core.AuthErrorDetector;
import com.example.refreshingclient.core.CredentialFetcher;
import com.example.refreshingclient.core.CredentialRefreshException;
import java.util.Objects;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * Reactive counterpart of {@link com.example.refreshingclient.core.RetryingInvoker} for operations
 * returning a {@link Mono}.
 *
 * <p>Each retry re-subscribes to a freshly supplied {@code Mono}. The refresh runs on {@link
 * Schedulers#boundedElastic()} because {@link CredentialFetcher#fetch()} may block while
 * throttled.
 *
 * <pre>{@code
 * var invoker = new ReactiveRetryingInvoker(fetcher, AuthErrorDetector.defaultDetector(), 3);
 * Mono<Project> project = invoker.invoke(() -> asyncClient.getProject("my-project"));
 * }</pre>
 */
public final class ReactiveRetryingInvoker {

  private static final System.Logger logger =
      System.getLogger(ReactiveRetryingInvoker.class.getName());

  private final CredentialFetcher fetcher;
  private final AuthErrorDetector detector;
  private final int maxTryTimes;

  public ReactiveRetryingInvoker(
      final CredentialFetcher fetcher, final AuthErrorDetector detector, final int maxTryTimes) {
    if (maxTryTimes < 1) throw new IllegalArgumentException("maxTryTimes must be >= 1");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.maxTryTimes = maxTryTimes;
  }

  /**
   * Subscribes to the supplied operation, refreshing the credential and re-subscribing on
   * credential rejections.
   *
   * @param call supplier of the operation, invoked once per attempt
   * @param <T> result type
   * @return a Mono emitting the operation result or its last failure
   */
  public <T> Mono<T> invoke(final Supplier<? extends Mono<T>> call) {
    return Mono.defer(call).retryWhen(authRetrySpec());
  }

  private Retry authRetrySpec() {
    return Retry.from(
        signals ->
            signals.concatMap(
                signal -> {
                  final var failure = signal.failure();
                  final var attempt = signal.totalRetries() + 1;
                  if (!detector.isAuthError(failure)) return Mono.<Long>error(failure);
                  logger.log(
                      System.Logger.Level.DEBUG,
                      "Credential rejected on attempt {0}, refreshing",
                      attempt);
                  return Mono.fromCallable(
                          () -> {
                            fetcher.fetch();
                            return attempt;
                          })
                      .subscribeOn(Schedulers.boundedElastic())
                      .onErrorMap(
                          CredentialRefreshException.class,
                          fetchError -> {
                            logger.log(
                                System.Logger.Level.WARNING,
                                "Operation error: {0}, credential refresh error: {1}",
                                failure.getMessage(),
                                fetchError.getMessage());
                            failure.addSuppressed(fetchError);
                            return failure;
                          })
                      .flatMap(
                          refreshed -> {
                            if (refreshed < maxTryTimes) return Mono.just(refreshed);
                            logger.log(
                                System.Logger.Level.WARNING,
                                "Credential still rejected after {0} attempts",
                                refreshed);
                            return Mono.<Long>error(failure);
                          });
                }));
  }
}
