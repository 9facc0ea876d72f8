package com.example.refreshingclient.core;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.refreshingclient.core.reactive.ReactiveRetryingInvoker;
import java.lang.System.Logger;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;
import reactor.core.publisher.Mono;

/**
 * Client wrapper that keeps a short-lived credential fresh and retries operations rejected because
 * the credential expired.
 *
 * <p>A background {@link RefreshScheduler} renews the credential ahead of its expiry. Operations
 * run through {@link #execute(ClientCall)} additionally recover from rejections by forcing a
 * refresh and retrying, up to {@link RefreshSettings#maxTryTimes()} attempts.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var client = RefreshingClient.<LogServiceClient>builder()
 *     .client(new LogServiceClient(endpoint))
 *     .credentialIssuer(StsCredentialIssuer.builder()
 *         .roleArn("arn:aws:iam::123456789012:role/log-writer")
 *         .build())
 *     .build();
 *
 * var project = client.execute(c -> c.getProject("my-project"));
 * }</pre>
 *
 * <h2>Host-Owned Shutdown</h2>
 *
 * <pre>{@code
 * var shutdown = new ShutdownSignal();
 * var client = RefreshingClient.<LogServiceClient>builder()
 *     .client(logClient)
 *     .credentialIssuer(new SecretsManagerCredentialIssuer("log/sts-credential"))
 *     .shutdownSignal(shutdown)
 *     .settings(RefreshSettings.fromSystem())
 *     .build();
 *
 * Runtime.getRuntime().addShutdownHook(new Thread(shutdown::signal));
 * }</pre>
 *
 * @param <C> type of the wrapped client
 */
public final class RefreshingClient<C extends RemoteClient> implements AutoCloseable {

  private static final Logger logger = System.getLogger(RefreshingClient.class.getName());

  private final C delegate;
  private final CredentialState state;
  private final CredentialFetcher fetcher;
  private final RetryingInvoker invoker;
  private final ReactiveRetryingInvoker reactiveInvoker;
  private final RefreshScheduler scheduler;
  private final ShutdownSignal shutdownSignal;

  private RefreshingClient(final Builder<C> builder) {
    this.delegate = builder.client;
    this.shutdownSignal = builder.shutdownSignal;
    this.state = new CredentialState();
    this.fetcher =
        new CredentialFetcher(
            state, builder.credentialIssuer, delegate, builder.settings, builder.clock);
    this.invoker =
        new RetryingInvoker(
            fetcher, builder.authErrorDetector, builder.settings.maxTryTimes());
    this.reactiveInvoker =
        new ReactiveRetryingInvoker(
            fetcher, builder.authErrorDetector, builder.settings.maxTryTimes());

    if (builder.prefetch) {
      try {
        fetcher.fetch();
      } catch (final CredentialRefreshException e) {
        throw new IllegalStateException("Initial credential fetch failed", e);
      }
    }

    this.scheduler = new RefreshScheduler(fetcher, shutdownSignal, builder.clock, builder.name);
    scheduler.start();
    logger.log(INFO, "Credential refresh started for {0}", builder.name);
  }

  /**
   * Creates a new builder instance.
   *
   * @param <C> type of the wrapped client
   * @return new builder
   */
  public static <C extends RemoteClient> Builder<C> builder() {
    return new Builder<>();
  }

  /**
   * Builder for {@link RefreshingClient} instances.
   *
   * <h3>Example: Production Configuration</h3>
   *
   * <pre>{@code
   * var client = RefreshingClient.<LogServiceClient>builder()
   *     .name("log-writer")
   *     .client(logClient)
   *     .credentialIssuer(issuer)
   *     .maxTryTimes(5)
   *     .minFetchInterval(Duration.ofSeconds(2))
   *     .backoff(Duration.ofSeconds(1), Duration.ofMinutes(2))
   *     .authErrorDetector(AuthErrorDetector.defaultDetector().or(myDetector))
   *     .build();
   * }</pre>
   *
   * @param <C> type of the wrapped client
   */
  public static class Builder<C extends RemoteClient> {
    private C client;
    private CredentialIssuer credentialIssuer;
    private ShutdownSignal shutdownSignal = new ShutdownSignal();
    private RefreshSettings settings = RefreshSettings.defaults();
    private AuthErrorDetector authErrorDetector = AuthErrorDetector.defaultDetector();
    private boolean prefetch = true;
    private String name = "default";
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the wrapped client (required).
     *
     * @param client client receiving refreshed credentials
     * @return this builder
     */
    public Builder<C> client(final C client) {
      this.client = client;
      return this;
    }

    /**
     * Sets the credential source (required).
     *
     * @param credentialIssuer issuer called on every refresh
     * @return this builder
     */
    public Builder<C> credentialIssuer(final CredentialIssuer credentialIssuer) {
      this.credentialIssuer = credentialIssuer;
      return this;
    }

    /**
     * Sets a host-owned shutdown signal. Signalling it stops the background refresh.
     *
     * <p>Default: a private signal, triggered by {@link RefreshingClient#shutdown()}
     *
     * @param shutdownSignal cancellation token
     * @return this builder
     */
    public Builder<C> shutdownSignal(final ShutdownSignal shutdownSignal) {
      this.shutdownSignal = shutdownSignal;
      return this;
    }

    /**
     * Replaces all refresh settings at once.
     *
     * <p>Default: {@link RefreshSettings#defaults()}
     *
     * @param settings refresh settings
     * @return this builder
     */
    public Builder<C> settings(final RefreshSettings settings) {
      this.settings = settings;
      return this;
    }

    public Builder<C> maxTryTimes(final int maxTryTimes) {
      this.settings =
          new RefreshSettings(
              maxTryTimes, settings.minFetchInterval(), settings.backoffMin(), settings.backoffMax());
      return this;
    }

    public Builder<C> minFetchInterval(final Duration minFetchInterval) {
      this.settings =
          new RefreshSettings(
              settings.maxTryTimes(), minFetchInterval, settings.backoffMin(), settings.backoffMax());
      return this;
    }

    /**
     * Sets the range of the throttle delay applied after failed fetches.
     *
     * @param backoffMin delay after the first failure
     * @param backoffMax cap for the doubling delay
     * @return this builder
     */
    public Builder<C> backoff(final Duration backoffMin, final Duration backoffMax) {
      this.settings =
          new RefreshSettings(
              settings.maxTryTimes(), settings.minFetchInterval(), backoffMin, backoffMax);
      return this;
    }

    /**
     * Sets the detector deciding which failures trigger a refresh and retry.
     *
     * <p>Default: {@link AuthErrorDetector#defaultDetector()}
     *
     * @param authErrorDetector credential rejection detector
     * @return this builder
     */
    public Builder<C> authErrorDetector(final AuthErrorDetector authErrorDetector) {
      this.authErrorDetector = authErrorDetector;
      return this;
    }

    /**
     * Whether {@link #build()} fetches a credential before returning.
     *
     * <p>Default: true
     *
     * @param prefetch fetch synchronously during build
     * @return this builder
     */
    public Builder<C> prefetch(final boolean prefetch) {
      this.prefetch = prefetch;
      return this;
    }

    /**
     * Sets the name used for the background thread.
     *
     * @param name client name
     * @return this builder
     */
    public Builder<C> name(final String name) {
      this.name = name;
      return this;
    }

    public Builder<C> clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the client and starts the background refresh.
     *
     * @return configured client
     * @throws IllegalStateException if required fields are missing or the initial fetch failed
     */
    public RefreshingClient<C> build() {
      if (client == null) throw new IllegalStateException("client is required");
      if (credentialIssuer == null) throw new IllegalStateException("credentialIssuer is required");
      if (shutdownSignal == null) throw new IllegalStateException("shutdownSignal cannot be null");
      if (settings == null) throw new IllegalStateException("settings cannot be null");
      if (authErrorDetector == null)
        throw new IllegalStateException("authErrorDetector cannot be null");
      if (name == null || name.isBlank()) throw new IllegalStateException("name is required");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      return new RefreshingClient<>(this);
    }
  }

  /**
   * Executes an operation against the wrapped client, refreshing the credential and retrying when
   * the remote side rejects it.
   *
   * @param call operation to execute
   * @param <T> result type
   * @param <E> checked exception type of the operation
   * @return operation result
   * @throws E the operation's failure
   */
  public <T, E extends Exception> T execute(final ClientCall<? super C, T, E> call) throws E {
    return invoker.invoke(() -> call.call(delegate));
  }

  /**
   * Reactive variant of {@link #execute(ClientCall)}; the function is applied again for every
   * attempt.
   *
   * @param call function producing the operation
   * @param <T> result type
   * @return a Mono emitting the operation result
   */
  public <T> Mono<T> executeReactive(final Function<? super C, ? extends Mono<T>> call) {
    return reactiveInvoker.invoke(() -> call.apply(delegate));
  }

  /**
   * Forces a credential fetch, subject to the same debounce and backoff as any other fetch.
   *
   * @throws CredentialRefreshException if the fetch was debounced or failed
   */
  public void refreshNow() throws CredentialRefreshException {
    fetcher.fetch();
  }

  public CredentialState.Snapshot credentialState() {
    return state.snapshot();
  }

  /** Returns the wrapped client. Calls made directly on it are not retried. */
  public C delegate() {
    return delegate;
  }

  public void setUserAgent(final String userAgent) {
    delegate.setUserAgent(userAgent);
  }

  public void setHttpClient(final HttpClient httpClient) {
    delegate.setHttpClient(httpClient);
  }

  public void setRetryTimeout(final Duration timeout) {
    delegate.setRetryTimeout(timeout);
  }

  public void setAuthVersion(final AuthVersion version) {
    delegate.setAuthVersion(version);
  }

  public void setRegion(final String region) {
    delegate.setRegion(region);
  }

  public void resetAccessKeyToken(
      final String accessKeyId, final String accessKeySecret, final String securityToken) {
    delegate.resetAccessKeyToken(accessKeyId, accessKeySecret, securityToken);
  }

  /**
   * Signals the shutdown token and waits up to five seconds for the background task to exit.
   * Operations already in flight are not cancelled.
   */
  public void shutdown() {
    shutdownSignal.signal();
    try {
      if (!scheduler.awaitTermination(Duration.ofSeconds(5)))
        logger.log(WARNING, "Credential refresh task did not stop in time");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Marks the client closed; the background task exits after its next refresh cycle. */
  @Override
  public void close() {
    scheduler.close();
  }

  public boolean isClosed() {
    return scheduler.isClosed();
  }

  public boolean isRefreshRunning() {
    return scheduler.isRunning();
  }
}
