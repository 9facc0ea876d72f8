/**
 * Credential refresh layer for authenticated remote service clients.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.refreshingclient.core.RefreshingClient} – wraps a {@link
 *       com.example.refreshingclient.core.RemoteClient}, keeps its credential fresh and retries
 *       rejected operations.
 *   <li>{@link com.example.refreshingclient.core.CredentialState} – shared expiry and refresh
 *       history, guarded by one lock.
 *   <li>{@link com.example.refreshingclient.core.CredentialFetcher} – debounced, backoff-throttled
 *       single refresh attempt.
 *   <li>{@link com.example.refreshingclient.core.RefreshScheduler} – background task renewing the
 *       credential ahead of expiry.
 *   <li>{@link com.example.refreshingclient.core.RetryingInvoker} – refresh-and-retry on credential
 *       rejections.
 *   <li>{@link com.example.refreshingclient.core.AuthErrorDetector} – pluggable classification of
 *       credential rejections.
 *   <li>{@link com.example.refreshingclient.core.reactive.ReactiveRetryingInvoker} – the same
 *       retry contract for Reactor {@code Mono} operations.
 *   <li>{@link com.example.refreshingclient.core.secrets.StsCredentialIssuer} and {@link
 *       com.example.refreshingclient.core.secrets.SecretsManagerCredentialIssuer} – credential
 *       issuers backed by AWS STS and AWS Secrets Manager.
 * </ul>
 */
package com.example.refreshingclient.core;
