package com.example;

import com.example.refreshingclient.core.AuthVersion;
import com.example.refreshingclient.core.RemoteClient;
import com.example.refreshingclient.core.RemoteServiceException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Client of the {@link LogService}. Every request is signed with the credential most recently
 * installed through {@link #resetAccessKeyToken(String, String, String)}.
 */
public class LogServiceClient implements RemoteClient {

  record Signature(String accessKeyId, String accessKeySecret, String securityToken) {}

  private final LogService service;

  private volatile Signature signature;
  private volatile String userAgent = "log-service-app";
  private volatile HttpClient httpClient;
  private volatile Duration retryTimeout = Duration.ofSeconds(30);
  private volatile AuthVersion authVersion = AuthVersion.V1;
  private volatile String region;

  public LogServiceClient(final LogService service) {
    this.service = service;
  }

  @Override
  public void resetAccessKeyToken(
      final String accessKeyId, final String accessKeySecret, final String securityToken) {
    this.signature = new Signature(accessKeyId, accessKeySecret, securityToken);
  }

  @Override
  public void setUserAgent(final String userAgent) {
    this.userAgent = userAgent;
  }

  @Override
  public void setHttpClient(final HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public void setRetryTimeout(final Duration timeout) {
    this.retryTimeout = timeout;
  }

  @Override
  public void setAuthVersion(final AuthVersion version) {
    this.authVersion = version;
  }

  @Override
  public void setRegion(final String region) {
    this.region = region;
  }

  public void createProject(final String project) {
    service.createProject(sign(), project);
  }

  public List<String> listProjects() {
    return service.listProjects(sign());
  }

  public void putLogs(final String project, final List<String> lines) {
    service.putLogs(sign(), project, lines);
  }

  public List<String> getLogs(final String project) {
    return service.getLogs(sign(), project);
  }

  /**
   * Asynchronous variant of {@link #getLogs(String)}. The request is signed on subscription.
   *
   * @param project project name
   * @return a Mono emitting the stored lines
   */
  public Mono<List<String>> getLogsAsync(final String project) {
    return Mono.fromCallable(() -> getLogs(project));
  }

  public String userAgent() {
    return userAgent;
  }

  public HttpClient httpClient() {
    return httpClient;
  }

  public Duration retryTimeout() {
    return retryTimeout;
  }

  public AuthVersion authVersion() {
    return authVersion;
  }

  public String region() {
    return region;
  }

  private Signature sign() {
    if (authVersion == AuthVersion.V4 && (region == null || region.isBlank()))
      throw new RemoteServiceException(400, "InvalidRegion", "V4 signing requires a region");
    return signature;
  }
}
