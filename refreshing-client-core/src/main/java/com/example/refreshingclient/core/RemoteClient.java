package com.example.refreshingclient.core;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Contract of the authenticated client wrapped by {@link RefreshingClient}.
 *
 * <p>Only the credential slot and the transport settings are part of this contract. Remote
 * operations are invoked through {@link RefreshingClient#execute(ClientCall)}, so the client may
 * expose any number of them.
 */
public interface RemoteClient {

  /**
   * Replaces the credential used to sign subsequent requests.
   *
   * @param accessKeyId access key identifier
   * @param accessKeySecret access key secret
   * @param securityToken session token, may be {@code null} for long-lived keys
   */
  void resetAccessKeyToken(String accessKeyId, String accessKeySecret, String securityToken);

  void setUserAgent(String userAgent);

  /**
   * Sets the HTTP client all requests are sent through.
   *
   * @param httpClient custom HTTP client
   */
  void setHttpClient(HttpClient httpClient);

  void setRetryTimeout(Duration timeout);

  void setAuthVersion(AuthVersion version);

  /**
   * Sets the region; required when signing with {@link AuthVersion#V4}.
   *
   * @param region region identifier
   */
  void setRegion(String region);
}
