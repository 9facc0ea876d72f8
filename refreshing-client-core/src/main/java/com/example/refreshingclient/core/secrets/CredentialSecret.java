package com.example.refreshingclient.core.secrets;

import com.example.refreshingclient.core.Credential;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * Credential payload stored as a JSON secret.
 *
 * <pre>{@code
 * {
 *   "accessKeyId": "STS.NXa...",
 *   "accessKeySecret": "9dk...",
 *   "securityToken": "CAIS...",
 *   "expiration": "2024-05-01T12:00:00Z"
 * }
 * }</pre>
 *
 * @param accessKeyId access key identifier
 * @param accessKeySecret access key secret
 * @param securityToken session token, may be absent for long-lived keys
 * @param expiration ISO-8601 instant at which the credential expires
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialSecret(
    String accessKeyId, String accessKeySecret, String securityToken, String expiration) {

  /**
   * Converts the payload into a {@link Credential}.
   *
   * @return the credential
   * @throws IllegalArgumentException if a required field is missing or the expiration is not an
   *     ISO-8601 instant
   */
  public Credential toCredential() {
    if (accessKeyId == null || accessKeyId.isBlank())
      throw new IllegalArgumentException("accessKeyId is missing");
    if (accessKeySecret == null || accessKeySecret.isBlank())
      throw new IllegalArgumentException("accessKeySecret is missing");
    if (expiration == null || expiration.isBlank())
      throw new IllegalArgumentException("expiration is missing");
    return new Credential(accessKeyId, accessKeySecret, securityToken, Instant.parse(expiration));
  }
}
