package com.example.refreshingclient.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived access identity issued by a {@link CredentialIssuer}.
 *
 * <p>The secret and the security token are never included in {@link #toString()}.
 *
 * @param accessKeyId access key identifier
 * @param accessKeySecret access key secret
 * @param securityToken session token bound to the key pair
 * @param expiresAt instant after which the remote side rejects the credential
 */
public record Credential(
    String accessKeyId, String accessKeySecret, String securityToken, Instant expiresAt) {

  public Credential {
    Objects.requireNonNull(accessKeyId, "accessKeyId");
    Objects.requireNonNull(accessKeySecret, "accessKeySecret");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  @Override
  public String toString() {
    return "Credential[accessKeyId=" + accessKeyId + ", expiresAt=" + expiresAt + "]";
  }
}
