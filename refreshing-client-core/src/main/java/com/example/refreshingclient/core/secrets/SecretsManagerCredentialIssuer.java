package com.example.refreshingclient.core.secrets;

import com.example.refreshingclient.core.Credential;
import com.example.refreshingclient.core.CredentialIssuer;

/**
 * Issues credentials stored as a JSON secret in AWS Secrets Manager, typically kept up to date by
 * a rotation function. See {@link CredentialSecret} for the expected payload.
 *
 * @param secretId the Secrets Manager secret ID or name
 */
public record SecretsManagerCredentialIssuer(String secretId) implements CredentialIssuer {

  public SecretsManagerCredentialIssuer {
    if (secretId == null || secretId.isBlank())
      throw new IllegalArgumentException("secretId is required");
  }

  @Override
  public Credential issue() {
    return SecretHelper.getCredentialSecret(secretId).toCredential();
  }
}
