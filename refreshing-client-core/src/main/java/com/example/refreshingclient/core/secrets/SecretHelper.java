package com.example.refreshingclient.core.secrets;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Supplier;

/**
 * Utility helper for retrieving and parsing credential secrets from AWS Secrets Manager.
 *
 * <p>This class fetches the secret string and deserializes it into a {@link CredentialSecret}
 * using Jackson.
 */
public final class SecretHelper {

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private SecretHelper() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} to use for deserialization.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Retrieves a credential secret from AWS Secrets Manager and converts it into a {@link
   * CredentialSecret}.
   *
   * @param secretId the identifier/name of the secret in AWS Secrets Manager
   * @return the parsed {@link CredentialSecret}
   * @throws RuntimeException if the secret cannot be fetched or parsed
   */
  public static CredentialSecret getCredentialSecret(final String secretId) {
    try {
      return parse(SecretsManagerProvider.getSecret(secretId));
    } catch (final Exception exception) {
      throw new RuntimeException("Failed to load credential secret " + secretId, exception);
    }
  }

  static CredentialSecret parse(final String json) throws Exception {
    return mapperSupplier.get().readValue(json, CredentialSecret.class);
  }
}
