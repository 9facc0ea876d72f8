package com.example.refreshingclient.core.secrets;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Provides a lazily configured AWS Secrets Manager client.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 *
 * <p>Secrets are always read from the service; a credential secret must not be served stale.
 */
public final class SecretsManagerProvider {

  private static volatile SecretsManagerClient client;

  static {
    Runtime.getRuntime().addShutdownHook(new Thread(SecretsManagerProvider::closeQuietly));
  }

  private SecretsManagerProvider() {}

  /** Closes the current client; next access will lazily rebuild one with current config. */
  public static synchronized void resetClient() {
    closeQuietly();
    client = null;
  }

  /** Lazily gets the SecretsManagerClient, building it if necessary. */
  static synchronized SecretsManagerClient getClient() {
    return Optional.ofNullable(client).orElseGet(() -> client = buildClient());
  }

  /**
   * Retrieves the raw secret string for the given secret identifier.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return the secret string as stored in Secrets Manager
   */
  public static String getSecret(final String secretId) {
    final var request = GetSecretValueRequest.builder().secretId(secretId).build();
    return getClient().getSecretValue(request).secretString();
  }

  /**
   * Builds the {@link SecretsManagerClient} honoring region, endpoint and credentials overrides.
   *
   * @return configured {@link SecretsManagerClient}
   */
  private static SecretsManagerClient buildClient() {
    final var builder = SecretsManagerClient.builder();
    builder.region(AwsSettings.region());

    // Endpoint override (useful for Localstack in tests)
    Optional.ofNullable(System.getProperty("aws.sm.endpoint"))
        .or(() -> Optional.ofNullable(System.getenv("AWS_SM_ENDPOINT")))
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    builder.credentialsProvider(AwsSettings.credentialsProvider());
    return builder.build();
  }

  private static void closeQuietly() {
    Optional.ofNullable(client)
        .ifPresent(
            c -> {
              try {
                c.close();
              } catch (final RuntimeException e) {
                System.getLogger(SecretsManagerProvider.class.getName())
                    .log(System.Logger.Level.DEBUG, "Failed to close Secrets Manager client", e);
              }
            });
  }

  /** Region and credentials shared by the AWS clients of this package. */
  static final class AwsSettings {

    private AwsSettings() {}

    /** Region from system property or env, default to us-east-1. */
    static Region region() {
      return Optional.ofNullable(System.getProperty("aws.region"))
          .or(() -> Optional.ofNullable(System.getenv("AWS_REGION")))
          .map(Region::of)
          .orElse(Region.US_EAST_1);
    }

    /** Credentials from system properties if provided, else the default provider chain. */
    static AwsCredentialsProvider credentialsProvider() {
      return Optional.ofNullable(
              System.getProperty("aws.accessKeyId", System.getenv("AWS_ACCESS_KEY_ID")))
          .flatMap(
              accessKey ->
                  Optional.ofNullable(
                          System.getProperty(
                              "aws.secretAccessKey", System.getenv("AWS_SECRET_ACCESS_KEY")))
                      .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
          .<AwsCredentialsProvider>map(StaticCredentialsProvider::create)
          .orElseGet(() -> DefaultCredentialsProvider.builder().build());
    }
  }
}
