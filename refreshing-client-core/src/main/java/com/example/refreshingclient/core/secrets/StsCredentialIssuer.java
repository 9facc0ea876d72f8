package com.example.refreshingclient.core.secrets;

import com.example.refreshingclient.core.Credential;
import com.example.refreshingclient.core.CredentialIssuer;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;

/**
 * Issues temporary credentials by assuming an IAM role through AWS STS.
 *
 * <pre>{@code
 * var issuer = StsCredentialIssuer.builder()
 *     .roleArn("arn:aws:iam::123456789012:role/log-writer")
 *     .roleSessionName("log-writer")
 *     .duration(Duration.ofMinutes(30))
 *     .build();
 * }</pre>
 *
 * <p>Unless a client is supplied, the STS client honors aws.region / AWS_REGION, aws.sts.endpoint /
 * AWS_STS_ENDPOINT and the same credential overrides as {@link SecretsManagerProvider}.
 */
public final class StsCredentialIssuer implements CredentialIssuer, AutoCloseable {

  private static final Duration MIN_DURATION = Duration.ofMinutes(15);
  private static final Duration MAX_DURATION = Duration.ofHours(12);

  private final StsClient stsClient;
  private final String roleArn;
  private final String roleSessionName;
  private final Duration duration;
  private final String externalId;

  private StsCredentialIssuer(final Builder builder) {
    this.stsClient =
        Optional.ofNullable(builder.stsClient).orElseGet(StsCredentialIssuer::buildClient);
    this.roleArn = builder.roleArn;
    this.roleSessionName = builder.roleSessionName;
    this.duration = builder.duration;
    this.externalId = builder.externalId;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link StsCredentialIssuer}. */
  public static class Builder {
    private StsClient stsClient;
    private String roleArn;
    private String roleSessionName = "refreshing-client";
    private Duration duration = Duration.ofHours(1);
    private String externalId;

    private Builder() {}

    /**
     * Sets the ARN of the role to assume (required).
     *
     * @param roleArn role ARN
     * @return this builder
     */
    public Builder roleArn(final String roleArn) {
      this.roleArn = roleArn;
      return this;
    }

    public Builder roleSessionName(final String roleSessionName) {
      this.roleSessionName = roleSessionName;
      return this;
    }

    /**
     * Sets the requested validity of issued credentials.
     *
     * <p>Default: 1 hour. STS accepts 15 minutes up to the role's maximum session duration, which
     * is never more than 12 hours.
     *
     * @param duration credential validity
     * @return this builder
     */
    public Builder duration(final Duration duration) {
      this.duration = duration;
      return this;
    }

    public Builder externalId(final String externalId) {
      this.externalId = externalId;
      return this;
    }

    /**
     * Uses the given client instead of building one from system properties.
     *
     * @param stsClient STS client
     * @return this builder
     */
    public Builder stsClient(final StsClient stsClient) {
      this.stsClient = stsClient;
      return this;
    }

    /**
     * Builds the issuer.
     *
     * @return configured issuer
     * @throws IllegalStateException if roleArn or roleSessionName is missing
     * @throws IllegalArgumentException if duration is shorter than 15 minutes or longer than 12
     *     hours
     */
    public StsCredentialIssuer build() {
      if (roleArn == null || roleArn.isBlank())
        throw new IllegalStateException("roleArn is required");
      if (roleSessionName == null || roleSessionName.isBlank())
        throw new IllegalStateException("roleSessionName is required");
      if (duration == null || duration.compareTo(MIN_DURATION) < 0)
        throw new IllegalArgumentException("duration must be at least 15 minutes");
      if (duration.compareTo(MAX_DURATION) > 0)
        throw new IllegalArgumentException("duration must be at most 12 hours");
      return new StsCredentialIssuer(this);
    }
  }

  @Override
  public Credential issue() {
    final var request =
        AssumeRoleRequest.builder()
            .roleArn(roleArn)
            .roleSessionName(roleSessionName)
            .durationSeconds(Math.toIntExact(duration.toSeconds()))
            .externalId(externalId)
            .build();
    final var credentials = stsClient.assumeRole(request).credentials();
    return new Credential(
        credentials.accessKeyId(),
        credentials.secretAccessKey(),
        credentials.sessionToken(),
        credentials.expiration());
  }

  @Override
  public void close() {
    stsClient.close();
  }

  private static StsClient buildClient() {
    final var builder = StsClient.builder();
    builder.region(SecretsManagerProvider.AwsSettings.region());

    Optional.ofNullable(System.getProperty("aws.sts.endpoint"))
        .or(() -> Optional.ofNullable(System.getenv("AWS_STS_ENDPOINT")))
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    builder.credentialsProvider(SecretsManagerProvider.AwsSettings.credentialsProvider());
    return builder.build();
  }
}
