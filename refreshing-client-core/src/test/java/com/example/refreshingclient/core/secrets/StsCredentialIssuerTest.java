package com.example.refreshingclient.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;
import software.amazon.awssdk.services.sts.model.StsException;

class StsCredentialIssuerTest {

  private static final String ROLE_ARN = "arn:aws:iam::123456789012:role/log-writer";
  private static final Instant EXPIRATION = Instant.parse("2024-05-01T13:00:00Z");

  private StsClient sts;

  @BeforeEach
  void setUp() {
    sts = mock(StsClient.class);
  }

  @Nested
  @DisplayName("Builder")
  class BuilderValidation {

    @Test
    @DisplayName("Should require a role ARN")
    void requiresRoleArn() {
      assertThrows(
          IllegalStateException.class, () -> StsCredentialIssuer.builder().stsClient(sts).build());
    }

    @Test
    @DisplayName("Should reject a blank session name")
    void rejectsBlankSessionName() {
      assertThrows(
          IllegalStateException.class,
          () ->
              StsCredentialIssuer.builder()
                  .stsClient(sts)
                  .roleArn(ROLE_ARN)
                  .roleSessionName("")
                  .build());
    }

    @Test
    @DisplayName("Should reject durations shorter than 15 minutes")
    void rejectsShortDuration() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              StsCredentialIssuer.builder()
                  .stsClient(sts)
                  .roleArn(ROLE_ARN)
                  .duration(Duration.ofMinutes(5))
                  .build());
    }

    @Test
    @DisplayName("Should reject durations beyond the STS maximum")
    void rejectsLongDuration() {
      final var thrown =
          assertThrows(
              IllegalArgumentException.class,
              () ->
                  StsCredentialIssuer.builder()
                      .stsClient(sts)
                      .roleArn(ROLE_ARN)
                      .duration(Duration.ofDays(365L * 100))
                      .build());
      assertEquals("duration must be at most 12 hours", thrown.getMessage());
    }

    @Test
    @DisplayName("Should accept the 12 hour maximum")
    void acceptsMaximumDuration() {
      assertNotNull(
          StsCredentialIssuer.builder()
              .stsClient(sts)
              .roleArn(ROLE_ARN)
              .duration(Duration.ofHours(12))
              .build());
    }
  }

  @Nested
  @DisplayName("Issuing")
  class Issuing {

    @Test
    @DisplayName("Should map assumed role credentials")
    void mapsCredentials() {
      when(sts.assumeRole(any(AssumeRoleRequest.class)))
          .thenReturn(
              AssumeRoleResponse.builder()
                  .credentials(
                      Credentials.builder()
                          .accessKeyId("ASIA1")
                          .secretAccessKey("secret1")
                          .sessionToken("token1")
                          .expiration(EXPIRATION)
                          .build())
                  .build());
      final var issuer =
          StsCredentialIssuer.builder()
              .stsClient(sts)
              .roleArn(ROLE_ARN)
              .roleSessionName("log-writer")
              .duration(Duration.ofMinutes(30))
              .externalId("ext-1")
              .build();

      final var credential = issuer.issue();

      assertEquals("ASIA1", credential.accessKeyId());
      assertEquals("secret1", credential.accessKeySecret());
      assertEquals("token1", credential.securityToken());
      assertEquals(EXPIRATION, credential.expiresAt());

      final var captor = ArgumentCaptor.forClass(AssumeRoleRequest.class);
      verify(sts).assumeRole(captor.capture());
      assertEquals(ROLE_ARN, captor.getValue().roleArn());
      assertEquals("log-writer", captor.getValue().roleSessionName());
      assertEquals(1800, captor.getValue().durationSeconds());
      assertEquals("ext-1", captor.getValue().externalId());
    }

    @Test
    @DisplayName("Should propagate STS failures")
    void propagatesFailures() {
      when(sts.assumeRole(any(AssumeRoleRequest.class)))
          .thenThrow(StsException.builder().statusCode(403).message("not authorized").build());
      final var issuer = StsCredentialIssuer.builder().stsClient(sts).roleArn(ROLE_ARN).build();

      assertThrows(StsException.class, issuer::issue);
    }

    @Test
    @DisplayName("Should close the STS client")
    void closesClient() {
      final var issuer = StsCredentialIssuer.builder().stsClient(sts).roleArn(ROLE_ARN).build();

      issuer.close();

      verify(sts).close();
    }
  }
}
