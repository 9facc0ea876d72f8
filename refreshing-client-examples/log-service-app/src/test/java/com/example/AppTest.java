package com.example;

import static org.junit.jupiter.api.Assertions.*;

import com.example.refreshingclient.core.AuthVersion;
import com.example.refreshingclient.core.Credential;
import com.example.refreshingclient.core.RefreshSettings;
import com.example.refreshingclient.core.RemoteServiceException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class AppTest {

  private static final Duration VALIDITY = Duration.ofMinutes(15);
  private static final RefreshSettings SETTINGS =
      new RefreshSettings(3, Duration.ZERO, Duration.ofMillis(10), Duration.ofMillis(100));

  private ServiceClock serviceClock;
  private LogService service;
  private App app;

  @BeforeEach
  void setUp() {
    serviceClock = new ServiceClock(Instant.now());
    service = new LogService(serviceClock);
    app = new App(service, VALIDITY, SETTINGS);
    app.createProject("demo");
  }

  @AfterEach
  void tearDown() {
    app.shutdown();
  }

  @Test
  @DisplayName("Should write and read logs")
  void shouldWriteAndReadLogs() {
    app.write("demo", List.of("started", "ready"));

    assertEquals(List.of("started", "ready"), app.read("demo"));
    assertEquals(List.of("demo"), app.client().execute(LogServiceClient::listProjects));
  }

  @Test
  @DisplayName("Should recover when the session credential expired")
  void shouldRecoverFromExpiredCredential() {
    final var before = app.client().credentialState().expiresAt();
    serviceClock.advance(VALIDITY.plusMinutes(1));

    app.write("demo", List.of("after expiry"));

    assertEquals(List.of("after expiry"), app.read("demo"));
    assertTrue(app.client().credentialState().expiresAt().isAfter(before));
  }

  @Test
  @DisplayName("Should recover when the service revoked all credentials")
  void shouldRecoverFromRevokedCredential() {
    service.revokeAll();

    assertEquals(List.of(), app.read("demo"));
  }

  @Test
  @DisplayName("Should recover reactive reads too")
  void shouldRecoverReactiveRead() {
    app.write("demo", List.of("line"));
    service.revokeAll();

    assertEquals(List.of("line"), app.readAsync("demo").block(Duration.ofSeconds(5)));
  }

  @Test
  @DisplayName("Should not retry errors unrelated to the credential")
  void shouldNotRetryOtherErrors() {
    final var thrown = assertThrows(RemoteServiceException.class, () -> app.read("missing"));

    assertEquals(404, thrown.httpStatus());
    assertEquals("ProjectNotExist", thrown.errorCode());
  }

  @Test
  @DisplayName("Should surface the rejection when the credential cannot be renewed")
  void shouldSurfaceRejectionWhenRenewalKeepsFailing() {
    final var broken =
        new App(
            new LogService(serviceClock) {
              @Override
              public Credential issue(final Duration validity) {
                final var issued = super.issue(validity);
                revokeAll();
                return issued;
              }
            },
            VALIDITY,
            SETTINGS);

    try {
      final var thrown = assertThrows(RemoteServiceException.class, () -> broken.read("demo"));
      assertEquals("InvalidAccessKeyId", thrown.errorCode());
    } finally {
      broken.shutdown();
    }
  }

  @Test
  @DisplayName("Should forward client configuration")
  void shouldForwardConfiguration() {
    app.client().setAuthVersion(AuthVersion.V4);
    final var thrown = assertThrows(RemoteServiceException.class, () -> app.read("demo"));
    assertEquals("InvalidRegion", thrown.errorCode());

    app.client().setRegion("eu-west-1");
    app.client().setRetryTimeout(Duration.ofSeconds(5));

    assertEquals(List.of(), app.read("demo"));
    assertEquals("eu-west-1", app.client().delegate().region());
    assertEquals(Duration.ofSeconds(5), app.client().delegate().retryTimeout());
    assertEquals("log-service-app/1.0", app.client().delegate().userAgent());
  }

  /** Service-side clock the tests move forward to expire issued credentials. */
  private static final class ServiceClock extends Clock {
    private volatile Instant now;

    ServiceClock(final Instant start) {
      this.now = start;
    }

    void advance(final Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public Instant instant() {
      return now;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
      return this;
    }
  }
}
