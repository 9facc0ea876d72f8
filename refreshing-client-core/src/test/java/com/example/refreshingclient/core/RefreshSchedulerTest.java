package com.example.refreshingclient.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.*;

class RefreshSchedulerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private MutableClock clock;
  private CredentialState state;
  private CredentialFetcher fetcher;
  private ShutdownSignal signal;
  private RefreshScheduler scheduler;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    state = new CredentialState();
    fetcher = mock(CredentialFetcher.class);
    when(fetcher.state()).thenReturn(state);
    signal = new ShutdownSignal();
  }

  @AfterEach
  void tearDown() throws Exception {
    signal.signal();
    if (scheduler != null) scheduler.awaitTermination(Duration.ofSeconds(2));
  }

  @Nested
  @DisplayName("Interval tiers")
  class IntervalTiers {

    @Test
    @DisplayName("Less than a minute left waits a fixed 30 seconds")
    void underOneMinute() {
      assertEquals(Duration.ofSeconds(30), RefreshScheduler.nextInterval(Duration.ofSeconds(30)));
      assertEquals(Duration.ofSeconds(30), RefreshScheduler.nextInterval(Duration.ofSeconds(59)));
    }

    @Test
    @DisplayName("Expired credential waits a fixed 30 seconds")
    void expired() {
      assertEquals(Duration.ofSeconds(30), RefreshScheduler.nextInterval(Duration.ofMinutes(-5)));
    }

    @Test
    @DisplayName("Less than ten minutes left waits 70%")
    void underTenMinutes() {
      assertEquals(
          Duration.ofSeconds(210), RefreshScheduler.nextInterval(Duration.ofMinutes(5)));
      assertEquals(Duration.ofSeconds(42), RefreshScheduler.nextInterval(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("Less than an hour left waits 60%")
    void underOneHour() {
      assertEquals(Duration.ofMinutes(6), RefreshScheduler.nextInterval(Duration.ofMinutes(10)));
      assertEquals(Duration.ofMinutes(18), RefreshScheduler.nextInterval(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("An hour or more left waits 50%")
    void oneHourOrMore() {
      assertEquals(Duration.ofMinutes(30), RefreshScheduler.nextInterval(Duration.ofHours(1)));
      assertEquals(Duration.ofHours(6), RefreshScheduler.nextInterval(Duration.ofHours(12)));
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("Interval is computed from the state's remaining validity")
    void intervalFromState() throws Exception {
      state.recordSuccess(NOW.plus(Duration.ofMinutes(5)));
      final var seen = new AtomicReference<Duration>();
      final var computed = new CountDownLatch(1);
      scheduler =
          new RefreshScheduler(
              fetcher,
              signal,
              clock,
              "interval",
              remaining -> {
                seen.set(remaining);
                computed.countDown();
                return RefreshScheduler.nextInterval(remaining);
              });

      scheduler.start();

      assertTrue(computed.await(2, TimeUnit.SECONDS));
      assertEquals(Duration.ofMinutes(5), seen.get());
      verify(fetcher, never()).fetch();
    }

    @Test
    @DisplayName("Shutdown signal interrupts the wait and stops without fetching")
    void shutdownStopsWithoutFetching() throws Exception {
      scheduler = new RefreshScheduler(fetcher, signal, clock, "shutdown", d -> Duration.ofHours(1));
      scheduler.start();
      assertTrue(scheduler.isRunning());

      signal.signal();

      assertTrue(scheduler.awaitTermination(Duration.ofSeconds(2)));
      assertFalse(scheduler.isRunning());
      verify(fetcher, never()).fetch();
    }

    @Test
    @DisplayName("Closed flag stops the task after the next fetch")
    void closedFlagStopsAfterFetch() throws Exception {
      scheduler =
          new RefreshScheduler(fetcher, signal, clock, "closed", d -> Duration.ofMillis(10));
      scheduler.close();

      scheduler.start();

      assertTrue(scheduler.awaitTermination(Duration.ofSeconds(2)));
      verify(fetcher, times(1)).fetch();
    }

    @Test
    @DisplayName("Fetch failures never stop the task")
    void fetchFailuresAreNotFatal() throws Exception {
      final var attempts = new CountDownLatch(3);
      doAnswer(
              invocation -> {
                attempts.countDown();
                throw new CredentialFetchException("down", new IllegalStateException("down"));
              })
          .when(fetcher)
          .fetch();
      scheduler =
          new RefreshScheduler(fetcher, signal, clock, "failures", d -> Duration.ofMillis(5));

      scheduler.start();

      assertTrue(attempts.await(2, TimeUnit.SECONDS));
      assertTrue(scheduler.isRunning());
      signal.signal();
      assertTrue(scheduler.awaitTermination(Duration.ofSeconds(2)));
    }

    @Test
    @DisplayName("No fetch happens after shutdown")
    void noFetchAfterShutdown() throws Exception {
      final var firstFetch = new CountDownLatch(1);
      doAnswer(
              invocation -> {
                firstFetch.countDown();
                return null;
              })
          .when(fetcher)
          .fetch();
      scheduler =
          new RefreshScheduler(fetcher, signal, clock, "after", d -> Duration.ofMillis(20));
      scheduler.start();
      assertTrue(firstFetch.await(2, TimeUnit.SECONDS));

      signal.signal();
      assertTrue(scheduler.awaitTermination(Duration.ofSeconds(2)));
      clearInvocations(fetcher);

      Thread.sleep(100);
      verify(fetcher, never()).fetch();
    }

    @Test
    @DisplayName("Keeps running for a credential that practically never expires")
    void farFutureExpiry() throws Exception {
      state.recordSuccess(Instant.parse("9999-12-31T23:59:59Z"));
      scheduler = new RefreshScheduler(fetcher, signal, clock, "far-future");

      scheduler.start();
      Thread.sleep(100);

      assertTrue(scheduler.isRunning());
      verify(fetcher, never()).fetch();
      signal.signal();
      assertTrue(scheduler.awaitTermination(Duration.ofSeconds(2)));
    }

    @Test
    @DisplayName("Cannot be started twice")
    void cannotStartTwice() {
      scheduler = new RefreshScheduler(fetcher, signal, clock, "twice", d -> Duration.ofHours(1));
      scheduler.start();
      assertThrows(IllegalStateException.class, scheduler::start);
    }
  }
}
