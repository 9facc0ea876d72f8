package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.refreshingclient.core.RefreshSettings;
import com.example.refreshingclient.core.RefreshingClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import reactor.core.publisher.Mono;

/** Demo application writing and reading logs while its session credential keeps expiring. */
public class App {
  private final RefreshingClient<LogServiceClient> client;

  /**
   * Constructs the application with a single RefreshingClient reused for all later calls.
   *
   * @param service the log service to talk to
   * @param validity validity of every credential the service issues
   * @param settings retry, debounce and backoff settings
   */
  public App(final LogService service, final Duration validity, final RefreshSettings settings) {
    this.client =
        RefreshingClient.<LogServiceClient>builder()
            .name("log-service-app")
            .client(new LogServiceClient(service))
            .credentialIssuer(() -> service.issue(validity))
            .settings(settings)
            .build();
    client.setUserAgent("log-service-app/1.0");
  }

  /**
   * Entry point. Writes a few lines to a demo project and prints them back.
   *
   * @param args CLI args (unused)
   * @throws Exception on unexpected failures
   */
  public static void main(String[] args) throws Exception {
    final var logger = System.getLogger(App.class.getName());

    final var service = new LogService(Clock.systemUTC());
    final var app = new App(service, Duration.ofMinutes(15), RefreshSettings.fromSystem());
    try {
      app.createProject("demo");
      app.write("demo", List.of("started", "ready"));
      logger.log(INFO, "Logs = %s".formatted(app.read("demo")));
    } finally {
      app.shutdown();
    }
  }

  public void createProject(final String project) {
    client.execute(
        c -> {
          c.createProject(project);
          return null;
        });
  }

  public void write(final String project, final List<String> lines) {
    client.execute(
        c -> {
          c.putLogs(project, lines);
          return null;
        });
  }

  public List<String> read(final String project) {
    return client.execute(c -> c.getLogs(project));
  }

  /**
   * Reads the logs without blocking the caller's thread.
   *
   * @param project project name
   * @return the stored lines, or an error after the credential could not be renewed
   */
  public Mono<List<String>> readAsync(final String project) {
    return client.executeReactive(c -> c.getLogsAsync(project));
  }

  public RefreshingClient<LogServiceClient> client() {
    return client;
  }

  /** Stops the background credential refresh. */
  public void shutdown() {
    client.shutdown();
  }
}
