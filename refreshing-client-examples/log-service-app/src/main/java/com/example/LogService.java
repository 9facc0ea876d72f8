package com.example;

import com.example.refreshingclient.core.Credential;
import com.example.refreshingclient.core.RemoteServiceException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory log service standing in for a remote endpoint. It issues short-lived session
 * credentials and rejects requests signed with unknown, mismatched or expired ones the way the
 * hosted service does.
 */
public class LogService {

  private final Clock clock;
  private final Map<String, Credential> sessions = new ConcurrentHashMap<>();
  private final Map<String, List<String>> projects = new ConcurrentHashMap<>();

  public LogService(final Clock clock) {
    this.clock = clock;
  }

  /**
   * Issues a new session credential.
   *
   * @param validity how long the credential is accepted
   * @return the issued credential
   */
  public Credential issue(final Duration validity) {
    final var credential =
        new Credential(
            "STS." + UUID.randomUUID(),
            UUID.randomUUID().toString(),
            UUID.randomUUID().toString(),
            clock.instant().plus(validity));
    sessions.put(credential.accessKeyId(), credential);
    return credential;
  }

  /** Invalidates every issued credential, as a key rotation on the service side would. */
  public void revokeAll() {
    sessions.clear();
  }

  void authenticate(final LogServiceClient.Signature signature) {
    if (signature == null) throw new RemoteServiceException(401, "Unauthorized", "No credential");

    final var session = sessions.get(signature.accessKeyId());
    if (session == null)
      throw new RemoteServiceException(
          401, "InvalidAccessKeyId", "Access key " + signature.accessKeyId() + " not found");
    if (!session.accessKeySecret().equals(signature.accessKeySecret())
        || !session.securityToken().equals(signature.securityToken()))
      throw new RemoteServiceException(403, "SignatureDoesNotMatch", "Signature mismatch");
    if (!clock.instant().isBefore(session.expiresAt()))
      throw new RemoteServiceException(401, "SecurityTokenExpired", "Security token expired");
  }

  void createProject(final LogServiceClient.Signature signature, final String project) {
    authenticate(signature);
    if (projects.putIfAbsent(project, new CopyOnWriteArrayList<>()) != null)
      throw new RemoteServiceException(
          409, "ProjectAlreadyExist", "Project " + project + " already exists");
  }

  List<String> listProjects(final LogServiceClient.Signature signature) {
    authenticate(signature);
    return projects.keySet().stream().sorted().toList();
  }

  void putLogs(
      final LogServiceClient.Signature signature, final String project, final List<String> lines) {
    authenticate(signature);
    projectLogs(project).addAll(lines);
  }

  List<String> getLogs(final LogServiceClient.Signature signature, final String project) {
    authenticate(signature);
    return List.copyOf(projectLogs(project));
  }

  private List<String> projectLogs(final String project) {
    final var logs = projects.get(project);
    if (logs == null)
      throw new RemoteServiceException(404, "ProjectNotExist", "Project " + project + " not found");
    return logs;
  }
}
