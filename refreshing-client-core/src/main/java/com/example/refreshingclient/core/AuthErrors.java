package com.example.refreshingclient.core;

import java.util.Locale;
import java.util.Set;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

/** Heuristics used by {@link AuthErrorDetector#defaultDetector()}. */
final class AuthErrors {

  private AuthErrors() {}

  static final int UNAUTHORIZED = 401;

  static final Set<String> TOKEN_ERROR_CODES =
      Set.of(
          "ExpiredToken",
          "ExpiredTokenException",
          "InvalidClientTokenId",
          "InvalidAccessKeyId",
          "SignatureDoesNotMatch",
          "SecurityTokenExpired",
          "Unauthorized");

  private static final String[] AUTH_KEYWORDS = {
    "security token expired", "token expired", "invalid access key", "unauthorized"
  };

  /**
   * Walks the cause chain and reports whether any element signals a rejected credential.
   *
   * <ul>
   *   <li>{@link AuthInvalidException} anywhere in the chain
   *   <li>{@link RemoteServiceException} or AWS {@link AwsServiceException} with HTTP 401 or a token
   *       error code
   *   <li>message keywords: security token expired, token expired, invalid access key, unauthorized
   * </ul>
   */
  static boolean isAuthError(final Throwable error) {
    Throwable cur = error;
    while (cur != null) {
      if (matches(cur)) return true;
      if (cur.getCause() == cur) break;
      cur = cur.getCause();
    }
    return false;
  }

  private static boolean matches(final Throwable t) {
    if (t instanceof AuthInvalidException) return true;

    if (t instanceof RemoteServiceException remote) {
      if (remote.httpStatus() == UNAUTHORIZED) return true;
      if (remote.errorCode() != null && TOKEN_ERROR_CODES.contains(remote.errorCode())) return true;
    }

    if (t instanceof AwsServiceException aws) {
      if (aws.statusCode() == UNAUTHORIZED) return true;
      final var details = aws.awsErrorDetails();
      if (details != null
          && details.errorCode() != null
          && TOKEN_ERROR_CODES.contains(details.errorCode())) return true;
    }

    final var msg = t.getMessage();
    if (msg != null) {
      final var lower = msg.toLowerCase(Locale.ROOT);
      for (final var keyword : AUTH_KEYWORDS) if (lower.contains(keyword)) return true;
    }

    return false;
  }
}
