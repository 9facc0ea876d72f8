package com.example.refreshingclient.core;

/**
 * Signals that a remote operation failed because the remote side rejected the credential, for
 * example because it expired while the request was in flight.
 *
 * <p>Recognised by {@link AuthErrorDetector#defaultDetector()}.
 */
public class AuthInvalidException extends RuntimeException {

  public AuthInvalidException(final String message) {
    super(message);
  }

  public AuthInvalidException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
