package com.example.refreshingclient.core;

import java.util.function.Predicate;

/**
 * Decides whether a failed remote operation was rejected because of its credential.
 *
 * <h2>Combining Detectors</h2>
 *
 * <pre>{@code
 * var detector = AuthErrorDetector.defaultDetector()
 *     .or(AuthErrorDetector.custom(e -> e instanceof MyServiceException ex && ex.code() == 4011));
 * }</pre>
 */
@FunctionalInterface
public interface AuthErrorDetector {

  /**
   * Determines if the failure represents a credential rejection.
   *
   * @param error the failure raised by the operation
   * @return true if refreshing the credential may let a retry succeed
   */
  boolean isAuthError(Throwable error);

  /**
   * Returns the default detector.
   *
   * <p>Recognises {@link AuthInvalidException}, HTTP 401 and token error codes on {@link
   * RemoteServiceException} and AWS service exceptions, and common token-expiry messages, anywhere
   * in the cause chain.
   *
   * @return default detector
   */
  static AuthErrorDetector defaultDetector() {
    return AuthErrors::isAuthError;
  }

  /**
   * Creates a custom detector from a predicate.
   *
   * @param predicate the predicate to use for detection
   * @return custom detector
   */
  static AuthErrorDetector custom(final Predicate<Throwable> predicate) {
    return predicate::test;
  }

  /**
   * Combines this detector with another using OR logic.
   *
   * @param other the other detector to combine with
   * @return combined detector
   */
  default AuthErrorDetector or(final AuthErrorDetector other) {
    return e -> this.isAuthError(e) || other.isAuthError(e);
  }
}
