package com.example.refreshingclient.core;

/**
 * Failure reported by the remote service, carrying the HTTP status and the service error code.
 *
 * <p>Status 401 and the token error codes listed in {@link AuthErrors} are treated as
 * credential rejections by the default {@link AuthErrorDetector}.
 */
public class RemoteServiceException extends RuntimeException {

  private final int httpStatus;
  private final String errorCode;

  public RemoteServiceException(final int httpStatus, final String errorCode, final String message) {
    super(message);
    this.httpStatus = httpStatus;
    this.errorCode = errorCode;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public String errorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    return getClass().getName()
        + "{httpStatus="
        + httpStatus
        + ", errorCode="
        + errorCode
        + ", message="
        + getMessage()
        + "}";
  }
}
