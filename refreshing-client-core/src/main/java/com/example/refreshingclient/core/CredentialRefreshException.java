package com.example.refreshingclient.core;

/** Base type for failures of a credential refresh attempt. */
public class CredentialRefreshException extends Exception {

  public CredentialRefreshException(final String message) {
    super(message);
  }

  public CredentialRefreshException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
