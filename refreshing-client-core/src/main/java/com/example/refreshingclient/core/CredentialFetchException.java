package com.example.refreshingclient.core;

/** Thrown when the credential issuer failed or the attempt was interrupted before issuing. */
public class CredentialFetchException extends CredentialRefreshException {

  public CredentialFetchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
