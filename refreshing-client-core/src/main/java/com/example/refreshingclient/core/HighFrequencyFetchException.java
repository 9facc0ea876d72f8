package com.example.refreshingclient.core;

/**
 * Thrown when a refresh is requested before the minimum fetch interval has elapsed since the
 * previous attempt. No issuer call was made and no state was changed.
 */
public class HighFrequencyFetchException extends CredentialRefreshException {

  public HighFrequencyFetchException(final String message) {
    super(message);
  }
}
