package com.example.refreshingclient.core;

/**
 * Source of fresh credentials. Implementations typically call a security token service or read a
 * secret store.
 */
@FunctionalInterface
public interface CredentialIssuer {
  /**
   * Issues a new credential.
   *
   * @return the issued credential
   * @throws Exception if no credential could be obtained
   */
  Credential issue() throws Exception;
}
