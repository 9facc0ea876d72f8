package com.example.refreshingclient.core;

/** Request signature scheme used by a {@link RemoteClient}. */
public enum AuthVersion {
  V1,
  V4
}
