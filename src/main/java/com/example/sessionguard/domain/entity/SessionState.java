package com.example.sessionguard.domain.entity;

/**
 * Lifecycle state of a session. Only {@link #ACTIVE} sessions can authenticate a request;
 * every other state is terminal.
 */
public enum SessionState {
  ACTIVE,
  EXPIRED,
  LOGGED_OUT,
  EVICTED
}
