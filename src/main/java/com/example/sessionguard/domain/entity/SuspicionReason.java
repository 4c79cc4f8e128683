package com.example.sessionguard.domain.entity;

/**
 * Why a session was flagged. Flags are advisory and never deactivate a session.
 */
public enum SuspicionReason {
  FINGERPRINT_MISMATCH("Fingerprint mismatch - possible session hijacking"),
  ABNORMAL_REQUEST_RATE("Abnormal request rate");

  private final String description;

  SuspicionReason(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
