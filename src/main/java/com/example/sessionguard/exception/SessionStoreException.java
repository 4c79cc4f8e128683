package com.example.sessionguard.exception;

/**
 * Session store could not be reached or returned an unusable record.
 */
public class SessionStoreException extends RuntimeException {
  public SessionStoreException(String message) {
    super(message);
  }

  public SessionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
