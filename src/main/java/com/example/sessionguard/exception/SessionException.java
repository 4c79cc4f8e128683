package com.example.sessionguard.exception;

/**
 * Raised when a request refers to a session that does not exist or can no longer authenticate.
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }

  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
