package com.example.sessionguard.exception;

/**
 * Signals that a counter store could not serve an increment, so the caller may fall back.
 */
public class CounterStoreUnavailableException extends RuntimeException {
  public CounterStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
