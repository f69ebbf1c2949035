package com.rackspace.helios.app.exceptions;

/**
 * A store read or write failed. Never retried locally; the caller owns the retry policy.
 */
public class StoreUnavailableException extends RuntimeException {
  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
