package com.rackspace.helios.app.exceptions;

/**
 * A raw point failed type, range or unit validation. The point is dropped; the batch goes on.
 */
public class ValidationException extends RuntimeException {
  public ValidationException(String message) {
    super(message);
  }
}
