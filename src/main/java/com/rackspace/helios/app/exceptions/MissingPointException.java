package com.rackspace.helios.app.exceptions;

/**
 * A series has no value at a timestamp where the computation needs one.
 */
public class MissingPointException extends RuntimeException {
  public MissingPointException(String message) {
    super(message);
  }
}
