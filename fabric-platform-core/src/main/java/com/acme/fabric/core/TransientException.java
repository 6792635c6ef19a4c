package com.acme.fabric.core;

/** Failure that may succeed on a later attempt, such as a dropped connection or a lock timeout. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
