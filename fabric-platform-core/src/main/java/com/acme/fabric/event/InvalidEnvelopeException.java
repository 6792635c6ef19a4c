package com.acme.fabric.event;

import com.acme.fabric.core.PermanentException;

public class InvalidEnvelopeException extends PermanentException {
  public InvalidEnvelopeException(String message) {
    super(message);
  }
}
