package com.acme.fabric.domain;

import com.acme.fabric.core.PermanentException;

/**
 * Base type for rule violations raised by the fabric aggregate and its repository. These never
 * succeed on retry, so they extend {@link PermanentException}.
 */
public abstract class FabricDomainException extends PermanentException {
  protected FabricDomainException(String message) {
    super(message);
  }

  protected FabricDomainException(String message, Throwable cause) {
    super(message, cause);
  }
}
