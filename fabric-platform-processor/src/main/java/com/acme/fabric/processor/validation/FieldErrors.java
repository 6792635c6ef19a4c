package com.acme.fabric.processor.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Collects input problems keyed by field. Only the first message per field is kept. */
public class FieldErrors {

  private final Map<String, String> errors = new LinkedHashMap<>();

  public FieldErrors check(boolean ok, String field, String message) {
    if (!ok) {
      errors.putIfAbsent(field, message);
    }
    return this;
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(errors);
  }

  /** @throws InputValidationException if any check failed */
  public void throwIfInvalid() {
    if (!isValid()) {
      throw new InputValidationException(asMap());
    }
  }

  @Override
  public String toString() {
    return errors.toString();
  }
}
