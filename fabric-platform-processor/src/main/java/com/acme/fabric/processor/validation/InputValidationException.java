package com.acme.fabric.processor.validation;

import com.acme.fabric.core.PermanentException;
import java.util.Map;
import lombok.Getter;

/** Request or inbound event data failed field validation before any command ran. */
@Getter
public class InputValidationException extends PermanentException {

  private final Map<String, String> errors;

  public InputValidationException(Map<String, String> errors) {
    super("Invalid input: " + errors);
    this.errors = Map.copyOf(errors);
  }
}
