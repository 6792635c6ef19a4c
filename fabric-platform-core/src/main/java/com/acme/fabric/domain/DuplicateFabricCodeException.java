package com.acme.fabric.domain;

import lombok.Getter;

@Getter
public class DuplicateFabricCodeException extends FabricDomainException {
  private final String code;

  public DuplicateFabricCodeException(String code) {
    super("a fabric with this code already exists: " + code);
    this.code = code;
  }

  public DuplicateFabricCodeException(String code, Throwable cause) {
    super("a fabric with this code already exists: " + code, cause);
    this.code = code;
  }
}
