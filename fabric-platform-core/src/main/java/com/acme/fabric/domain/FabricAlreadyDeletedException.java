package com.acme.fabric.domain;

import lombok.Getter;

@Getter
public class FabricAlreadyDeletedException extends FabricDomainException {
  private final String code;

  public FabricAlreadyDeletedException(String code) {
    super("cannot perform on a deleted fabric: " + code);
    this.code = code;
  }
}
