package com.acme.fabric.domain;

import lombok.Getter;

/**
 * No matching row: either the code never existed, the row is DELETED, or a conditional write found
 * the version already moved on.
 */
@Getter
public class FabricNotFoundException extends FabricDomainException {
  private final String code;

  public FabricNotFoundException(String code) {
    super("record not found: fabric " + code);
    this.code = code;
  }
}
