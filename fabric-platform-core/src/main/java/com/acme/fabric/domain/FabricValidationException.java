package com.acme.fabric.domain;

import lombok.Getter;

/** Thrown when a fabric attribute breaks one of the {@link Rule}s. */
@Getter
public class FabricValidationException extends FabricDomainException {

  private final Rule rule;

  public FabricValidationException(Rule rule) {
    super(rule.getMessage());
    this.rule = rule;
  }

  @Getter
  public enum Rule {
    CODE_LENGTH("code", "the fabric code length must be 2-30"),
    CODE_PATTERN("code", "the fabric code can contain A-Z and 0-9 characters"),
    NAME_LENGTH("name", "the fabric name length must be 1-250");

    private final String field;
    private final String message;

    Rule(String field, String message) {
      this.field = field;
      this.message = message;
    }
  }
}
