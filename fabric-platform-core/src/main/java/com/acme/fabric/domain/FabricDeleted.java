package com.acme.fabric.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FabricDeleted(
    @JsonProperty("code") String code, @JsonProperty("version") int version)
    implements FabricEvent {

  @Override
  public FabricEventKind kind() {
    return FabricEventKind.DELETED;
  }
}
