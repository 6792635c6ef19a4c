package com.acme.fabric.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FabricCreated(
    @JsonProperty("code") String code,
    @JsonProperty("name") String name,
    @JsonProperty("measure_unit") String measureUnit,
    @JsonProperty("offer_status") String offerStatus,
    @JsonProperty("version") int version)
    implements FabricEvent {

  @Override
  public FabricEventKind kind() {
    return FabricEventKind.CREATED;
  }
}
