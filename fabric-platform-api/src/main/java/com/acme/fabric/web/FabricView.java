package com.acme.fabric.web;

import com.acme.fabric.domain.Fabric;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Read model returned under the {@code fabric} key. */
public record FabricView(
    @JsonProperty("code") String code,
    @JsonProperty("name") String name,
    @JsonProperty("measure_unit") String measureUnit,
    @JsonProperty("offer_status") String offerStatus,
    @JsonProperty("status") String status,
    @JsonProperty("version") int version) {

  public static FabricView of(Fabric fabric) {
    return new FabricView(
        fabric.getCode(),
        fabric.getName(),
        fabric.getMeasureUnit(),
        fabric.getOfferStatus(),
        fabric.getStatus().name(),
        fabric.getVersion());
  }
}
