package com.acme.fabric.web;

import com.fasterxml.jackson.annotation.JsonProperty;

/** JSON bodies accepted by {@link FabricController}. Missing numbers bind as 0. */
public final class FabricRequests {

  private FabricRequests() {}

  public record Create(
      @JsonProperty("code") String code,
      @JsonProperty("name") String name,
      @JsonProperty("measure_unit") String measureUnit,
      @JsonProperty("offer_status") String offerStatus) {}

  public record Update(
      @JsonProperty("name") String name,
      @JsonProperty("measure_unit") String measureUnit,
      @JsonProperty("offer_status") String offerStatus,
      @JsonProperty("version") int version) {}

  public record Delete(@JsonProperty("version") int version) {}
}
