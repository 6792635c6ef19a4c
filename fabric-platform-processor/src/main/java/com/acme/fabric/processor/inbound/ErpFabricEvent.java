package com.acme.fabric.processor.inbound;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Payload of an {@code erp.fabric.*} event. Unit and offer status are optional. */
public record ErpFabricEvent(
    @JsonProperty("fabric_code") String code,
    @JsonProperty("fabric_name") String name,
    @JsonProperty("measure_unit") String measureUnit,
    @JsonProperty("offer_status") String offerStatus) {

  ErpFabricEvent withDefaults(String defaultMeasureUnit, String defaultOfferStatus) {
    return new ErpFabricEvent(
        code,
        name,
        isBlank(measureUnit) ? defaultMeasureUnit : measureUnit,
        isBlank(offerStatus) ? defaultOfferStatus : offerStatus);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
