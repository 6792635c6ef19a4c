package com.acme.fabric.web;

import com.acme.fabric.repository.StoredEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

/**
 * One recorded event as exposed over HTTP. The payload is written as stored, not re-encoded, and
 * the timestamp as ISO-8601 text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventView(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("aggregate_version") int aggregateVersion,
    @JsonProperty("event_version") int eventVersion,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("correlation_id") String correlationId,
    @JsonProperty("causation_id") String causationId,
    @JsonProperty("user_id") String userId,
    @JsonRawValue @JsonProperty("payload") String payload) {

  public static EventView of(StoredEvent event) {
    return new EventView(
        event.eventId().toString(),
        event.eventType(),
        event.aggregateVersion(),
        event.eventVersion(),
        event.timestamp().toString(),
        event.correlationId(),
        event.causationId(),
        event.userId(),
        event.payload());
  }
}
