package com.acme.fabric.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable, transmissible record of one fact about one aggregate version. The pair {@code
 * (aggregateId, aggregateVersion)} is the natural key: at most one envelope exists per pair.
 *
 * <p>Serialized as snake_case JSON; empty tracing fields are omitted from the wire form.
 *
 * @param eventId globally unique id, a random UUID
 * @param eventType namespaced type, e.g. {@code app.fabric.created}
 * @param aggregateId identity of the aggregate, the fabric code
 * @param aggregateType aggregate kind, e.g. {@code Fabric}
 * @param aggregateVersion aggregate version this fact produced
 * @param eventVersion schema version of the envelope itself
 * @param timestamp creation time
 * @param correlationId optional correlation id
 * @param causationId optional id of the causing message
 * @param userId optional acting user
 * @param payload the fact
 * @param <T> payload type
 */
public record EventEnvelope<T>(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("aggregate_id") String aggregateId,
    @JsonProperty("aggregate_type") String aggregateType,
    @JsonProperty("aggregate_version") int aggregateVersion,
    @JsonProperty("event_version") int eventVersion,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("correlation_id") @JsonInclude(JsonInclude.Include.NON_EMPTY)
        String correlationId,
    @JsonProperty("causation_id") @JsonInclude(JsonInclude.Include.NON_EMPTY) String causationId,
    @JsonProperty("user_id") @JsonInclude(JsonInclude.Include.NON_EMPTY) String userId,
    @JsonProperty("payload") T payload) {

  public static final int CURRENT_EVENT_VERSION = 1;

  public static <T> EventEnvelope<T> of(
      String eventType,
      String aggregateId,
      String aggregateType,
      int aggregateVersion,
      T payload,
      EnvelopeOptions options) {
    EnvelopeOptions opts = options == null ? EnvelopeOptions.NONE : options;
    return new EventEnvelope<>(
        UUID.randomUUID().toString(),
        eventType,
        aggregateId,
        aggregateType,
        aggregateVersion,
        CURRENT_EVENT_VERSION,
        Instant.now(),
        opts.correlationId(),
        opts.causationId(),
        opts.userId(),
        payload);
  }

  public static <T> EventEnvelope<T> of(
      String eventType, String aggregateId, String aggregateType, int aggregateVersion, T payload) {
    return of(eventType, aggregateId, aggregateType, aggregateVersion, payload, EnvelopeOptions.NONE);
  }

  /**
   * Checks the fields every downstream consumer relies on.
   *
   * @throws InvalidEnvelopeException naming the first missing field
   */
  public void validate() {
    if (isBlank(eventType)) {
      throw new InvalidEnvelopeException("event type is required");
    }
    if (isBlank(aggregateId)) {
      throw new InvalidEnvelopeException("aggregate ID is required");
    }
    if (isBlank(aggregateType)) {
      throw new InvalidEnvelopeException("aggregate type is required");
    }
    if (payload == null) {
      throw new InvalidEnvelopeException("payload is required");
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
