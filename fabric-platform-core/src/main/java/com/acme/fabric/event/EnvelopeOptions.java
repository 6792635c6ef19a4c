package com.acme.fabric.event;

/**
 * Optional tracing metadata copied onto an {@link EventEnvelope}. Absent values are empty strings,
 * never null.
 *
 * @param correlationId ties every event produced by one request or inbound message together
 * @param causationId id of the message that caused this event, if any
 * @param userId acting user, for audit
 */
public record EnvelopeOptions(String correlationId, String causationId, String userId) {

  public static final EnvelopeOptions NONE = new EnvelopeOptions("", "", "");

  public EnvelopeOptions {
    correlationId = correlationId == null ? "" : correlationId;
    causationId = causationId == null ? "" : causationId;
    userId = userId == null ? "" : userId;
  }
}
