package com.acme.fabric.repository;

import java.time.Instant;
import java.util.UUID;

/** One row of the event table. The payload is kept as the JSON text that was written. */
public record StoredEvent(
    UUID eventId,
    String aggregateId,
    String aggregateType,
    String eventType,
    int aggregateVersion,
    int eventVersion,
    String payload,
    Instant timestamp,
    String correlationId,
    String causationId,
    String userId) {}
