package com.acme.fabric.repository;

import com.acme.fabric.domain.ConcurrencyConflictException;
import com.acme.fabric.event.EventEnvelope;
import java.util.List;

/** Append-only record of facts, at most one per (aggregate id, aggregate version). */
public interface EventStore {

  /**
   * Appends all envelopes in one batch. Either every envelope is recorded or none is.
   *
   * @throws ConcurrencyConflictException if an event already exists for one of the (aggregate id,
   *     aggregate version) pairs
   */
  void append(List<? extends EventEnvelope<?>> envelopes);

  default void append(EventEnvelope<?>... envelopes) {
    append(List.of(envelopes));
  }

  /** Recorded events for one aggregate, oldest version first. */
  List<StoredEvent> findByAggregateId(String aggregateId);
}
