package com.acme.fabric.spi;

import com.acme.fabric.event.EventEnvelope;

/** Outward transport for recorded events. */
public interface EventPublisher {

  /**
   * Publishes one envelope to a topic, keyed by aggregate id so events of one aggregate keep their
   * order.
   */
  void publish(String topic, EventEnvelope<?> envelope);
}
