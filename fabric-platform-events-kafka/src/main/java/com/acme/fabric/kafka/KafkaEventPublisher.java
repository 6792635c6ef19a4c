package com.acme.fabric.kafka;

import com.acme.fabric.core.Jsons;
import com.acme.fabric.core.TransientException;
import com.acme.fabric.event.EventEnvelope;
import com.acme.fabric.spi.EventPublisher;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes event envelopes to Kafka as JSON. The record key is the aggregate id so all events of
 * one fabric land on one partition in version order.
 */
@Singleton
public class KafkaEventPublisher implements EventPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(KafkaEventPublisher.class);

  static final String HEADER_EVENT_TYPE = "eventType";
  static final String HEADER_EVENT_ID = "eventId";
  static final String HEADER_AGGREGATE_TYPE = "aggregateType";
  static final String HEADER_CORRELATION_ID = "correlationId";

  private final Producer<String, String> producer;

  public KafkaEventPublisher(Producer<String, String> producer) {
    this.producer = producer;
  }

  @Override
  public void publish(String topic, EventEnvelope<?> envelope) {
    envelope.validate();

    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, envelope.aggregateId(), Jsons.toJson(envelope));
    header(record, HEADER_EVENT_TYPE, envelope.eventType());
    header(record, HEADER_EVENT_ID, envelope.eventId());
    header(record, HEADER_AGGREGATE_TYPE, envelope.aggregateType());
    header(record, HEADER_CORRELATION_ID, envelope.correlationId());

    try {
      producer.send(
          record,
          (metadata, exception) -> {
            if (exception != null) {
              LOG.error(
                  "Failed to publish to Kafka topic {}: eventType={}, aggregateId={}",
                  topic,
                  envelope.eventType(),
                  envelope.aggregateId(),
                  exception);
            } else {
              LOG.debug(
                  "Published {} v{} to {}-{}@{}",
                  envelope.eventType(),
                  envelope.aggregateVersion(),
                  metadata.topic(),
                  metadata.partition(),
                  metadata.offset());
            }
          });
    } catch (KafkaException e) {
      throw new TransientException("Failed to publish to Kafka topic " + topic, e);
    }
  }

  private static void header(ProducerRecord<String, String> record, String name, String value) {
    if (value != null && !value.isEmpty()) {
      record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
    }
  }
}
