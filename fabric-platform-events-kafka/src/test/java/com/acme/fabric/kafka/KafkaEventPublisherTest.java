package com.acme.fabric.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.fabric.core.TransientException;
import com.acme.fabric.domain.FabricCreated;
import com.acme.fabric.domain.FabricDeleted;
import com.acme.fabric.event.EnvelopeOptions;
import com.acme.fabric.event.EventEnvelope;
import com.acme.fabric.event.InvalidEnvelopeException;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.producer.Callback;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("KafkaEventPublisher Unit Tests")
class KafkaEventPublisherTest {

  private Producer<String, String> producer;
  private KafkaEventPublisher publisher;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    producer = mock(Producer.class);
    publisher = new KafkaEventPublisher(producer);
  }

  private static EventEnvelope<FabricCreated> created() {
    return EventEnvelope.of(
        "app.fabric.created",
        "COT01",
        "Fabric",
        1,
        new FabricCreated("COT01", "Cotton", "MB", "ACTIVE", 1),
        new EnvelopeOptions("corr-9", "", "alice"));
  }

  @SuppressWarnings("unchecked")
  private ProducerRecord<String, String> capturedRecord() {
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(producer).send(captor.capture(), any(Callback.class));
    return captor.getValue();
  }

  private static String header(ProducerRecord<String, String> record, String name) {
    return new String(record.headers().lastHeader(name).value(), StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("Should key the record by aggregate id and write the envelope as JSON")
  void testPublish_RecordShape() {
    // When
    publisher.publish("app.fabric", created());

    // Then
    ProducerRecord<String, String> record = capturedRecord();
    assertThat(record.topic()).isEqualTo("app.fabric");
    assertThat(record.key()).isEqualTo("COT01");
    assertThat(record.value())
        .contains("\"event_type\":\"app.fabric.created\"")
        .contains("\"aggregate_version\":1")
        .contains("\"correlation_id\":\"corr-9\"")
        .doesNotContain("causation_id");
  }

  @Test
  @DisplayName("Should copy routing metadata into headers and skip empty ones")
  void testPublish_Headers() {
    EventEnvelope<FabricCreated> envelope = created();

    publisher.publish("app.fabric", envelope);

    ProducerRecord<String, String> record = capturedRecord();
    assertThat(header(record, KafkaEventPublisher.HEADER_EVENT_TYPE)).isEqualTo("app.fabric.created");
    assertThat(header(record, KafkaEventPublisher.HEADER_EVENT_ID)).isEqualTo(envelope.eventId());
    assertThat(header(record, KafkaEventPublisher.HEADER_AGGREGATE_TYPE)).isEqualTo("Fabric");
    assertThat(header(record, KafkaEventPublisher.HEADER_CORRELATION_ID)).isEqualTo("corr-9");
  }

  @Test
  @DisplayName("Should omit the correlation header when the envelope has none")
  void testPublish_NoCorrelation() {
    publisher.publish(
        "app.fabric",
        EventEnvelope.of("app.fabric.deleted", "COT01", "Fabric", 2, new FabricDeleted("COT01", 2)));

    assertThat(capturedRecord().headers().lastHeader(KafkaEventPublisher.HEADER_CORRELATION_ID))
        .isNull();
  }

  @Test
  @DisplayName("Should reject an invalid envelope without sending")
  void testPublish_Invalid() {
    EventEnvelope<FabricDeleted> invalid =
        EventEnvelope.of("app.fabric.deleted", " ", "Fabric", 2, new FabricDeleted("COT01", 2));

    assertThatThrownBy(() -> publisher.publish("app.fabric", invalid))
        .isInstanceOf(InvalidEnvelopeException.class)
        .hasMessage("aggregate ID is required");
    verify(producer, never()).send(any(), any());
  }

  @Test
  @DisplayName("Should translate a synchronous send failure into a transient exception")
  void testPublish_SendFailure() {
    when(producer.send(any(), any())).thenThrow(new KafkaException("buffer exhausted"));

    assertThatThrownBy(() -> publisher.publish("app.fabric", created()))
        .isInstanceOf(TransientException.class)
        .hasMessageContaining("app.fabric");
  }

  @Test
  @DisplayName("Should log, not throw, from the completion callback")
  void testPublish_Callbacks() {
    ArgumentCaptor<Callback> callbackCaptor = ArgumentCaptor.forClass(Callback.class);
    publisher.publish("app.fabric", created());
    verify(producer).send(any(), callbackCaptor.capture());
    Callback callback = callbackCaptor.getValue();

    callback.onCompletion(
        new RecordMetadata(new TopicPartition("app.fabric", 0), 0L, 0, 0L, 0, 100), null);
    callback.onCompletion(null, new KafkaException("broker unavailable"));
  }
}
