package com.acme.fabric.kafka;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.fabric.core.PermanentException;
import com.acme.fabric.core.TransientException;
import com.acme.fabric.messaging.MessageRouter;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KafkaEventListener Tests")
class KafkaEventListenerTest {

  private static final TopicPartition ERP_FABRIC = new TopicPartition("erp.fabric", 0);
  private static final TopicPartition ERP_FABRIC_1 = new TopicPartition("erp.fabric", 1);

  private MockConsumer<String, String> consumer;
  private MessageRouter router;
  private final List<String> received = new CopyOnWriteArrayList<>();
  private KafkaEventListener listener;

  @BeforeEach
  void setUp() {
    consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    router = new MessageRouter();

    KafkaSettings settings = new KafkaSettings();
    settings.setRetryBackoff(Duration.ofMillis(1));
    settings.setPollTimeout(Duration.ofMillis(10));

    listener = new KafkaEventListener(consumer, router, settings);
  }

  private void assign() {
    consumer.assign(List.of(ERP_FABRIC));
    consumer.updateBeginningOffsets(Map.of(ERP_FABRIC, 0L));
  }

  private void addRecord(long offset, String value) {
    consumer.addRecord(new ConsumerRecord<>("erp.fabric", 0, offset, "key", value));
  }

  private void addRecord(int partition, long offset, String value) {
    consumer.addRecord(new ConsumerRecord<>("erp.fabric", partition, offset, "key", value));
  }

  private Long committedOffset() {
    return committedOffset(ERP_FABRIC);
  }

  private Long committedOffset(TopicPartition partition) {
    OffsetAndMetadata committed = consumer.committed(Set.of(partition)).get(partition);
    return committed == null ? null : committed.offset();
  }

  @Test
  @DisplayName("Should route each record by topic and commit after success")
  void testPollOnce_Success() {
    // Given
    router.registerHandler("erp.fabric", (subject, payload) -> received.add(payload));
    assign();
    addRecord(0, "first");
    addRecord(1, "second");

    // When
    int handled = listener.pollOnce();

    // Then
    assertThat(handled).isEqualTo(2);
    assertThat(received).containsExactly("first", "second");
    assertThat(committedOffset()).isEqualTo(2L);
  }

  @Test
  @DisplayName("Should seek back to a failed record and not commit it")
  void testPollOnce_RetryableFailure() {
    router.registerHandler(
        "erp.fabric",
        (subject, payload) -> {
          if (payload.equals("bad")) {
            throw new TransientException("database unavailable");
          }
          received.add(payload);
        });
    assign();
    addRecord(0, "good");
    addRecord(1, "bad");
    addRecord(2, "after");

    int handled = listener.pollOnce();

    assertThat(handled).isEqualTo(1);
    assertThat(received).containsExactly("good");
    assertThat(committedOffset()).isEqualTo(1L);
    assertThat(consumer.position(ERP_FABRIC)).isEqualTo(1L);
  }

  @Test
  @DisplayName("Should keep processing other partitions when one partition fails")
  void testPollOnce_RetryableFailureOnOnePartition() {
    AtomicBoolean failedOnce = new AtomicBoolean();
    router.registerHandler(
        "erp.fabric",
        (subject, payload) -> {
          if (payload.equals("p1-0") && failedOnce.compareAndSet(false, true)) {
            throw new TransientException("database unavailable");
          }
          received.add(payload);
        });
    consumer.assign(List.of(ERP_FABRIC, ERP_FABRIC_1));
    consumer.updateBeginningOffsets(Map.of(ERP_FABRIC, 0L, ERP_FABRIC_1, 0L));
    addRecord(0, 0, "p0-0");
    addRecord(0, 1, "p0-1");
    addRecord(1, 0, "p1-0");
    addRecord(1, 1, "p1-1");

    int handled = listener.pollOnce();

    assertThat(handled).isEqualTo(2);
    assertThat(received).containsExactly("p0-0", "p0-1");
    assertThat(committedOffset(ERP_FABRIC)).isEqualTo(2L);
    assertThat(committedOffset(ERP_FABRIC_1)).isNull();
    assertThat(consumer.position(ERP_FABRIC)).isEqualTo(2L);
    assertThat(consumer.position(ERP_FABRIC_1)).isZero();

    // redelivery of the failed partition from the seek position
    addRecord(1, 0, "p1-0");
    addRecord(1, 1, "p1-1");

    handled = listener.pollOnce();

    assertThat(handled).isEqualTo(2);
    assertThat(received).containsExactly("p0-0", "p0-1", "p1-0", "p1-1");
    assertThat(committedOffset(ERP_FABRIC)).isEqualTo(2L);
    assertThat(committedOffset(ERP_FABRIC_1)).isEqualTo(2L);
  }

  @Test
  @DisplayName("Should commit past a record that failed permanently")
  void testPollOnce_PermanentFailure() {
    router.registerHandler(
        "erp.fabric",
        (subject, payload) -> {
          throw new PermanentException("cannot ever succeed");
        });
    assign();
    addRecord(0, "poison");

    int handled = listener.pollOnce();

    assertThat(handled).isEqualTo(1);
    assertThat(committedOffset()).isEqualTo(1L);
  }

  @Test
  @DisplayName("Should acknowledge records on topics without a handler")
  void testPollOnce_UnknownSubject() {
    assign();
    addRecord(0, "{}");

    int handled = listener.pollOnce();

    assertThat(handled).isEqualTo(1);
    assertThat(committedOffset()).isEqualTo(1L);
  }

  @Test
  @DisplayName("Should subscribe on start and stop on wakeup")
  void testLifecycle() {
    listener.start();
    assertThat(listener.isRunning()).isTrue();

    listener.stop();

    assertThat(listener.isRunning()).isFalse();
  }

  @Test
  @DisplayName("Should keep polling after a poll error")
  void testRun_SurvivesPollError() throws InterruptedException {
    router.registerHandler("erp.fabric", (subject, payload) -> received.add(payload));
    consumer.updatePartitions(
        "erp.fabric", List.of(new PartitionInfo("erp.fabric", 0, null, null, null)));
    consumer.updateBeginningOffsets(Map.of(ERP_FABRIC, 0L));
    consumer.schedulePollTask(() -> addRecord(0, "after-error"));
    consumer.setPollException(new KafkaException("broker unavailable"));

    listener.start();
    long deadline = System.currentTimeMillis() + 5_000;
    while (received.isEmpty() && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    assertThat(received).containsExactly("after-error");
    assertThat(listener.isRunning()).isTrue();
    listener.stop();
    assertThat(listener.isRunning()).isFalse();
  }
}
