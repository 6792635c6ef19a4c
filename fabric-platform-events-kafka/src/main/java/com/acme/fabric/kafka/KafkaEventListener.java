package com.acme.fabric.kafka;

import com.acme.fabric.core.PermanentException;
import com.acme.fabric.messaging.MessageRouter;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes inbound topics as a member of a consumer group and hands each record to the
 * {@link MessageRouter}, using the topic name as subject.
 *
 * <p>Offsets are committed one record at a time after the handler returns. When the handler throws
 * the consumer seeks that partition back to the failed record, so it is redelivered after {@code
 * retryBackoff} and nothing behind it on that partition is processed first. A {@link
 * PermanentException} is logged and committed past instead. Errors escaping a poll are logged and
 * the loop carries on after the same back-off.
 */
@Singleton
@Requires(beans = Consumer.class)
public class KafkaEventListener implements ApplicationEventListener<StartupEvent> {
  private static final Logger LOG = LoggerFactory.getLogger(KafkaEventListener.class);

  private final Consumer<String, String> consumer;
  private final MessageRouter router;
  private final KafkaSettings settings;
  private final AtomicBoolean running = new AtomicBoolean();
  private Thread worker;

  public KafkaEventListener(
      Consumer<String, String> consumer, MessageRouter router, KafkaSettings settings) {
    this.consumer = consumer;
    this.router = router;
    this.settings = settings;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    start();
  }

  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    worker = new Thread(this::run, "kafka-inbound-listener");
    worker.setDaemon(true);
    worker.start();
    LOG.info(
        "Kafka listener started: group={}, pattern={}",
        settings.getGroupId(),
        settings.getTopicPattern());
  }

  @PreDestroy
  public synchronized void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    consumer.wakeup();
    try {
      worker.join(Duration.ofSeconds(10).toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOG.info("Kafka listener stopped");
  }

  public boolean isRunning() {
    return running.get();
  }

  void run() {
    try {
      consumer.subscribe(Pattern.compile(settings.getTopicPattern()));
      while (running.get()) {
        try {
          pollOnce();
        } catch (WakeupException e) {
          throw e;
        } catch (RuntimeException e) {
          LOG.error("Error in Kafka listener poll loop: {}", e.getMessage(), e);
          backoff();
        }
      }
    } catch (WakeupException e) {
      if (running.get()) {
        throw e;
      }
    } finally {
      running.set(false);
    }
  }

  /**
   * Polls one batch and processes it partition by partition; returns the number of records handled
   * successfully. A failed record stops its own partition only, the other partitions of the batch
   * are still processed in order.
   */
  int pollOnce() {
    ConsumerRecords<String, String> records = consumer.poll(settings.getPollTimeout());
    int handled = 0;
    boolean failed = false;
    for (TopicPartition partition : records.partitions()) {
      for (ConsumerRecord<String, String> record : records.records(partition)) {
        if (!process(partition, record)) {
          // the rest of this partition is fetched again after the seek
          failed = true;
          break;
        }
        handled++;
      }
    }
    if (failed) {
      backoff();
    }
    return handled;
  }

  private boolean process(TopicPartition partition, ConsumerRecord<String, String> record) {
    try {
      router.handle(record.topic(), record.value());
      consumer.commitSync(Map.of(partition, new OffsetAndMetadata(record.offset() + 1)));
      return true;
    } catch (PermanentException e) {
      LOG.error(
          "Dropping unprocessable record {}-{}@{}",
          record.topic(),
          record.partition(),
          record.offset(),
          e);
      consumer.commitSync(Map.of(partition, new OffsetAndMetadata(record.offset() + 1)));
      return true;
    } catch (RuntimeException e) {
      LOG.warn(
          "Processing failed for {}-{}@{}, will retry: {}",
          record.topic(),
          record.partition(),
          record.offset(),
          e.getMessage());
      consumer.seek(partition, record.offset());
      return false;
    }
  }

  private void backoff() {
    try {
      Thread.sleep(settings.getRetryBackoff().toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running.set(false);
    }
  }
}
