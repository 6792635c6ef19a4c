package com.acme.fabric.kafka;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.Properties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

/** Creates the Kafka producer and consumer from {@link KafkaSettings}. */
@Factory
public class KafkaClientFactory {

  /** Creates KafkaSettings bean populated from application.yml kafka.* properties */
  @Singleton
  @ConfigurationProperties("kafka")
  public KafkaSettings kafkaSettings() {
    return new KafkaSettings();
  }

  @Singleton
  @Bean(preDestroy = "close")
  public Producer<String, String> kafkaProducer(KafkaSettings settings) {
    return new KafkaProducer<>(producerProperties(settings));
  }

  @Singleton
  @Bean(preDestroy = "close")
  @Requires(property = "kafka.consumer-enabled", value = "true", defaultValue = "true")
  public Consumer<String, String> kafkaConsumer(KafkaSettings settings) {
    return new KafkaConsumer<>(consumerProperties(settings));
  }

  static Properties producerProperties(KafkaSettings settings) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, settings.getBootstrapServers());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, settings.getClientId() + "-producer");
    props.put(ProducerConfig.ACKS_CONFIG, settings.getAcks());
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return props;
  }

  static Properties consumerProperties(KafkaSettings settings) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, settings.getBootstrapServers());
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, settings.getClientId() + "-consumer");
    props.put(ConsumerConfig.GROUP_ID_CONFIG, settings.getGroupId());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "50");
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    return props;
  }
}
