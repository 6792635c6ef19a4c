package com.acme.fabric.kafka;

import java.time.Duration;

/** Kafka client settings bound from {@code kafka.*}. Pure POJO - no framework dependencies. */
public class KafkaSettings {

  private String bootstrapServers = "localhost:9092";
  private String clientId = "fabric-service";
  private String acks = "all";

  private boolean consumerEnabled = true;
  private String groupId = "erp-service-group";
  private String topicPattern = "erp\\..*";
  private Duration pollTimeout = Duration.ofMillis(500);
  private Duration retryBackoff = Duration.ofSeconds(1);

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public String getAcks() {
    return acks;
  }

  public void setAcks(String acks) {
    this.acks = acks;
  }

  public boolean isConsumerEnabled() {
    return consumerEnabled;
  }

  public void setConsumerEnabled(boolean consumerEnabled) {
    this.consumerEnabled = consumerEnabled;
  }

  public String getGroupId() {
    return groupId;
  }

  public void setGroupId(String groupId) {
    this.groupId = groupId;
  }

  /** Regular expression of topics to subscribe to, e.g. {@code erp\..*}. */
  public String getTopicPattern() {
    return topicPattern;
  }

  public void setTopicPattern(String topicPattern) {
    this.topicPattern = topicPattern;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public void setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
  }

  /** Pause before a failed record is redelivered. */
  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(Duration retryBackoff) {
    this.retryBackoff = retryBackoff;
  }
}
