package com.acme.fabric.config;

import com.acme.fabric.kafka.KafkaSettings;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);
  private static final String RULE =
      "═══════════════════════════════════════════════════════════════════════════════";

  private final MessagingConfig messagingConfig;
  private final StoreConfig storeConfig;
  private final KafkaSettings kafkaSettings;

  @Property(name = "micronaut.server.port")
  private int serverPort;

  @Property(name = "db.dialect")
  private String dialect;

  @Property(name = "datasources.default.url")
  private String datasourceUrl;

  @Property(name = "datasources.default.username")
  private String datasourceUsername;

  @Property(name = "datasources.default.maximum-pool-size")
  private int maxPoolSize;

  public ConfigurationLogger(
      MessagingConfig messagingConfig, StoreConfig storeConfig, KafkaSettings kafkaSettings) {
    this.messagingConfig = messagingConfig;
    this.storeConfig = storeConfig;
    this.kafkaSettings = kafkaSettings;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    LOG.info(RULE);
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info(RULE);

    LOG.info("━━━ Server ━━━");
    LOG.info("  Port:               {} (REST endpoint listening port)", serverPort);
    LOG.info("");

    LOG.info("━━━ Database ━━━");
    LOG.info("  Dialect:            {} (selects the H2 or PostgreSQL repositories)", dialect);
    LOG.info("  JDBC URL:           {}", datasourceUrl);
    LOG.info("  Username:           {}", datasourceUsername);
    LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
    LOG.info(
        "  Statement Timeout:  {}s (upper bound for every repository statement)",
        storeConfig.getStatementTimeoutSeconds());
    LOG.info("");

    LOG.info("━━━ Messaging ━━━");
    LOG.info("  Kafka Servers:      {}", kafkaSettings.getBootstrapServers());
    LOG.info("  Outbound Topic:     {} (REST-originated fabric events)", messagingConfig.getOutboundTopic());
    LOG.info(
        "  Inbound Listener:   {} (group {}, topics {})",
        kafkaSettings.isConsumerEnabled() ? "ENABLED" : "DISABLED",
        kafkaSettings.getGroupId(),
        kafkaSettings.getTopicPattern());
    LOG.info("  Inbound Subject:    {} (ERP fabric event handler)", messagingConfig.getInboundSubject());
    LOG.info(
        "  Inbound Defaults:   measure_unit={}, offer_status={}",
        messagingConfig.getDefaultMeasureUnit(),
        messagingConfig.getDefaultOfferStatus());
    LOG.info("");

    LOG.info(RULE);
    LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
    LOG.info(RULE);
  }
}
