package com.acme.fabric.processor.config;

import com.acme.fabric.config.MessagingConfig;
import com.acme.fabric.config.StoreConfig;
import com.acme.fabric.messaging.MessageRouter;
import com.acme.fabric.processor.inbound.FabricEventHandler;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module remains free of framework dependencies; this module does the DI wiring.
 */
@Factory
public class CoreBeansFactory {

  /** Creates MessagingConfig bean populated from application.yml fabric.messaging.* properties */
  @Singleton
  @ConfigurationProperties("fabric.messaging")
  public MessagingConfig messagingConfig() {
    return new MessagingConfig();
  }

  /** Creates StoreConfig bean populated from application.yml fabric.store.* properties */
  @Singleton
  @ConfigurationProperties("fabric.store")
  public StoreConfig storeConfig() {
    return new StoreConfig();
  }

  /** Creates the MessageRouter with the ERP fabric handler registered for the inbound subject */
  @Singleton
  public MessageRouter messageRouter(
      MessagingConfig messagingConfig, FabricEventHandler fabricEventHandler) {
    MessageRouter router = new MessageRouter();
    router.registerHandler(messagingConfig.getInboundSubject(), fabricEventHandler);
    return router;
  }
}
