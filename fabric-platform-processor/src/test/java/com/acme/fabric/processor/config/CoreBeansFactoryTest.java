package com.acme.fabric.processor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.acme.fabric.config.MessagingConfig;
import com.acme.fabric.messaging.MessageRouter;
import com.acme.fabric.processor.inbound.FabricEventHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CoreBeansFactoryTest {

  private final CoreBeansFactory factory = new CoreBeansFactory();

  @Test
  @DisplayName("config beans should start from their defaults")
  void testConfigDefaults() {
    assertThat(factory.messagingConfig().getOutboundTopic()).isEqualTo("app.fabric");
    assertThat(factory.storeConfig().getStatementTimeoutSeconds()).isEqualTo(5);
  }

  @Test
  @DisplayName("router should deliver the inbound subject to the ERP fabric handler")
  void testRouterWiring() {
    MessagingConfig messagingConfig = new MessagingConfig();
    FabricEventHandler handler = mock(FabricEventHandler.class);

    MessageRouter router = factory.messageRouter(messagingConfig, handler);
    router.handle("ERP.FABRIC", "{}");

    verify(handler).handle("ERP.FABRIC", "{}");
  }
}
