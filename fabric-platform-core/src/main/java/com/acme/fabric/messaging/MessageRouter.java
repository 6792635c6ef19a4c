package com.acme.fabric.messaging;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes inbound messages to the handler registered for their subject. Matching is exact and
 * case-insensitive. Pure POJO - no framework dependencies.
 */
public class MessageRouter implements MessageHandler {
  private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

  private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Register a handler for a subject
   *
   * @throws IllegalStateException if a handler is already registered for this subject
   */
  public void registerHandler(String subject, MessageHandler handler) {
    String key = normalize(subject);
    if (handlers.putIfAbsent(key, handler) != null) {
      String error = "Handler already registered for subject: " + subject;
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registered message handler for subject: {}", subject);
  }

  /**
   * Delegates to the registered handler. Messages for unknown subjects are dropped with a warning
   * so they are acknowledged rather than redelivered forever.
   */
  @Override
  public void handle(String subject, String payload) {
    MessageHandler handler = subject == null ? null : handlers.get(normalize(subject));
    if (handler == null) {
      log.warn("No handler found for subject: {}", subject);
      return;
    }
    log.debug("Routing message on subject: {}", subject);
    handler.handle(subject, payload);
  }

  private static String normalize(String subject) {
    return subject.toLowerCase(Locale.ROOT);
  }
}
