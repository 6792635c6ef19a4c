package com.acme.fabric.messaging;

/**
 * Consumer of raw inbound messages. Returning normally acknowledges the message; throwing asks the
 * transport to redeliver it.
 */
@FunctionalInterface
public interface MessageHandler {
  void handle(String subject, String payload);
}
