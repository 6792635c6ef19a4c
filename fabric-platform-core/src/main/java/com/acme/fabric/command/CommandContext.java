package com.acme.fabric.command;

import com.acme.fabric.event.EnvelopeOptions;

/**
 * Describes one command invocation: where it came from and the tracing ids to stamp on the events
 * it produces. Passed explicitly to every command service call.
 */
public record CommandContext(
    CommandSource source, String correlationId, String causationId, String userId) {

  public CommandContext {
    if (source == null) {
      throw new IllegalArgumentException("Command source cannot be null");
    }
  }

  public static CommandContext rest(String correlationId, String userId) {
    return new CommandContext(CommandSource.REST, correlationId, null, userId);
  }

  /**
   * Context for a command derived from an inbound event. The inbound event id becomes the
   * causation id of every event this command records.
   */
  public static CommandContext event(String correlationId, String causationId) {
    return new CommandContext(CommandSource.EVENT, correlationId, causationId, null);
  }

  public boolean isFromRest() {
    return source == CommandSource.REST;
  }

  public EnvelopeOptions envelopeOptions() {
    return new EnvelopeOptions(correlationId, causationId, userId);
  }
}
