package com.acme.fabric.processor.inbound;

import com.acme.fabric.command.CommandContext;
import com.acme.fabric.config.MessagingConfig;
import com.acme.fabric.core.Jsons;
import com.acme.fabric.domain.ConcurrencyConflictException;
import com.acme.fabric.domain.DuplicateFabricCodeException;
import com.acme.fabric.domain.FabricAlreadyDeletedException;
import com.acme.fabric.domain.FabricNotFoundException;
import com.acme.fabric.domain.FabricValidationException;
import com.acme.fabric.event.EventEnvelope;
import com.acme.fabric.event.InvalidEnvelopeException;
import com.acme.fabric.messaging.MessageHandler;
import com.acme.fabric.processor.service.FabricCommandService;
import com.acme.fabric.processor.validation.FabricInputValidator;
import com.acme.fabric.processor.validation.FieldErrors;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates ERP fabric events into fabric commands.
 *
 * <p>Returns normally for every message that must not be redelivered: malformed or invalid input,
 * unknown event types, duplicates and out-of-order versions. Only infrastructure failures
 * propagate, so the transport retries them.
 */
@Slf4j
@Singleton
@RequiredArgsConstructor
public class FabricEventHandler implements MessageHandler {

  public static final String CREATED = "erp.fabric.created";
  public static final String UPDATED = "erp.fabric.updated";
  public static final String DELETED = "erp.fabric.deleted";

  private static final TypeReference<EventEnvelope<ErpFabricEvent>> ENVELOPE_TYPE =
      new TypeReference<>() {};

  private final FabricCommandService commandService;
  private final MessagingConfig messagingConfig;

  @Override
  public void handle(String subject, String payload) {
    if (payload == null || payload.isBlank()) {
      log.error("Dropping empty ERP event on {}", subject);
      return;
    }
    EventEnvelope<ErpFabricEvent> envelope;
    try {
      envelope = Jsons.fromJson(payload, ENVELOPE_TYPE);
      envelope.validate();
    } catch (Jsons.MalformedJsonException | InvalidEnvelopeException e) {
      log.error("Dropping unreadable ERP event on {}: {}", subject, e.getMessage());
      return;
    }

    CommandContext context = CommandContext.event(envelope.correlationId(), envelope.eventId());
    ErpFabricEvent event = envelope.payload();

    switch (envelope.eventType()) {
      case CREATED -> onCreated(context, event, envelope.eventId());
      case UPDATED -> onUpdated(context, event, envelope.eventId(), envelope.aggregateVersion());
      case DELETED -> onDeleted(context, event, envelope.eventId(), envelope.aggregateVersion());
      default -> log.warn(
          "Discarding unknown ERP event type {} (event_id={})",
          envelope.eventType(),
          envelope.eventId());
    }
  }

  private void onCreated(CommandContext context, ErpFabricEvent raw, String eventId) {
    ErpFabricEvent event = withDefaults(raw);
    FieldErrors errors = FabricInputValidator.validateCreate(event.code(), event.name());
    if (!errors.isValid()) {
      log.error("Invalid fabric data from ERP event {}: {}", eventId, errors);
      return;
    }

    try {
      commandService.createFabric(
          context, event.code(), event.name(), event.measureUnit(), event.offerStatus());
      log.info("Fabric created from event: code={}, event_id={}", event.code(), eventId);
    } catch (DuplicateFabricCodeException e) {
      log.info("Fabric already exists, skipping: code={}, event_id={}", event.code(), eventId);
    } catch (FabricValidationException e) {
      log.error(
          "Invalid fabric data from ERP: code={}, event_id={}: {}",
          event.code(),
          eventId,
          e.getMessage());
    }
  }

  private void onUpdated(
      CommandContext context, ErpFabricEvent raw, String eventId, int externalVersion) {
    ErpFabricEvent event = withDefaults(raw);
    FieldErrors errors = FabricInputValidator.validateUpdate(externalVersion, event.name());
    if (!errors.isValid()) {
      log.error("Invalid fabric data from ERP event {}: {}", eventId, errors);
      return;
    }

    // the ERP version is the one the change produces
    int expectedVersion = externalVersion - 1;
    try {
      commandService.updateFabric(
          context,
          event.code(),
          event.name(),
          event.measureUnit(),
          event.offerStatus(),
          expectedVersion);
      log.info(
          "Fabric updated from event: code={}, version={}, event_id={}",
          event.code(),
          externalVersion,
          eventId);
    } catch (FabricNotFoundException e) {
      log.warn(
          "Fabric not found for update, might need to create first: code={}, event_id={}",
          event.code(),
          eventId);
    } catch (ConcurrencyConflictException e) {
      log.warn(
          "Version conflict, event might be out of order: code={}, version={}, event_id={}",
          event.code(),
          externalVersion,
          eventId);
    } catch (FabricValidationException | FabricAlreadyDeletedException e) {
      log.error(
          "Rejected ERP update: code={}, event_id={}: {}", event.code(), eventId, e.getMessage());
    }
  }

  private void onDeleted(
      CommandContext context, ErpFabricEvent event, String eventId, int externalVersion) {
    FieldErrors errors = FabricInputValidator.validateDelete(externalVersion);
    if (!errors.isValid()) {
      log.error("Invalid fabric data from ERP event {}: {}", eventId, errors);
      return;
    }

    try {
      commandService.deleteFabric(context, event.code(), externalVersion - 1);
      log.info(
          "Fabric deleted from event: code={}, version={}, event_id={}",
          event.code(),
          externalVersion,
          eventId);
    } catch (FabricNotFoundException e) {
      log.info("Fabric already deleted or not found: code={}, event_id={}", event.code(), eventId);
    } catch (ConcurrencyConflictException e) {
      log.warn(
          "Version conflict on delete: code={}, version={}, event_id={}",
          event.code(),
          externalVersion,
          eventId);
    } catch (FabricAlreadyDeletedException e) {
      log.error(
          "Rejected ERP delete: code={}, event_id={}: {}", event.code(), eventId, e.getMessage());
    }
  }

  private ErpFabricEvent withDefaults(ErpFabricEvent event) {
    return event.withDefaults(
        messagingConfig.getDefaultMeasureUnit(), messagingConfig.getDefaultOfferStatus());
  }
}
