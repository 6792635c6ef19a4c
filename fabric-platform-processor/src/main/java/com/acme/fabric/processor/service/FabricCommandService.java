package com.acme.fabric.processor.service;

import com.acme.fabric.command.CommandContext;
import com.acme.fabric.config.MessagingConfig;
import com.acme.fabric.domain.ConcurrencyConflictException;
import com.acme.fabric.domain.Fabric;
import com.acme.fabric.domain.FabricEvent;
import com.acme.fabric.domain.FabricNotFoundException;
import com.acme.fabric.event.EnvelopeOptions;
import com.acme.fabric.event.EventEnvelope;
import com.acme.fabric.repository.EventStore;
import com.acme.fabric.repository.FabricCommandRepository;
import com.acme.fabric.repository.StoredEvent;
import com.acme.fabric.spi.EventPublisher;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.util.List;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Orchestrates fabric commands for both ingress paths.
 *
 * <p>Each mutation applies the aggregate operation in memory, persists the new state, then records
 * one envelope per emitted event. State write and event append share one transaction, so either
 * both are durable or neither is. Envelopes of REST-originated commands are published to the
 * outbound topic after commit; publish failures are logged only.
 */
@Slf4j
@Singleton
@RequiredArgsConstructor
public class FabricCommandService {

  public static final String AGGREGATE_TYPE = "Fabric";

  private final FabricCommandRepository repository;
  private final EventStore eventStore;
  private final EventPublisher eventPublisher;
  private final TransactionOperations<Connection> transactionOps;
  private final MessagingConfig messagingConfig;

  public Fabric createFabric(
      CommandContext context, String code, String name, String measureUnit, String offerStatus) {
    Fabric fabric = Fabric.create(code, name, measureUnit, offerStatus);
    Result result = execute(context, () -> repository.save(fabric));
    log.info(
        "Fabric created: code={}, version={}, source={}",
        code,
        result.fabric().getVersion(),
        context.source());
    return result.fabric();
  }

  public Fabric updateFabric(
      CommandContext context,
      String code,
      String name,
      String measureUnit,
      String offerStatus,
      int expectedVersion) {
    Result result =
        execute(
            context,
            () -> {
              Fabric fabric = repository.getActive(code);
              fabric.update(name, measureUnit, offerStatus, expectedVersion);
              conditionalWrite(fabric, repository::update);
              return fabric;
            });
    log.info(
        "Fabric updated: code={}, version={}, source={}",
        code,
        result.fabric().getVersion(),
        context.source());
    return result.fabric();
  }

  public Fabric deleteFabric(CommandContext context, String code, int expectedVersion) {
    Result result =
        execute(
            context,
            () -> {
              Fabric fabric = repository.getActive(code);
              fabric.delete(expectedVersion);
              conditionalWrite(fabric, repository::delete);
              return fabric;
            });
    log.info(
        "Fabric deleted: code={}, version={}, source={}",
        code,
        result.fabric().getVersion(),
        context.source());
    return result.fabric();
  }

  public Fabric getByCode(String code) {
    return transactionOps.executeRead(status -> repository.getActive(code));
  }

  public Fabric getByCodeIncludingDeleted(String code) {
    return transactionOps.executeRead(status -> repository.getIncludingDeleted(code));
  }

  /**
   * Recorded history of a fabric, oldest first. Deleted fabrics keep their history.
   *
   * @throws FabricNotFoundException if no fabric with this code was ever created
   */
  public List<StoredEvent> getHistory(String code) {
    return transactionOps.executeRead(
        status -> {
          repository.getIncludingDeleted(code);
          return eventStore.findByAggregateId(code);
        });
  }

  private Result execute(CommandContext context, Mutation mutation) {
    Result result =
        transactionOps.executeWrite(
            status -> {
              Fabric fabric = mutation.apply();
              List<EventEnvelope<FabricEvent>> envelopes =
                  toEnvelopes(fabric.drainEvents(), context.envelopeOptions());
              eventStore.append(envelopes);
              return new Result(fabric, envelopes);
            });

    if (context.isFromRest()) {
      result.envelopes().forEach(this::publishQuietly);
    }
    return result;
  }

  /**
   * The row was read as ACTIVE at the previous version inside this transaction, so a conditional
   * write that matches nothing means another writer moved it in between.
   */
  private static void conditionalWrite(Fabric fabric, Consumer<Fabric> write) {
    try {
      write.accept(fabric);
    } catch (FabricNotFoundException e) {
      throw new ConcurrencyConflictException(
          String.format(
              "fabric %s changed before version %d could be written",
              fabric.getCode(), fabric.getVersion()),
          e);
    }
  }

  private static List<EventEnvelope<FabricEvent>> toEnvelopes(
      List<FabricEvent> events, EnvelopeOptions options) {
    return events.stream()
        .map(
            event ->
                EventEnvelope.of(
                    event.kind().eventType(),
                    event.code(),
                    AGGREGATE_TYPE,
                    event.version(),
                    event,
                    options))
        .toList();
  }

  private void publishQuietly(EventEnvelope<FabricEvent> envelope) {
    try {
      eventPublisher.publish(messagingConfig.getOutboundTopic(), envelope);
    } catch (RuntimeException e) {
      log.error(
          "Failed to publish {} for fabric {} v{}; event is recorded in the event store",
          envelope.eventType(),
          envelope.aggregateId(),
          envelope.aggregateVersion(),
          e);
    }
  }

  @FunctionalInterface
  private interface Mutation {
    Fabric apply();
  }

  private record Result(Fabric fabric, List<EventEnvelope<FabricEvent>> envelopes) {}
}
