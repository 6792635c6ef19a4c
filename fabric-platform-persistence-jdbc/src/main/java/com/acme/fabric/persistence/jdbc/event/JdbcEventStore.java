package com.acme.fabric.persistence.jdbc.event;

import com.acme.fabric.config.StoreConfig;
import com.acme.fabric.core.Jsons;
import com.acme.fabric.domain.ConcurrencyConflictException;
import com.acme.fabric.event.EventEnvelope;
import com.acme.fabric.persistence.jdbc.ExceptionTranslator;
import com.acme.fabric.persistence.jdbc.LocalTransaction;
import com.acme.fabric.persistence.jdbc.mapper.StoredEventMapper;
import com.acme.fabric.repository.EventStore;
import com.acme.fabric.repository.StoredEvent;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of EventStore using Template Method pattern. Subclasses supply the
 * dialect-specific SQL, mainly how the JSON payload column is written.
 */
public abstract class JdbcEventStore implements EventStore {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcEventStore.class);

  protected final DataSource dataSource;
  protected final StoreConfig storeConfig;

  protected JdbcEventStore(DataSource dataSource, StoreConfig storeConfig) {
    this.dataSource = dataSource;
    this.storeConfig = storeConfig;
  }

  @Override
  @Transactional
  public void append(List<? extends EventEnvelope<?>> envelopes) {
    if (envelopes.isEmpty()) {
      return;
    }
    envelopes.forEach(EventEnvelope::validate);

    try (Connection conn = dataSource.getConnection()) {
      LocalTransaction.run(conn, c -> insertBatch(c, envelopes));
      LOG.debug(
          "Appended {} event(s) for aggregate {}", envelopes.size(), envelopes.get(0).aggregateId());
    } catch (SQLException e) {
      if (ExceptionTranslator.isUniqueViolation(e)) {
        EventEnvelope<?> first = envelopes.get(0);
        LOG.warn(
            "Event already recorded for aggregate {} near version {}",
            first.aggregateId(),
            first.aggregateVersion());
        throw new ConcurrencyConflictException(
            String.format(
                "an event for aggregate %s version %d is already recorded",
                first.aggregateId(), first.aggregateVersion()),
            e);
      }
      throw ExceptionTranslator.translateException(e, "append events", LOG);
    }
  }

  private int[] insertBatch(Connection conn, List<? extends EventEnvelope<?>> envelopes)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(getInsertSql())) {
      ps.setQueryTimeout(storeConfig.getStatementTimeoutSeconds());
      for (EventEnvelope<?> envelope : envelopes) {
        ps.setObject(1, UUID.fromString(envelope.eventId()));
        ps.setString(2, envelope.aggregateId());
        ps.setString(3, envelope.aggregateType());
        ps.setString(4, envelope.eventType());
        ps.setInt(5, envelope.aggregateVersion());
        ps.setInt(6, envelope.eventVersion());
        ps.setString(7, Jsons.toJson(envelope.payload()));
        ps.setObject(8, OffsetDateTime.ofInstant(envelope.timestamp(), ZoneOffset.UTC));
        ps.setString(9, emptyToNull(envelope.correlationId()));
        ps.setString(10, emptyToNull(envelope.causationId()));
        ps.setString(11, emptyToNull(envelope.userId()));
        ps.addBatch();
      }
      return ps.executeBatch();
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<StoredEvent> findByAggregateId(String aggregateId) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(getFindByAggregateIdSql())) {
      ps.setQueryTimeout(storeConfig.getStatementTimeoutSeconds());
      ps.setString(1, aggregateId);

      List<StoredEvent> events = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          events.add(StoredEventMapper.toStoredEvent(rs));
        }
      }
      return events;
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find events for " + aggregateId, LOG);
    }
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  // Template methods for database-specific SQL

  /**
   * Params: event_id, aggregate_id, aggregate_type, event_type, aggregate_version, event_version,
   * payload (JSON text), timestamp, correlation_id, causation_id, user_id.
   */
  protected abstract String getInsertSql();

  /** Param: aggregate_id. Rows ordered by aggregate_version ascending. */
  protected abstract String getFindByAggregateIdSql();
}
