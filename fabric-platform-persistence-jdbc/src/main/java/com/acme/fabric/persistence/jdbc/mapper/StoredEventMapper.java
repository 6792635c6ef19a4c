package com.acme.fabric.persistence.jdbc.mapper;

import com.acme.fabric.repository.StoredEvent;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.UUID;

/** Maps an {@code events} row to a {@link StoredEvent}. */
public final class StoredEventMapper {

  private StoredEventMapper() {}

  public static StoredEvent toStoredEvent(ResultSet rs) throws SQLException {
    OffsetDateTime timestamp = rs.getObject("timestamp", OffsetDateTime.class);
    return new StoredEvent(
        rs.getObject("event_id", UUID.class),
        rs.getString("aggregate_id"),
        rs.getString("aggregate_type"),
        rs.getString("event_type"),
        rs.getInt("aggregate_version"),
        rs.getInt("event_version"),
        rs.getString("payload"),
        timestamp == null ? null : timestamp.toInstant(),
        rs.getString("correlation_id"),
        rs.getString("causation_id"),
        rs.getString("user_id"));
  }
}
