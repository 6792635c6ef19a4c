package com.acme.fabric.persistence.jdbc.event;

import com.acme.fabric.config.StoreConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** PostgreSQL-specific implementation of EventStore. The payload column is JSONB. */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresEventStore extends JdbcEventStore {

  public PostgresEventStore(DataSource dataSource, StoreConfig storeConfig) {
    super(dataSource, storeConfig);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO events (event_id, aggregate_id, aggregate_type, event_type, aggregate_version,
                            event_version, payload, "timestamp", correlation_id, causation_id, user_id)
        VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getFindByAggregateIdSql() {
    return """
        SELECT event_id, aggregate_id, aggregate_type, event_type, aggregate_version, event_version,
               payload::text AS payload, "timestamp", correlation_id, causation_id, user_id
        FROM events
        WHERE aggregate_id = ?
        ORDER BY aggregate_version
        """;
  }
}
