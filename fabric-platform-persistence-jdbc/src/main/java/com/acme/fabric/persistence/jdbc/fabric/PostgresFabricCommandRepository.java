package com.acme.fabric.persistence.jdbc.fabric;

import com.acme.fabric.config.StoreConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of FabricCommandRepository. The insert ignores code
 * conflicts instead of raising them, so a lost creation race does not abort the surrounding
 * transaction.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresFabricCommandRepository extends JdbcFabricCommandRepository {

  public PostgresFabricCommandRepository(DataSource dataSource, StoreConfig storeConfig) {
    super(dataSource, storeConfig);
  }

  @Override
  protected String getSelectForUpdateSql() {
    return """
        SELECT code, name, measure_unit, offer_status, status, version
        FROM fabrics
        WHERE code = ?
        FOR UPDATE
        """;
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO fabrics (code, name, measure_unit, offer_status, status, version, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, now(), now())
        ON CONFLICT (code) DO NOTHING
        """;
  }

  @Override
  protected String getReactivateSql() {
    return """
        UPDATE fabrics
        SET name = ?, measure_unit = ?, offer_status = ?, status = 'ACTIVE', version = ?,
            updated_at = now()
        WHERE code = ? AND version = ? AND status = 'DELETED'
        """;
  }

  @Override
  protected String getFindActiveSql() {
    return """
        SELECT code, name, measure_unit, offer_status, status, version
        FROM fabrics
        WHERE code = ? AND status = 'ACTIVE'
        """;
  }

  @Override
  protected String getFindAnySql() {
    return """
        SELECT code, name, measure_unit, offer_status, status, version
        FROM fabrics
        WHERE code = ?
        """;
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE fabrics
        SET name = ?, measure_unit = ?, offer_status = ?, version = ?, updated_at = now()
        WHERE code = ? AND version = ? AND status = 'ACTIVE'
        """;
  }

  @Override
  protected String getDeleteSql() {
    return """
        UPDATE fabrics
        SET status = 'DELETED', version = ?, updated_at = now()
        WHERE code = ? AND version = ? AND status = 'ACTIVE'
        """;
  }
}
