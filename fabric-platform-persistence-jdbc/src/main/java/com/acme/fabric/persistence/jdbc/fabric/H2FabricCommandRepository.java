package com.acme.fabric.persistence.jdbc.fabric;

import com.acme.fabric.config.StoreConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific implementation of FabricCommandRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2FabricCommandRepository extends JdbcFabricCommandRepository {

  private static final String COLUMNS = "code, name, measure_unit, offer_status, status, version";

  public H2FabricCommandRepository(DataSource dataSource, StoreConfig storeConfig) {
    super(dataSource, storeConfig);
  }

  @Override
  protected String getSelectForUpdateSql() {
    return "SELECT " + COLUMNS + " FROM fabrics WHERE code = ? FOR UPDATE";
  }

  /** Plain insert; a concurrent creator surfaces as a 23505 unique violation. */
  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO fabrics (code, name, measure_unit, offer_status, status, version, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """;
  }

  @Override
  protected String getReactivateSql() {
    return """
        UPDATE fabrics
        SET name = ?, measure_unit = ?, offer_status = ?, status = 'ACTIVE', version = ?,
            updated_at = CURRENT_TIMESTAMP
        WHERE code = ? AND version = ? AND status = 'DELETED'
        """;
  }

  @Override
  protected String getFindActiveSql() {
    return "SELECT " + COLUMNS + " FROM fabrics WHERE code = ? AND status = 'ACTIVE'";
  }

  @Override
  protected String getFindAnySql() {
    return "SELECT " + COLUMNS + " FROM fabrics WHERE code = ?";
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE fabrics
        SET name = ?, measure_unit = ?, offer_status = ?, version = ?, updated_at = CURRENT_TIMESTAMP
        WHERE code = ? AND version = ? AND status = 'ACTIVE'
        """;
  }

  @Override
  protected String getDeleteSql() {
    return """
        UPDATE fabrics
        SET status = 'DELETED', version = ?, updated_at = CURRENT_TIMESTAMP
        WHERE code = ? AND version = ? AND status = 'ACTIVE'
        """;
  }
}
