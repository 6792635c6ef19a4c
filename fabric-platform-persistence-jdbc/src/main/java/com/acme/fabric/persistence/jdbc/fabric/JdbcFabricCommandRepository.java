package com.acme.fabric.persistence.jdbc.fabric;

import com.acme.fabric.config.StoreConfig;
import com.acme.fabric.domain.DuplicateFabricCodeException;
import com.acme.fabric.domain.Fabric;
import com.acme.fabric.domain.FabricNotFoundException;
import com.acme.fabric.domain.FabricStatus;
import com.acme.fabric.persistence.jdbc.ExceptionTranslator;
import com.acme.fabric.persistence.jdbc.LocalTransaction;
import com.acme.fabric.persistence.jdbc.mapper.FabricMapper;
import com.acme.fabric.repository.FabricCommandRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of FabricCommandRepository using Template Method pattern.
 * Subclasses override database-specific SQL methods.
 *
 * <p>Every write is a single conditional statement on {@code (code, previous version)}, so a
 * stale writer affects zero rows instead of overwriting a newer version.
 */
public abstract class JdbcFabricCommandRepository implements FabricCommandRepository {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcFabricCommandRepository.class);

  protected final DataSource dataSource;
  protected final StoreConfig storeConfig;

  protected JdbcFabricCommandRepository(DataSource dataSource, StoreConfig storeConfig) {
    this.dataSource = dataSource;
    this.storeConfig = storeConfig;
  }

  @Override
  @Transactional
  public Fabric save(Fabric fabric) {
    try (Connection conn = dataSource.getConnection()) {
      return LocalTransaction.run(conn, c -> saveLocked(c, fabric));
    } catch (SQLException e) {
      if (ExceptionTranslator.isUniqueViolation(e)) {
        LOG.info("Lost creation race for fabric code={}", fabric.getCode());
        throw new DuplicateFabricCodeException(fabric.getCode(), e);
      }
      throw ExceptionTranslator.translateException(e, "save fabric " + fabric.getCode(), LOG);
    }
  }

  private Fabric saveLocked(Connection conn, Fabric fabric) throws SQLException {
    Optional<Fabric> existing = findForUpdate(conn, fabric.getCode());

    if (existing.isEmpty()) {
      insert(conn, fabric);
      LOG.debug("Inserted fabric: code={}, version={}", fabric.getCode(), fabric.getVersion());
      return fabric;
    }

    Fabric current = existing.get();
    if (current.getStatus() == FabricStatus.ACTIVE) {
      throw new DuplicateFabricCodeException(fabric.getCode());
    }

    int previousVersion = current.getVersion();
    current.reactivate(
        fabric.getName(), fabric.getMeasureUnit(), fabric.getOfferStatus(), previousVersion);
    reactivate(conn, current, previousVersion);
    LOG.info(
        "Reactivated deleted fabric: code={}, version {} -> {}",
        current.getCode(),
        previousVersion,
        current.getVersion());
    return current;
  }

  private Optional<Fabric> findForUpdate(Connection conn, String code) throws SQLException {
    try (PreparedStatement ps = prepare(conn, getSelectForUpdateSql())) {
      ps.setString(1, code);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(FabricMapper.toDomain(rs)) : Optional.empty();
      }
    }
  }

  private void insert(Connection conn, Fabric fabric) throws SQLException {
    try (PreparedStatement ps = prepare(conn, getInsertSql())) {
      ps.setString(1, fabric.getCode());
      ps.setString(2, fabric.getName());
      ps.setString(3, fabric.getMeasureUnit());
      ps.setString(4, fabric.getOfferStatus());
      ps.setString(5, fabric.getStatus().name());
      ps.setInt(6, fabric.getVersion());

      if (ps.executeUpdate() == 0) {
        // conflict-ignoring insert: another creator committed first
        throw new DuplicateFabricCodeException(fabric.getCode());
      }
    }
  }

  private void reactivate(Connection conn, Fabric fabric, int previousVersion)
      throws SQLException {
    try (PreparedStatement ps = prepare(conn, getReactivateSql())) {
      ps.setString(1, fabric.getName());
      ps.setString(2, fabric.getMeasureUnit());
      ps.setString(3, fabric.getOfferStatus());
      ps.setInt(4, fabric.getVersion());
      ps.setString(5, fabric.getCode());
      ps.setInt(6, previousVersion);

      if (ps.executeUpdate() == 0) {
        throw new FabricNotFoundException(fabric.getCode());
      }
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Fabric getActive(String code) {
    return findOne(getFindActiveSql(), code, "find active fabric");
  }

  @Override
  @Transactional(readOnly = true)
  public Fabric getIncludingDeleted(String code) {
    return findOne(getFindAnySql(), code, "find fabric including deleted");
  }

  private Fabric findOne(String sql, String code, String operation) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = prepare(conn, sql)) {
      ps.setString(1, code);
      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return FabricMapper.toDomain(rs);
        }
      }
      throw new FabricNotFoundException(code);
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, operation + " " + code, LOG);
    }
  }

  @Override
  @Transactional
  public void update(Fabric fabric) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = prepare(conn, getUpdateSql())) {
      ps.setString(1, fabric.getName());
      ps.setString(2, fabric.getMeasureUnit());
      ps.setString(3, fabric.getOfferStatus());
      ps.setInt(4, fabric.getVersion());
      ps.setString(5, fabric.getCode());
      ps.setInt(6, fabric.getVersion() - 1);

      if (ps.executeUpdate() == 0) {
        LOG.warn(
            "No active fabric matched update: code={}, previousVersion={}",
            fabric.getCode(),
            fabric.getVersion() - 1);
        throw new FabricNotFoundException(fabric.getCode());
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "update fabric " + fabric.getCode(), LOG);
    }
  }

  @Override
  @Transactional
  public void delete(Fabric fabric) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = prepare(conn, getDeleteSql())) {
      ps.setInt(1, fabric.getVersion());
      ps.setString(2, fabric.getCode());
      ps.setInt(3, fabric.getVersion() - 1);

      if (ps.executeUpdate() == 0) {
        LOG.warn(
            "No active fabric matched delete: code={}, previousVersion={}",
            fabric.getCode(),
            fabric.getVersion() - 1);
        throw new FabricNotFoundException(fabric.getCode());
      }
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "delete fabric " + fabric.getCode(), LOG);
    }
  }

  private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    ps.setQueryTimeout(storeConfig.getStatementTimeoutSeconds());
    return ps;
  }

  // Template methods for database-specific SQL

  /** Columns: code, name, measure_unit, offer_status, status, version. Param: code. */
  protected abstract String getSelectForUpdateSql();

  /** Params: code, name, measure_unit, offer_status, status, version. */
  protected abstract String getInsertSql();

  /** Params: name, measure_unit, offer_status, new version, code, previous version. */
  protected abstract String getReactivateSql();

  protected abstract String getFindActiveSql();

  protected abstract String getFindAnySql();

  /** Params: name, measure_unit, offer_status, new version, code, previous version. */
  protected abstract String getUpdateSql();

  /** Params: new version, code, previous version. */
  protected abstract String getDeleteSql();
}
