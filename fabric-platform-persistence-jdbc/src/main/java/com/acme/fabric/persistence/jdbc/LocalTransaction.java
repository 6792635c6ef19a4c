package com.acme.fabric.persistence.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs multi-statement work atomically on one connection. When the connection already belongs to
 * an outer transaction (auto-commit off) the work simply joins it; otherwise a local transaction
 * is opened and committed or rolled back here.
 */
public final class LocalTransaction {

  @FunctionalInterface
  public interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
  }

  private LocalTransaction() {}

  public static <T> T run(Connection conn, SqlWork<T> work) throws SQLException {
    if (!conn.getAutoCommit()) {
      return work.execute(conn);
    }

    conn.setAutoCommit(false);
    try {
      T result = work.execute(conn);
      conn.commit();
      return result;
    } catch (SQLException | RuntimeException e) {
      rollbackQuietly(conn, e);
      throw e;
    } finally {
      conn.setAutoCommit(true);
    }
  }

  private static void rollbackQuietly(Connection conn, Exception original) {
    try {
      conn.rollback();
    } catch (SQLException rollbackFailure) {
      original.addSuppressed(rollbackFailure);
    }
  }
}
