package com.acme.fabric.persistence.jdbc;

import com.acme.fabric.core.PermanentException;
import com.acme.fabric.core.TransientException;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Translates SQLException into the platform's retry classification. Transient failures (lost
 * connections, lock and statement timeouts, serialization failures) may succeed on redelivery;
 * permanent ones (constraint, syntax and data errors) never will.
 */
public final class ExceptionTranslator {

  /** SQLState for a unique constraint violation, shared by PostgreSQL and H2. */
  public static final String UNIQUE_VIOLATION = "23505";

  private static final List<String> TRANSIENT_STATE_PREFIXES = List.of("08", "40", "57P03", "HYT");
  private static final List<String> PERMANENT_STATE_PREFIXES =
      List.of("22", "23", "42", "3D", "3F");

  private static final List<String> TRANSIENT_MESSAGES =
      List.of(
          "timeout",
          "timed out",
          "connection refused",
          "deadlock",
          "too many connections",
          "pool exhausted");
  private static final List<String> PERMANENT_MESSAGES =
      List.of(
          "syntax error",
          "table not found",
          "column not found",
          "does not exist",
          "constraint violation",
          "unique constraint",
          "foreign key",
          "type mismatch");

  // PostgreSQL 40001 serialization failure, 8003/8006 connection failure; H2 50200 lock timeout,
  // 57014 statement cancelled, 90008 invalid value / timeout
  private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(40001, 8003, 8006, 50200, 57014, 90008);
  // H2 42102 table not found, 42122 column not found, 90007 parameter count mismatch
  private static final Set<Integer> PERMANENT_VENDOR_CODES = Set.of(42102, 42122, 90007, 23505, 23503);

  private ExceptionTranslator() {}

  /**
   * Logs the failure and returns the exception to throw in its place.
   *
   * @param exception the SQLException that occurred
   * @param operation short description of the failed operation, used in the message
   * @param logger logger of the calling repository
   * @return TransientException for retryable failures, PermanentException otherwise; unknown
   *     failures are treated as transient
   */
  public static RuntimeException translateException(
      SQLException exception, String operation, Logger logger) {
    logger.error(
        "Database operation failed: {} (sqlState={}, errorCode={})",
        operation,
        exception.getSQLState(),
        exception.getErrorCode(),
        exception);

    String detail = String.format("%s: %s", operation, exception.getMessage());
    if (isTransient(exception)) {
      return new TransientException("Transient database error during " + detail, exception);
    }
    if (isPermanent(exception)) {
      return new PermanentException("Permanent database error during " + detail, exception);
    }
    return new TransientException("Database error during " + detail, exception);
  }

  /** True if the exception, or any exception chained to it, is a unique constraint violation. */
  public static boolean isUniqueViolation(SQLException exception) {
    SQLException current = exception;
    while (current != null) {
      if (UNIQUE_VIOLATION.equals(current.getSQLState())) {
        return true;
      }
      if (current.getCause() instanceof SQLException cause
          && UNIQUE_VIOLATION.equals(cause.getSQLState())) {
        return true;
      }
      current = current.getNextException();
    }
    return false;
  }

  static boolean isTransient(SQLException exception) {
    return matches(
        exception, TRANSIENT_STATE_PREFIXES, TRANSIENT_MESSAGES, TRANSIENT_VENDOR_CODES);
  }

  static boolean isPermanent(SQLException exception) {
    return matches(
        exception, PERMANENT_STATE_PREFIXES, PERMANENT_MESSAGES, PERMANENT_VENDOR_CODES);
  }

  private static boolean matches(
      SQLException exception,
      List<String> statePrefixes,
      List<String> messageFragments,
      Set<Integer> vendorCodes) {
    String sqlState = exception.getSQLState();
    if (sqlState != null && statePrefixes.stream().anyMatch(sqlState::startsWith)) {
      return true;
    }
    String message =
        exception.getMessage() == null ? "" : exception.getMessage().toLowerCase(Locale.ROOT);
    if (messageFragments.stream().anyMatch(message::contains)) {
      return true;
    }
    return exception.getErrorCode() != 0 && vendorCodes.contains(exception.getErrorCode());
  }
}
