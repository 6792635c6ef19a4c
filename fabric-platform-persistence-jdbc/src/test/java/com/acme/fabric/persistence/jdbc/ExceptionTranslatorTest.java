package com.acme.fabric.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.fabric.core.PermanentException;
import com.acme.fabric.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ExceptionTranslatorTest {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  @Nested
  @DisplayName("Transient Error Detection")
  class TransientErrorTests {

    @ParameterizedTest(name = "{0} / {1}")
    @CsvSource({
      "Connection refused to host, 08001",
      "Deadlock detected, 40P01",
      "could not serialize access, 40001",
      "the database system is starting up, 57P03"
    })
    @DisplayName("should return TransientException for retryable SQL states")
    void testTransientStates(String message, String sqlState) {
      // Given
      SQLException cause = new SQLException(message, sqlState);

      // When
      RuntimeException result = ExceptionTranslator.translateException(cause, "update", logger);

      // Then
      assertThat(result).isInstanceOf(TransientException.class).hasCause(cause);
    }

    @Test
    @DisplayName("should detect lock timeout from the message alone")
    void testLockTimeoutMessage() {
      SQLException cause = new SQLException("Lock wait timeout exceeded");

      RuntimeException result = ExceptionTranslator.translateException(cause, "insert", logger);

      assertThat(result).isInstanceOf(TransientException.class);
      assertThat(result.getMessage()).contains("insert").contains("Lock wait timeout exceeded");
    }

    @Test
    @DisplayName("should default unknown failures to transient")
    void testUnknownDefaultsToTransient() {
      SQLException cause = new SQLException("something odd happened", "XX999");

      RuntimeException result = ExceptionTranslator.translateException(cause, "select", logger);

      assertThat(result).isInstanceOf(TransientException.class);
      assertThat(result.getMessage()).startsWith("Database error during select");
    }
  }

  @Nested
  @DisplayName("Permanent Error Detection")
  class PermanentErrorTests {

    @ParameterizedTest(name = "{0} / {1}")
    @CsvSource({
      "duplicate key value, 23505",
      "invalid input syntax, 22P02",
      "relation fabrics does not exist, 42P01",
      "null value in column, 23502"
    })
    @DisplayName("should return PermanentException for constraint, data and syntax errors")
    void testPermanentStates(String message, String sqlState) {
      SQLException cause = new SQLException(message, sqlState);

      RuntimeException result = ExceptionTranslator.translateException(cause, "insert", logger);

      assertThat(result).isInstanceOf(PermanentException.class).hasCause(cause);
    }

    @Test
    @DisplayName("should detect H2 table-not-found by vendor code")
    void testH2VendorCode() {
      SQLException cause = new SQLException("missing", null, 42102);

      assertThat(ExceptionTranslator.isPermanent(cause)).isTrue();
      assertThat(ExceptionTranslator.isTransient(cause)).isFalse();
    }
  }

  @Nested
  @DisplayName("Unique Violation Detection")
  class UniqueViolationTests {

    @Test
    @DisplayName("should recognise 23505 on the top-level exception")
    void testDirect() {
      assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("dup", "23505"))).isTrue();
    }

    @Test
    @DisplayName("should recognise 23505 on a chained batch exception")
    void testChained() {
      SQLException batch = new SQLException("batch failed", "XX000");
      batch.setNextException(new SQLException("dup", "23505"));

      assertThat(ExceptionTranslator.isUniqueViolation(batch)).isTrue();
    }

    @Test
    @DisplayName("should recognise 23505 on the cause")
    void testCause() {
      SQLException wrapper = new SQLException("wrapper", "XX000", new SQLException("dup", "23505"));

      assertThat(ExceptionTranslator.isUniqueViolation(wrapper)).isTrue();
    }

    @Test
    @DisplayName("should reject other SQL states")
    void testOther() {
      assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("fk", "23503"))).isFalse();
    }
  }
}
