package com.acme.wizard.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.wizard.core.PermanentException;
import com.acme.wizard.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tests translation of SQLException to PermanentException or TransientException.
 */
class ExceptionTranslatorTest {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  @Nested
  @DisplayName("Transient Error Detection")
  class TransientErrorTests {

    @Test
    @DisplayName("should return TransientException for a connection timeout")
    void testConnectionTimeout() {
      // Given
      SQLException cause = new SQLException("Connection timeout", "08001");

      // When
      RuntimeException result = ExceptionTranslator.translateException(cause, "save draft", logger);

      // Then
      assertThat(result).isInstanceOf(TransientException.class);
      assertThat(result.getMessage()).contains("save draft").containsIgnoringCase("connection timeout");
      assertThat(result.getCause()).isSameAs(cause);
    }

    @Test
    @DisplayName("should return TransientException for a deadlock")
    void testDeadlock() {
      SQLException cause = new SQLException("Deadlock detected", "40P01");

      assertThat(ExceptionTranslator.translateException(cause, "save draft", logger))
          .isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("should return TransientException for H2 lock timeout error code")
    void testLockTimeoutCode() {
      SQLException cause = new SQLException("Timeout trying to lock table", "HYT00", 50200);

      assertThat(ExceptionTranslator.translateException(cause, "save draft", logger))
          .isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("should default to TransientException when nothing matches")
    void testUnclassified() {
      SQLException cause = new SQLException("Something odd happened", "HY000");

      RuntimeException result = ExceptionTranslator.translateException(cause, "load draft", logger);

      assertThat(result).isInstanceOf(TransientException.class);
      assertThat(result.getMessage()).startsWith("Database error during load draft");
    }

    @Test
    @DisplayName("should handle a null message")
    void testNullMessage() {
      SQLException cause = new SQLException((String) null);

      assertThat(ExceptionTranslator.translateException(cause, "load draft", logger))
          .isInstanceOf(TransientException.class);
    }
  }

  @Nested
  @DisplayName("Permanent Error Detection")
  class PermanentErrorTests {

    @Test
    @DisplayName("should return PermanentException for a missing table")
    void testTableNotFound() {
      // Given
      SQLException cause = new SQLException("Table \"WIZARD_DRAFT\" not found", "42S02", 42102);

      // When
      RuntimeException result = ExceptionTranslator.translateException(cause, "load draft", logger);

      // Then
      assertThat(result).isInstanceOf(PermanentException.class);
      assertThat(result.getMessage()).startsWith("Permanent database error during load draft");
    }

    @Test
    @DisplayName("should return PermanentException for a unique constraint violation")
    void testUniqueViolation() {
      SQLException cause = new SQLException("duplicate key value violates unique constraint", "23505");

      assertThat(ExceptionTranslator.translateException(cause, "save draft", logger))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("should return PermanentException for invalid data by SQL state only")
    void testDataExceptionState() {
      SQLException cause = new SQLException("bad input", "22001");

      assertThat(ExceptionTranslator.translateException(cause, "save draft", logger))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("should prefer transient when both categories match")
    void testTransientWins() {
      SQLException cause = new SQLException("Lock timeout on table not found", "42000");

      assertThat(ExceptionTranslator.translateException(cause, "save draft", logger))
          .isInstanceOf(TransientException.class);
    }
  }
}
