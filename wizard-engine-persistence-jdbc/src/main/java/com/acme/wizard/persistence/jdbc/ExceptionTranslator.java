package com.acme.wizard.persistence.jdbc;

import com.acme.wizard.core.PermanentException;
import com.acme.wizard.core.TransientException;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Translates SQLException into the engine's retry categories. Anything that cannot be classified
 * is treated as transient, so a failed draft save can simply be attempted again.
 */
public final class ExceptionTranslator {

  private static final List<String> TRANSIENT_MESSAGES =
      List.of(
          "timeout",
          "connection refused",
          "connection reset",
          "deadlock",
          "too many connections",
          "pool exhausted");

  private static final List<String> PERMANENT_MESSAGES =
      List.of(
          "syntax error",
          "not found",
          "does not exist",
          "constraint violation",
          "unique constraint",
          "duplicate key",
          "foreign key",
          "type mismatch",
          "invalid column",
          "value too long");

  // 08 connection, 40 transaction rollback, 53 insufficient resources, 57P admin shutdown
  private static final List<String> TRANSIENT_STATE_PREFIXES = List.of("08", "40", "53", "57P");

  // 22 data, 23 integrity, 42 syntax or access, 3D catalog, 3F schema
  private static final List<String> PERMANENT_STATE_PREFIXES =
      List.of("22", "23", "42", "3D", "3F");

  // H2: 90002 table not found, 90007 parameter count, 42122 column not found, 23505 unique index
  private static final Set<Integer> PERMANENT_VENDOR_CODES = Set.of(90002, 90007, 42122, 23505);

  // H2: 50200 lock timeout; 40001 serialization failure
  private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(50200, 40001);

  private ExceptionTranslator() {
  }

  /**
   * @param operation what was attempted, used in the message, e.g. "save draft"
   * @return TransientException or PermanentException carrying the original as cause
   */
  public static RuntimeException translateException(
      SQLException exception, String operation, Logger logger) {
    logger.error("Database operation failed: {}", operation, exception);

    String detail = exception.getMessage();
    if (isTransient(exception)) {
      return new TransientException(
          String.format("Transient database error during %s: %s", operation, detail), exception);
    }
    if (isPermanent(exception)) {
      return new PermanentException(
          String.format("Permanent database error during %s: %s", operation, detail), exception);
    }
    return new TransientException(
        String.format("Database error during %s: %s", operation, detail), exception);
  }

  static boolean isTransient(SQLException exception) {
    return containsAny(message(exception), TRANSIENT_MESSAGES)
        || startsWithAny(exception.getSQLState(), TRANSIENT_STATE_PREFIXES)
        || TRANSIENT_VENDOR_CODES.contains(exception.getErrorCode());
  }

  static boolean isPermanent(SQLException exception) {
    return containsAny(message(exception), PERMANENT_MESSAGES)
        || startsWithAny(exception.getSQLState(), PERMANENT_STATE_PREFIXES)
        || PERMANENT_VENDOR_CODES.contains(exception.getErrorCode());
  }

  private static String message(SQLException exception) {
    String message = exception.getMessage();
    return message == null ? "" : message.toLowerCase(Locale.ROOT);
  }

  private static boolean containsAny(String message, List<String> fragments) {
    return fragments.stream().anyMatch(message::contains);
  }

  private static boolean startsWithAny(String sqlState, List<String> prefixes) {
    return sqlState != null && prefixes.stream().anyMatch(sqlState::startsWith);
  }
}
