package org.devolia.clientregistry.store;

import java.sql.SQLException;

/**
 * Raised when the client store fails. Wraps the driver exception and keeps its SQLState so
 * callers can tell integrity violations from connection failures.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ClientStoreException extends RuntimeException {

  private final String sqlState;

  public ClientStoreException(String message, SQLException cause) {
    super(message, cause);
    this.sqlState = cause != null ? cause.getSQLState() : null;
  }

  public ClientStoreException(String message, Throwable cause) {
    super(message, cause);
    this.sqlState = cause instanceof SQLException sqlException ? sqlException.getSQLState() : null;
  }

  /**
   * Gets the SQLState reported by the driver.
   *
   * @return the SQLState, or null if unknown
   */
  public String getSqlState() {
    return sqlState;
  }
}
