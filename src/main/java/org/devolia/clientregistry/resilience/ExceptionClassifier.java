package org.devolia.clientregistry.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.net.SocketTimeoutException;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import org.devolia.clientregistry.store.ClientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for classifying client store failures.
 *
 * <p>This class decides whether a failure:
 *
 * <ul>
 *   <li>is a uniqueness violation (a duplicate registration that lost a race)
 *   <li>is a data exception (a value the schema rejects, such as an over-long string)
 *   <li>should count against the circuit breaker (the database is unhealthy)
 *   <li>is transient (connection lost, pool exhausted, timeout)
 * </ul>
 *
 * <p>Classification uses the standard SQLState classes: {@code 22} data exception, {@code 23}
 * integrity constraint violation, {@code 08} connection exception, {@code 40} transaction
 * rollback, {@code 57} and {@code HYT00} for timeouts and cancellations.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ExceptionClassifier {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionClassifier.class);

  private static final String CLASS_DATA_EXCEPTION = "22";
  private static final String CLASS_INTEGRITY_VIOLATION = "23";
  private static final String CLASS_CONNECTION = "08";
  private static final String CLASS_TRANSACTION_ROLLBACK = "40";
  private static final String CLASS_OPERATOR_INTERVENTION = "57";
  private static final String STATE_TIMEOUT = "HYT00";

  private ExceptionClassifier() {}

  /**
   * Determines if a failure is an integrity constraint violation, such as a duplicate primary
   * key.
   *
   * @param exception the exception to classify
   * @return true if the store rejected the write for violating a constraint
   */
  public static boolean isUniqueViolation(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (exception instanceof SQLIntegrityConstraintViolationException) {
      return true;
    }

    String sqlState = sqlStateOf(exception);
    if (sqlState != null && sqlState.startsWith(CLASS_INTEGRITY_VIOLATION)) {
      logger.debug("Classified as integrity violation: SQLState {}", sqlState);
      return true;
    }

    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return isUniqueViolation(cause);
    }
    return false;
  }

  /**
   * Determines if a failure is a data exception: the store rejected a value, for example a string
   * longer than its column.
   *
   * @param exception the exception to classify
   * @return true if the store rejected the value itself
   */
  public static boolean isDataException(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (exception instanceof SQLDataException) {
      return true;
    }

    String sqlState = sqlStateOf(exception);
    if (sqlState != null && sqlState.startsWith(CLASS_DATA_EXCEPTION)) {
      logger.debug("Classified as data exception: SQLState {}", sqlState);
      return true;
    }

    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return isDataException(cause);
    }
    return false;
  }

  /**
   * Determines if a failure is transient: the same call may succeed later without any change.
   *
   * @param exception the exception to classify
   * @return true if the failure is transient
   */
  public static boolean isTransientFailure(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (exception instanceof SQLTransientConnectionException
        || exception instanceof SQLTimeoutException
        || exception instanceof SocketTimeoutException) {
      logger.debug("Classified as transient failure: {}", exception.getClass().getSimpleName());
      return true;
    }

    String sqlState = sqlStateOf(exception);
    if (sqlState != null) {
      boolean isTransient =
          sqlState.startsWith(CLASS_CONNECTION)
              || sqlState.startsWith(CLASS_TRANSACTION_ROLLBACK)
              || sqlState.startsWith(CLASS_OPERATOR_INTERVENTION)
              || STATE_TIMEOUT.equals(sqlState);
      if (isTransient) {
        logger.debug("Classified as transient failure: SQLState {}", sqlState);
        return true;
      }
    }

    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return isTransientFailure(cause);
    }

    logger.debug("Classified as permanent failure: {}", exception.getClass().getSimpleName());
    return false;
  }

  /**
   * Determines if a failure should be recorded by the circuit breaker.
   *
   * <p>Integrity violations and data exceptions are caused by the request, not by the health of
   * the database, and never count. Everything else raised by the store does.
   *
   * @param exception the exception to classify
   * @return true if the failure should count against the circuit breaker
   */
  public static boolean isCircuitBreakerFailure(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (isUniqueViolation(exception) || isDataException(exception)) {
      return false;
    }

    return exception instanceof ClientStoreException
        || exception instanceof SQLException
        || isTransientFailure(exception);
  }

  /**
   * Gets a short error category for logging and metrics.
   *
   * @param exception the exception to categorize
   * @return error category string
   */
  public static String getErrorCategory(Throwable exception) {
    if (exception == null) {
      return "unknown";
    }

    if (exception instanceof CallNotPermittedException) {
      return "circuit_open";
    }

    if (isUniqueViolation(exception)) {
      return "unique_violation";
    }

    if (isDataException(exception)) {
      return "invalid_data";
    }

    if (exception instanceof SQLNonTransientConnectionException) {
      return "connection";
    }

    if (isTransientFailure(exception)) {
      String sqlState = sqlStateOf(exception);
      if (sqlState != null && sqlState.startsWith(CLASS_CONNECTION)) {
        return "connection";
      }
      return "transient";
    }

    if (exception instanceof ClientStoreException || exception instanceof SQLException) {
      return "database";
    }

    return "unknown";
  }

  private static String sqlStateOf(Throwable exception) {
    if (exception instanceof SQLException sqlException) {
      return sqlException.getSQLState();
    }
    if (exception instanceof ClientStoreException storeException) {
      return storeException.getSqlState();
    }
    return null;
  }
}
