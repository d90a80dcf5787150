package org.devolia.clientregistry.service.error;

/**
 * Base class of the failures a registry operation reports to its caller.
 *
 * <p>Each subclass maps to one HTTP-equivalent status. The message is safe to show to the
 * caller; diagnostic detail stays in the cause.
 *
 * @author Devolia
 * @since 1.0.0
 */
public abstract class RegistryException extends RuntimeException {

  protected RegistryException(String message) {
    super(message);
  }

  protected RegistryException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Gets the HTTP-equivalent status of this failure.
   *
   * @return the status code
   */
  public abstract int getStatus();

  /**
   * Gets the status tag used in metrics.
   *
   * @return the metric status
   */
  public abstract String getErrorCode();
}
