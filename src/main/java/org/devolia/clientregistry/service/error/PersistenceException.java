package org.devolia.clientregistry.service.error;

/**
 * The client store failed or is unavailable. The message is generic; the cause holds the
 * driver detail for logs.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class PersistenceException extends RegistryException {

  private final String errorCategory;

  public PersistenceException(String message, String errorCategory, Throwable cause) {
    super(message, cause);
    this.errorCategory = errorCategory;
  }

  /**
   * Gets the classified store failure, for example {@code connection} or {@code circuit_open}.
   *
   * @return error category
   */
  public String getErrorCategory() {
    return errorCategory;
  }

  @Override
  public int getStatus() {
    return 500;
  }

  @Override
  public String getErrorCode() {
    return "error";
  }
}
