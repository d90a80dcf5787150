package org.devolia.clientregistry.service.error;

/**
 * A client with the same CNPJ already exists.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ConflictException extends RegistryException {

  public ConflictException(String message) {
    super(message);
  }

  public ConflictException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int getStatus() {
    return 409;
  }

  @Override
  public String getErrorCode() {
    return "conflict";
  }
}
