package org.devolia.clientregistry.service.error;

/**
 * No client matches the given CNPJ.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class NotFoundException extends RegistryException {

  public NotFoundException(String message) {
    super(message);
  }

  @Override
  public int getStatus() {
    return 404;
  }

  @Override
  public String getErrorCode() {
    return "not_found";
  }
}
