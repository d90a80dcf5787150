package org.devolia.clientregistry.service.error;

import java.util.List;

/**
 * Caller input is missing, blank or too long.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ValidationException extends RegistryException {

  private final List<String> missingFields;

  public ValidationException(List<String> missingFields) {
    super("Missing required fields: " + String.join(", ", missingFields));
    this.missingFields = List.copyOf(missingFields);
  }

  private ValidationException(String message) {
    super(message);
    this.missingFields = List.of();
  }

  /**
   * Creates an exception for a field longer than the store accepts.
   *
   * @param field the field name
   * @param maxLength the maximum length in characters
   * @return the exception
   */
  public static ValidationException tooLong(String field, int maxLength) {
    return new ValidationException(
        "Field '" + field + "' must be at most " + maxLength + " characters");
  }

  /**
   * Gets the names of the missing fields, in input order.
   *
   * @return missing field names, empty when the input was rejected for length
   */
  public List<String> getMissingFields() {
    return missingFields;
  }

  @Override
  public int getStatus() {
    return 400;
  }

  @Override
  public String getErrorCode() {
    return "validation_error";
  }
}
