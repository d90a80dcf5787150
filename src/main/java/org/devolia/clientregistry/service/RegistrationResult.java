package org.devolia.clientregistry.service;

/**
 * Outcome of a successful registration. The token is the plaintext secret and is handed out
 * only here.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class RegistrationResult {

  private final String cnpj;
  private final String token;

  public RegistrationResult(String cnpj, String token) {
    this.cnpj = cnpj;
    this.token = token;
  }

  public String getCnpj() {
    return cnpj;
  }

  public String getToken() {
    return token;
  }

  @Override
  public String toString() {
    return "RegistrationResult{cnpj='" + cnpj + "', token=***}";
  }
}
