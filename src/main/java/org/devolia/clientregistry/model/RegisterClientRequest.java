package org.devolia.clientregistry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw registration input. Fields may be null or blank; validation happens in the service.
 *
 * @author Devolia
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RegisterClientRequest {

  private final String cnpj;
  private final String nome;

  @JsonCreator
  public RegisterClientRequest(
      @JsonProperty("cnpj") String cnpj, @JsonProperty("nome") String nome) {
    this.cnpj = cnpj;
    this.nome = nome;
  }

  public String getCnpj() {
    return cnpj;
  }

  public String getNome() {
    return nome;
  }
}
