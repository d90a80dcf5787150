package org.devolia.clientregistry.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * Caller-facing projection of a client: identifier and name only.
 *
 * <p>This is the value kept in the response cache and returned by list and get operations. It
 * never carries secret material.
 *
 * @author Devolia
 * @since 1.0.0
 */
@JsonPropertyOrder({"cnpj", "nome"})
public final class ClientView {

  private final String cnpj;
  private final String nome;

  public ClientView(String cnpj, String nome) {
    this.cnpj = cnpj;
    this.nome = nome;
  }

  public String getCnpj() {
    return cnpj;
  }

  public String getNome() {
    return nome;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ClientView other)) {
      return false;
    }
    return Objects.equals(cnpj, other.cnpj) && Objects.equals(nome, other.nome);
  }

  @Override
  public int hashCode() {
    return Objects.hash(cnpj, nome);
  }

  @Override
  public String toString() {
    return "ClientView{cnpj='" + cnpj + "', nome='" + nome + "'}";
  }
}
