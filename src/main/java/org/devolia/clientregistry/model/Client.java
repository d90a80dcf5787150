package org.devolia.clientregistry.model;

import java.util.Objects;

/**
 * A registered client as persisted in the store.
 *
 * <p>Clients are immutable: they are created on registration and removed on deletion, never
 * updated in place. The secret is only ever held in its encrypted form.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class Client {

  /** Longest CNPJ the store accepts. */
  public static final int MAX_CNPJ_LENGTH = 32;

  /** Longest name the store accepts. */
  public static final int MAX_NOME_LENGTH = 255;

  private final String cnpj;
  private final String nome;
  private final String secretEncrypted;

  /**
   * Constructor for a client record.
   *
   * @param cnpj the trimmed tax identifier
   * @param nome the trimmed display name
   * @param secretEncrypted the encrypted secret, never the plaintext
   */
  public Client(String cnpj, String nome, String secretEncrypted) {
    this.cnpj = Objects.requireNonNull(cnpj, "cnpj cannot be null");
    this.nome = Objects.requireNonNull(nome, "nome cannot be null");
    this.secretEncrypted =
        Objects.requireNonNull(secretEncrypted, "secretEncrypted cannot be null");
  }

  public String getCnpj() {
    return cnpj;
  }

  public String getNome() {
    return nome;
  }

  public String getSecretEncrypted() {
    return secretEncrypted;
  }

  @Override
  public String toString() {
    return "Client{cnpj='" + cnpj + "', nome='" + nome + "'}";
  }
}
