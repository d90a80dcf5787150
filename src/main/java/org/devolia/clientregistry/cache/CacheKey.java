package org.devolia.clientregistry.cache;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.devolia.clientregistry.model.ClientView;

/**
 * Typed key for the response cache.
 *
 * <p>A key is either the full client list or a single client by CNPJ. The type parameter is the
 * type of the value cached under the key, so readers and writers cannot disagree on it. Keys
 * compare by kind and CNPJ rather than by their string form, so a client whose CNPJ happens to be
 * {@code ALL} never collides with the list key.
 *
 * <p>String forms:
 *
 * <ul>
 *   <li>{@code CLIENTES:ALL} - the ordered list of all clients
 *   <li>{@code CLIENTES:<cnpj>} - a single client
 * </ul>
 *
 * @param <T> the type of the cached value
 * @author Devolia
 * @since 1.0.0
 */
public final class CacheKey<T> {

  private static final String NAMESPACE = "CLIENTES";

  private static final CacheKey<List<ClientView>> ALL_CLIENTS =
      new CacheKey<>(Kind.ALL_CLIENTS, null, CacheKey::readClientList);

  private enum Kind {
    ALL_CLIENTS,
    CLIENT
  }

  private final Kind kind;
  private final String cnpj;
  private final Function<Object, T> reader;

  private CacheKey(Kind kind, String cnpj, Function<Object, T> reader) {
    this.kind = kind;
    this.cnpj = cnpj;
    this.reader = reader;
  }

  /**
   * Key for the ordered list of all clients.
   *
   * @return the list key
   */
  public static CacheKey<List<ClientView>> allClients() {
    return ALL_CLIENTS;
  }

  /**
   * Key for a single client.
   *
   * @param cnpj the client CNPJ
   * @return the client key
   */
  public static CacheKey<ClientView> client(String cnpj) {
    return new CacheKey<>(
        Kind.CLIENT, Objects.requireNonNull(cnpj, "cnpj cannot be null"), ClientView.class::cast);
  }

  /**
   * Every key that may hold data about the given client. A write touching that client must
   * invalidate all of them.
   *
   * @param cnpj the client CNPJ
   * @return the affected keys
   */
  public static List<CacheKey<?>> affectedBy(String cnpj) {
    return List.of(allClients(), client(cnpj));
  }

  /**
   * Gets the string form of this key, used in logs.
   *
   * @return {@code CLIENTES:ALL} or {@code CLIENTES:<cnpj>}
   */
  public String asString() {
    return kind == Kind.ALL_CLIENTS ? NAMESPACE + ":ALL" : NAMESPACE + ":" + cnpj;
  }

  /**
   * Reads a cached value back as this key's type.
   *
   * @throws ClassCastException if the value was not cached under a key of this kind
   */
  T read(Object value) {
    return reader.apply(value);
  }

  private static List<ClientView> readClientList(Object value) {
    return ((List<?>) value).stream().map(ClientView.class::cast).toList();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CacheKey<?> other)) {
      return false;
    }
    return kind == other.kind && Objects.equals(cnpj, other.cnpj);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, cnpj);
  }

  @Override
  public String toString() {
    return asString();
  }
}
