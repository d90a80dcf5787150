package org.devolia.clientregistry.secret;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide mapping from encrypted secret to client name.
 *
 * <p>Used to resolve a presented secret to its owner without querying the store. Entries are
 * added when a client is registered and removed when it is deleted. Unlike the response cache
 * this index has no expiry: it must hold every live client.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretIndex {

  private static final Logger logger = LoggerFactory.getLogger(SecretIndex.class);

  private final ConcurrentMap<String, String> namesBySecret = new ConcurrentHashMap<>();

  /**
   * Adds or replaces the owner of an encrypted secret.
   *
   * @param secretEncrypted the encrypted secret
   * @param nome the owning client name
   */
  public void add(String secretEncrypted, String nome) {
    Objects.requireNonNull(secretEncrypted, "secretEncrypted cannot be null");
    Objects.requireNonNull(nome, "nome cannot be null");
    namesBySecret.put(secretEncrypted, nome);
    logger.debug("Indexed secret {} for client: {}", mask(secretEncrypted), nome);
  }

  /**
   * Removes an encrypted secret. Removing an absent secret is a no-op.
   *
   * @param secretEncrypted the encrypted secret
   * @return true if an entry was removed
   */
  public boolean remove(String secretEncrypted) {
    if (secretEncrypted == null) {
      return false;
    }
    boolean removed = namesBySecret.remove(secretEncrypted) != null;
    if (removed) {
      logger.debug("Removed secret {} from index", mask(secretEncrypted));
    }
    return removed;
  }

  /**
   * Resolves the owner of an encrypted secret.
   *
   * @param secretEncrypted the encrypted secret
   * @return the client name, or empty if unknown
   */
  public Optional<String> resolve(String secretEncrypted) {
    if (secretEncrypted == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(namesBySecret.get(secretEncrypted));
  }

  /**
   * Replaces the whole index with the secrets read from the store. Not atomic with respect to
   * concurrent {@link #add}; call it before the registry serves requests.
   *
   * @param entries encrypted secret to client name
   */
  public void reload(Map<String, String> entries) {
    namesBySecret.clear();
    namesBySecret.putAll(entries);
    logger.info("Secret index loaded with {} entries", entries.size());
  }

  public int size() {
    return namesBySecret.size();
  }

  static String mask(String value) {
    if (value == null || value.length() <= 3) {
      return "***";
    }
    return value.substring(0, 2) + "***" + value.substring(value.length() - 1);
  }
}
