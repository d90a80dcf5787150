package org.devolia.clientregistry.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.devolia.clientregistry.model.Client;
import org.devolia.clientregistry.model.ClientView;

/**
 * Durable storage of clients.
 *
 * <p>Every method acquires its own connection and releases it before returning, on success and
 * on failure. Writes are committed before the method returns. Failures surface as {@link
 * ClientStoreException}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public interface ClientStore {

  /**
   * Inserts a client unless one with the same CNPJ exists. The existence check and the insert run
   * in one transaction on one connection. A concurrent insert of the same CNPJ that wins the race
   * surfaces as a {@link ClientStoreException} with an integrity-violation SQLState.
   *
   * @param client the client to insert
   * @return true if inserted and committed, false if the CNPJ was already present
   */
  boolean insertIfAbsent(Client client);

  /**
   * Lists all clients ordered by name.
   *
   * @return client projections, ascending by name
   */
  List<ClientView> findAll();

  /**
   * Finds a client by CNPJ.
   *
   * @param cnpj the client CNPJ
   * @return the projection, or empty if absent
   */
  Optional<ClientView> findByCnpj(String cnpj);

  /**
   * Deletes a client, reading its encrypted secret first in the same transaction.
   *
   * @param cnpj the client CNPJ
   * @return the encrypted secret of the deleted client, or empty if nothing was deleted
   */
  Optional<String> delete(String cnpj);

  /**
   * Reads every encrypted secret with its owner, for rebuilding the secret index.
   *
   * @return encrypted secret to client name
   */
  Map<String, String> findAllSecrets();
}
