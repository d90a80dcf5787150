package org.devolia.clientregistry.service;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.devolia.clientregistry.cache.CacheKey;
import org.devolia.clientregistry.cache.ResponseCache;
import org.devolia.clientregistry.metrics.ClientRegistryMetrics;
import org.devolia.clientregistry.model.Client;
import org.devolia.clientregistry.model.ClientView;
import org.devolia.clientregistry.model.RegisterClientRequest;
import org.devolia.clientregistry.resilience.ExceptionClassifier;
import org.devolia.clientregistry.resilience.ResilienceConfig;
import org.devolia.clientregistry.secret.GeneratedSecret;
import org.devolia.clientregistry.secret.SecretGenerator;
import org.devolia.clientregistry.secret.SecretIndex;
import org.devolia.clientregistry.service.error.ConflictException;
import org.devolia.clientregistry.service.error.NotFoundException;
import org.devolia.clientregistry.service.error.PersistenceException;
import org.devolia.clientregistry.service.error.RegistryException;
import org.devolia.clientregistry.service.error.ValidationException;
import org.devolia.clientregistry.store.ClientStore;
import org.devolia.clientregistry.store.ClientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers, lists, retrieves and deletes clients, keeping the response cache and the secret
 * index consistent with the store.
 *
 * <p>Consistency rules:
 *
 * <ul>
 *   <li>Reads go to the cache first. On a miss the store result is cached, unless a write
 *       invalidated the key while the query ran.
 *   <li>Every committed insert or delete is followed, in the same call, by invalidation of
 *       {@code CLIENTES:ALL} and {@code CLIENTES:<cnpj>} and by the matching secret index update.
 *   <li>Nothing is invalidated or indexed unless the store write committed.
 * </ul>
 *
 * <p>Store calls are not retried. When enabled, a circuit breaker makes them fail fast while the
 * database is unhealthy.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ClientRegistryService {

  private static final Logger logger = LoggerFactory.getLogger(ClientRegistryService.class);

  public static final String OPERATION_REGISTER = "register";
  public static final String OPERATION_LIST = "list";
  public static final String OPERATION_GET = "get";
  public static final String OPERATION_DELETE = "delete";
  public static final String OPERATION_AUTHENTICATE = "authenticate";

  private final ClientStore clientStore;
  private final ResponseCache responseCache;
  private final SecretIndex secretIndex;
  private final SecretGenerator secretGenerator;
  private final ClientRegistryMetrics metrics;
  private final CircuitBreaker circuitBreaker;

  /**
   * Constructor.
   *
   * @param clientStore durable client storage
   * @param responseCache cache of read projections
   * @param secretIndex encrypted secret to client name index
   * @param secretGenerator secret generator
   * @param metrics metrics collector
   * @param resilienceConfig circuit breaker configuration for store calls
   */
  public ClientRegistryService(
      ClientStore clientStore,
      ResponseCache responseCache,
      SecretIndex secretIndex,
      SecretGenerator secretGenerator,
      ClientRegistryMetrics metrics,
      ResilienceConfig resilienceConfig) {
    this.clientStore = Objects.requireNonNull(clientStore, "clientStore cannot be null");
    this.responseCache = Objects.requireNonNull(responseCache, "responseCache cannot be null");
    this.secretIndex = Objects.requireNonNull(secretIndex, "secretIndex cannot be null");
    this.secretGenerator =
        Objects.requireNonNull(secretGenerator, "secretGenerator cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.circuitBreaker = resilienceConfig.buildCircuitBreaker("client-store");

    if (circuitBreaker != null) {
      circuitBreaker
          .getEventPublisher()
          .onStateTransition(
              event -> {
                String fromState = event.getStateTransition().getFromState().name().toLowerCase();
                String toState = event.getStateTransition().getToState().name().toLowerCase();
                metrics.recordCircuitBreakerState(toState);
                logger.info(
                    "Client store circuit breaker transition: {} -> {}", fromState, toState);
              });
    }
  }

  /**
   * Registers a new client and issues its secret.
   *
   * @param request the registration input; CNPJ and name are trimmed
   * @return the CNPJ and the plaintext token, which is never returned again
   * @throws ValidationException if CNPJ or name is missing, blank or longer than the store
   *     accepts
   * @throws ConflictException if a client with this CNPJ exists
   * @throws PersistenceException if the store fails
   */
  public RegistrationResult register(RegisterClientRequest request) {
    return timed(
        OPERATION_REGISTER,
        () -> {
          String cnpj = trimToNull(request != null ? request.getCnpj() : null);
          String nome = trimToNull(request != null ? request.getNome() : null);

          List<String> missing = new ArrayList<>();
          if (cnpj == null) {
            missing.add("cnpj");
          }
          if (nome == null) {
            missing.add("nome");
          }
          if (!missing.isEmpty()) {
            throw new ValidationException(missing);
          }
          requireMaxLength("cnpj", cnpj, Client.MAX_CNPJ_LENGTH);
          requireMaxLength("nome", nome, Client.MAX_NOME_LENGTH);

          GeneratedSecret secret = secretGenerator.generate();
          Client client = new Client(cnpj, nome, secret.getEncrypted());

          boolean inserted;
          try {
            inserted = callStore(() -> clientStore.insertIfAbsent(client));
          } catch (ClientStoreException e) {
            if (ExceptionClassifier.isUniqueViolation(e)) {
              // Lost a race with a concurrent registration of the same CNPJ.
              throw new ConflictException("Client already exists", e);
            }
            throw persistenceFailure("Internal error registering client", e);
          } catch (CallNotPermittedException e) {
            throw persistenceFailure("Internal error registering client", e);
          }

          if (!inserted) {
            throw new ConflictException("Client already exists");
          }

          secretIndex.add(secret.getEncrypted(), nome);
          invalidateClient(cnpj);

          logger.info("Registered client: {}", cnpj);
          return new RegistrationResult(cnpj, secret.getPlaintext());
        });
  }

  /**
   * Lists all clients ordered by name.
   *
   * @return immutable list of client projections
   * @throws PersistenceException if the store fails
   */
  public List<ClientView> listAll() {
    return timed(
        OPERATION_LIST,
        () -> {
          CacheKey<List<ClientView>> key = CacheKey.allClients();
          Optional<List<ClientView>> cached = responseCache.get(key);
          if (cached.isPresent()) {
            metrics.incrementCacheHit();
            return cached.get();
          }
          metrics.incrementCacheMiss();

          return responseCache.load(
              key, () -> List.copyOf(readStore("Error listing clients", clientStore::findAll)));
        });
  }

  /**
   * Retrieves one client by CNPJ.
   *
   * @param cnpj the client CNPJ; trimmed
   * @return the client projection
   * @throws ValidationException if the CNPJ is missing, blank or too long
   * @throws NotFoundException if no client has this CNPJ
   * @throws PersistenceException if the store fails
   */
  public ClientView getByCnpj(String cnpj) {
    return timed(
        OPERATION_GET,
        () -> {
          String trimmed = requireCnpj(cnpj);
          CacheKey<ClientView> key = CacheKey.client(trimmed);
          Optional<ClientView> cached = responseCache.get(key);
          if (cached.isPresent()) {
            metrics.incrementCacheHit();
            return cached.get();
          }
          metrics.incrementCacheMiss();

          return responseCache.load(
              key,
              () ->
                  readStore("Error finding client", () -> clientStore.findByCnpj(trimmed))
                      .orElseThrow(() -> new NotFoundException("Client not found")));
        });
  }

  /**
   * Deletes a client. Cache keys and the secret index entry are cleared only after the delete
   * committed.
   *
   * @param cnpj the client CNPJ; trimmed
   * @return the deleted CNPJ
   * @throws ValidationException if the CNPJ is missing, blank or too long
   * @throws NotFoundException if no client has this CNPJ
   * @throws PersistenceException if the store fails
   */
  public String delete(String cnpj) {
    return timed(
        OPERATION_DELETE,
        () -> {
          String trimmed = requireCnpj(cnpj);

          Optional<String> secretEncrypted;
          try {
            secretEncrypted = callStore(() -> clientStore.delete(trimmed));
          } catch (ClientStoreException | CallNotPermittedException e) {
            throw persistenceFailure("Error deleting client", e);
          }

          if (secretEncrypted.isEmpty()) {
            throw new NotFoundException("Client not found for deletion");
          }

          invalidateClient(trimmed);
          secretIndex.remove(secretEncrypted.get());

          logger.info("Deleted client: {}", trimmed);
          return trimmed;
        });
  }

  /**
   * Resolves a presented secret to the name of the client that owns it, without a store query.
   *
   * @param token the plaintext secret issued at registration
   * @return the client name, or empty if the secret is unknown
   * @throws ValidationException if the token is missing or blank
   */
  public Optional<String> authenticate(String token) {
    return timed(
        OPERATION_AUTHENTICATE,
        () -> {
          String trimmed = trimToNull(token);
          if (trimmed == null) {
            throw new ValidationException(List.of("token"));
          }
          return secretIndex.resolve(secretGenerator.encrypt(trimmed));
        });
  }

  /**
   * Rebuilds the secret index from the store. Called once at startup.
   *
   * @return number of indexed secrets
   * @throws PersistenceException if the store fails
   */
  public int reloadSecretIndex() {
    secretIndex.reload(readStore("Error loading client secrets", clientStore::findAllSecrets));
    return secretIndex.size();
  }

  private void invalidateClient(String cnpj) {
    for (CacheKey<?> key : CacheKey.affectedBy(cnpj)) {
      responseCache.invalidate(key);
    }
  }

  private <T> T readStore(String failureMessage, Supplier<T> read) {
    try {
      return callStore(read);
    } catch (ClientStoreException | CallNotPermittedException e) {
      throw persistenceFailure(failureMessage, e);
    }
  }

  private <T> T callStore(Supplier<T> call) {
    Supplier<T> decorated =
        circuitBreaker != null ? CircuitBreaker.decorateSupplier(circuitBreaker, call) : call;
    return decorated.get();
  }

  private <T> T timed(String operation, Supplier<T> work) {
    long startTime = System.nanoTime();
    String status = "error";
    try {
      T result = work.get();
      status = ClientRegistryMetrics.STATUS_SUCCESS;
      return result;
    } catch (RegistryException e) {
      status = e.getErrorCode();
      throw e;
    } finally {
      metrics.recordOperation(operation, status, System.nanoTime() - startTime);
    }
  }

  private static PersistenceException persistenceFailure(String message, RuntimeException cause) {
    return new PersistenceException(message, ExceptionClassifier.getErrorCategory(cause), cause);
  }

  private static String requireCnpj(String cnpj) {
    String trimmed = trimToNull(cnpj);
    if (trimmed == null) {
      throw new ValidationException(List.of("cnpj"));
    }
    requireMaxLength("cnpj", trimmed, Client.MAX_CNPJ_LENGTH);
    return trimmed;
  }

  private static void requireMaxLength(String field, String value, int maxLength) {
    if (value.length() > maxLength) {
      throw ValidationException.tooLong(field, maxLength);
    }
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
