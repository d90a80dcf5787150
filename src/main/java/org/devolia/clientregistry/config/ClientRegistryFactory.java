package org.devolia.clientregistry.config;

import io.agroal.api.AgroalDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.devolia.clientregistry.api.ClientRegistryEndpoint;
import org.devolia.clientregistry.cache.CacheConfig;
import org.devolia.clientregistry.cache.ResponseCache;
import org.devolia.clientregistry.metrics.ClientRegistryMetrics;
import org.devolia.clientregistry.resilience.ResilienceConfig;
import org.devolia.clientregistry.secret.SecretCipher;
import org.devolia.clientregistry.secret.SecretGenerator;
import org.devolia.clientregistry.secret.SecretIndex;
import org.devolia.clientregistry.service.ClientRegistryService;
import org.devolia.clientregistry.store.DatabaseConfig;
import org.devolia.clientregistry.store.JdbcClientStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating {@link ClientRegistry} instances.
 *
 * <p>This factory is responsible for:
 *
 * <ul>
 *   <li>Validating configuration parameters
 *   <li>Creating the connection pool, cache, secret index and service
 *   <li>Rebuilding the secret index from the store before the registry is returned
 * </ul>
 *
 * <p>Configuration keys, read under the {@code client-registry.} prefix (see {@link
 * RegistrySettings} for where they are read from):
 *
 * <pre>
 * db.url=jdbc:postgresql://db/clients      # Required
 * db.user / db.password                    # Optional
 * db.pool.min-size=1                       # Optional
 * db.pool.max-size=10                      # Optional
 * db.pool.acquisition-timeout-ms=5000      # Optional
 * db.init-schema=false                     # Optional: create CLIENTES_API if missing
 * cache.ttl=300                            # Optional: response cache TTL in seconds
 * cache.max=1000                           # Optional: max response cache entries
 * secret.key=...                           # Required: base64 256-bit AES key
 * secret.bytes=32                          # Optional: random bytes per client secret
 * circuit-breaker.enabled=true             # Optional
 * circuit-breaker.failure-threshold=50     # Optional: percent
 * circuit-breaker.recovery-timeout-ms=30000 # Optional
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ClientRegistryFactory {

  private static final Logger logger = LoggerFactory.getLogger(ClientRegistryFactory.class);

  // Configuration keys
  static final String CONFIG_NAME = "name";
  static final String CONFIG_DB_URL = "db.url";
  static final String CONFIG_DB_USER = "db.user";
  static final String CONFIG_DB_PASSWORD = "db.password";
  static final String CONFIG_DB_POOL_MIN = "db.pool.min-size";
  static final String CONFIG_DB_POOL_MAX = "db.pool.max-size";
  static final String CONFIG_DB_ACQUISITION_TIMEOUT = "db.pool.acquisition-timeout-ms";
  static final String CONFIG_DB_INIT_SCHEMA = "db.init-schema";
  static final String CONFIG_CACHE_TTL = "cache.ttl";
  static final String CONFIG_CACHE_MAX = "cache.max";
  static final String CONFIG_SECRET_KEY = "secret.key";
  static final String CONFIG_SECRET_BYTES = "secret.bytes";
  static final String CONFIG_CB_ENABLED = "circuit-breaker.enabled";
  static final String CONFIG_CB_THRESHOLD = "circuit-breaker.failure-threshold";
  static final String CONFIG_CB_RECOVERY = "circuit-breaker.recovery-timeout-ms";

  private static final String DEFAULT_NAME = "client-registry";

  private RegistrySettings settings;

  /**
   * Initializes the factory with configuration and validates it.
   *
   * @param settings the configuration
   * @throws IllegalStateException if a required key is missing or a value is invalid or cannot
   *     be converted
   */
  public void init(RegistrySettings settings) {
    this.settings = settings;

    logger.info("Initializing client registry factory");
    validateConfiguration();
    logger.debug(
        "Configuration - DB: {}, Cache TTL: {}s, Cache Max: {}",
        DatabaseConfig.maskJdbcUrl(getDbUrl()),
        getCacheConfig().getCacheTtl(),
        getCacheConfig().getCacheMaxSize());
  }

  /**
   * Creates a registry with its own {@link SimpleMeterRegistry}.
   *
   * @return a started registry; the caller closes it
   */
  public ClientRegistry create() {
    return create(new SimpleMeterRegistry());
  }

  /**
   * Creates a registry publishing metrics to the given meter registry.
   *
   * @param meterRegistry the meter registry
   * @return a started registry; the caller closes it
   * @throws IllegalStateException if the factory is not initialized or the registry cannot start
   */
  public ClientRegistry create(MeterRegistry meterRegistry) {
    if (settings == null) {
      throw new IllegalStateException("Factory not initialized; call init() first");
    }
    logger.debug("Creating client registry instance");

    AgroalDataSource dataSource;
    try {
      dataSource = getDatabaseConfig().buildDataSource();
    } catch (Exception e) {
      logger.error("Failed to create connection pool", e);
      throw new IllegalStateException("Failed to create client registry connection pool", e);
    }

    try {
      JdbcClientStore store = new JdbcClientStore(dataSource);
      if (settings.getBoolean(CONFIG_DB_INIT_SCHEMA, false)) {
        store.createSchema();
      }

      String name = getName();
      ResponseCache responseCache = new ResponseCache(getCacheConfig());
      SecretIndex secretIndex = new SecretIndex();
      SecretGenerator secretGenerator =
          new SecretGenerator(
              SecretCipher.fromBase64Key(settings.get(CONFIG_SECRET_KEY)),
              settings.getInt(CONFIG_SECRET_BYTES, SecretGenerator.DEFAULT_SECRET_BYTES));
      ClientRegistryMetrics metrics = new ClientRegistryMetrics(meterRegistry, name);

      ClientRegistryService service =
          new ClientRegistryService(
              store, responseCache, secretIndex, secretGenerator, metrics, getResilienceConfig());
      int indexed = service.reloadSecretIndex();

      logger.info("Client registry {} started with {} clients", name, indexed);
      return new ClientRegistry(
          name,
          service,
          new ClientRegistryEndpoint(service),
          responseCache,
          secretIndex,
          metrics,
          meterRegistry,
          dataSource);
    } catch (RuntimeException e) {
      logger.error("Failed to create client registry", e);
      dataSource.close();
      throw new IllegalStateException("Failed to create client registry", e);
    }
  }

  public String getName() {
    return settings != null ? settings.get(CONFIG_NAME, DEFAULT_NAME) : DEFAULT_NAME;
  }

  public String getDbUrl() {
    return settings != null ? settings.get(CONFIG_DB_URL) : null;
  }

  DatabaseConfig getDatabaseConfig() {
    return new DatabaseConfig(
        getDbUrl(),
        settings.get(CONFIG_DB_USER),
        settings.get(CONFIG_DB_PASSWORD),
        settings.getInt(CONFIG_DB_POOL_MIN, DatabaseConfig.DEFAULT_POOL_MIN_SIZE),
        settings.getInt(CONFIG_DB_POOL_MAX, DatabaseConfig.DEFAULT_POOL_MAX_SIZE),
        settings.getLong(
            CONFIG_DB_ACQUISITION_TIMEOUT, DatabaseConfig.DEFAULT_ACQUISITION_TIMEOUT_MS));
  }

  CacheConfig getCacheConfig() {
    if (settings == null) {
      return CacheConfig.defaultConfig();
    }
    return new CacheConfig(
        settings.getInt(CONFIG_CACHE_TTL, CacheConfig.DEFAULT_CACHE_TTL),
        settings.getInt(CONFIG_CACHE_MAX, CacheConfig.DEFAULT_CACHE_MAX));
  }

  ResilienceConfig getResilienceConfig() {
    return new ResilienceConfig(
        settings.getBoolean(CONFIG_CB_ENABLED, ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_ENABLED),
        settings.getInt(
            CONFIG_CB_THRESHOLD, ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_FAILURE_THRESHOLD),
        settings.getLong(
            CONFIG_CB_RECOVERY, ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS));
  }

  /** Validates the configuration, failing fast on anything the registry cannot start with. */
  private void validateConfiguration() {
    String dbUrl = getDbUrl();
    if (dbUrl == null) {
      logger.error("Required configuration '{}' is missing or empty", CONFIG_DB_URL);
      throw new IllegalStateException(
          "Database URL is required. Please configure '" + CONFIG_DB_URL + "'");
    }

    String secretKey = settings.get(CONFIG_SECRET_KEY);
    if (secretKey == null) {
      logger.error("Required configuration '{}' is missing or empty", CONFIG_SECRET_KEY);
      throw new IllegalStateException(
          "Secret key is required. Please configure '" + CONFIG_SECRET_KEY + "'");
    }

    try {
      getDatabaseConfig().validate();
      getCacheConfig().validate();
      getResilienceConfig().validate();
      new SecretGenerator(
          SecretCipher.fromBase64Key(secretKey),
          settings.getInt(CONFIG_SECRET_BYTES, SecretGenerator.DEFAULT_SECRET_BYTES));
    } catch (IllegalArgumentException e) {
      logger.error("Invalid client registry configuration: {}", e.getMessage());
      throw new IllegalStateException(
          "Invalid client registry configuration: " + e.getMessage(), e);
    }

    logger.info(
        "Client registry configured successfully for database: {}",
        DatabaseConfig.maskJdbcUrl(dbUrl));
  }
}
