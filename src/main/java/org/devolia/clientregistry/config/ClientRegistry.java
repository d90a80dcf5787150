package org.devolia.clientregistry.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.devolia.clientregistry.api.ClientRegistryEndpoint;
import org.devolia.clientregistry.cache.ResponseCache;
import org.devolia.clientregistry.metrics.ClientRegistryMetrics;
import org.devolia.clientregistry.secret.SecretIndex;
import org.devolia.clientregistry.service.ClientRegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A running registry instance: the service, its boundary, and the state they own.
 *
 * <p>The response cache and the secret index belong to this instance, so several registries
 * can run side by side. Closing it releases the connection pool.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ClientRegistry implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ClientRegistry.class);

  private final String name;
  private final ClientRegistryService service;
  private final ClientRegistryEndpoint endpoint;
  private final ResponseCache responseCache;
  private final SecretIndex secretIndex;
  private final ClientRegistryMetrics metrics;
  private final MeterRegistry meterRegistry;
  private final AutoCloseable dataSource;

  ClientRegistry(
      String name,
      ClientRegistryService service,
      ClientRegistryEndpoint endpoint,
      ResponseCache responseCache,
      SecretIndex secretIndex,
      ClientRegistryMetrics metrics,
      MeterRegistry meterRegistry,
      AutoCloseable dataSource) {
    this.name = name;
    this.service = service;
    this.endpoint = endpoint;
    this.responseCache = responseCache;
    this.secretIndex = secretIndex;
    this.metrics = metrics;
    this.meterRegistry = meterRegistry;
    this.dataSource = dataSource;
  }

  public String getName() {
    return name;
  }

  public ClientRegistryService getService() {
    return service;
  }

  public ClientRegistryEndpoint getEndpoint() {
    return endpoint;
  }

  public ResponseCache getResponseCache() {
    return responseCache;
  }

  public SecretIndex getSecretIndex() {
    return secretIndex;
  }

  public ClientRegistryMetrics getMetrics() {
    return metrics;
  }

  public MeterRegistry getMeterRegistry() {
    return meterRegistry;
  }

  /** Closes the connection pool. */
  @Override
  public void close() {
    logger.debug("Closing client registry: {}", name);
    try {
      dataSource.close();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to close client registry: " + name, e);
    }
  }
}
