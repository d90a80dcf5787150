package org.devolia.clientregistry.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics collector for client registry operations.
 *
 * <p>This class provides Micrometer-based metrics for monitoring the registry:
 *
 * <ul>
 *   <li><strong>client_registry_requests_total</strong> - Counter of operations by operation and
 *       status
 *   <li><strong>client_registry_latency_seconds</strong> - Timer of operation latencies
 *   <li><strong>client_registry_cache_operations_total</strong> - Counter of response cache hits
 *       and misses
 *   <li><strong>client_registry_circuit_breaker_state</strong> - Gauge of the store circuit
 *       breaker (0 closed, 0.5 half open, 1 open)
 * </ul>
 *
 * <p>Metrics are tagged with:
 *
 * <ul>
 *   <li><code>operation</code> - register, list, get, delete, authenticate
 *   <li><code>status</code> - success, validation_error, conflict, not_found, error
 *   <li><code>registry</code> - the registry instance name
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ClientRegistryMetrics {

  private static final Logger logger = LoggerFactory.getLogger(ClientRegistryMetrics.class);

  // Metric names
  private static final String REQUESTS_TOTAL = "client_registry_requests_total";
  private static final String LATENCY_SECONDS = "client_registry_latency_seconds";
  private static final String CACHE_OPERATIONS_TOTAL = "client_registry_cache_operations_total";
  private static final String CIRCUIT_BREAKER_STATE = "client_registry_circuit_breaker_state";

  public static final String STATUS_SUCCESS = "success";

  private static final String OPERATION_CACHE_HIT = "cache_hit";
  private static final String OPERATION_CACHE_MISS = "cache_miss";

  private final MeterRegistry meterRegistry;
  private final String registryName;

  private final Counter cacheHitCounter;
  private final Counter cacheMissCounter;

  private volatile double circuitBreakerState;

  /**
   * Constructor.
   *
   * @param meterRegistry the Micrometer meter registry
   * @param registryName the registry name for tagging metrics
   */
  public ClientRegistryMetrics(MeterRegistry meterRegistry, String registryName) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");
    this.registryName = registryName != null ? registryName : "default";

    this.cacheHitCounter =
        Counter.builder(CACHE_OPERATIONS_TOTAL)
            .description("Total number of response cache operations")
            .tag("operation", OPERATION_CACHE_HIT)
            .tag("registry", this.registryName)
            .register(meterRegistry);

    this.cacheMissCounter =
        Counter.builder(CACHE_OPERATIONS_TOTAL)
            .description("Total number of response cache operations")
            .tag("operation", OPERATION_CACHE_MISS)
            .tag("registry", this.registryName)
            .register(meterRegistry);

    Gauge.builder(CIRCUIT_BREAKER_STATE, this, metrics -> metrics.circuitBreakerState)
        .description("State of the client store circuit breaker")
        .tag("registry", this.registryName)
        .register(meterRegistry);

    logger.info("Initialized client registry metrics for registry: {}", this.registryName);
  }

  /**
   * Records a completed operation.
   *
   * @param operation the operation name
   * @param status the outcome, {@link #STATUS_SUCCESS} or an error status
   * @param latencyNanos the operation latency in nanoseconds
   */
  public void recordOperation(String operation, String status, long latencyNanos) {
    requestCounter(operation, status).increment();
    latencyTimer(operation).record(Duration.ofNanos(latencyNanos));

    logger.debug(
        "Recorded {} operation - status: {}, latency: {}ms",
        operation,
        status,
        latencyNanos / 1_000_000);
  }

  /** Records a response cache hit. */
  public void incrementCacheHit() {
    cacheHitCounter.increment();
  }

  /** Records a response cache miss. */
  public void incrementCacheMiss() {
    cacheMissCounter.increment();
  }

  /**
   * Records circuit breaker state changes.
   *
   * @param state the circuit breaker state ("closed", "open", "half_open")
   */
  public void recordCircuitBreakerState(String state) {
    circuitBreakerState = getStateValue(state);
    logger.debug("Recorded circuit breaker state change: {}", state);
  }

  private double getStateValue(String state) {
    return switch (state) {
      case "closed" -> 0.0;
      case "half_open" -> 0.5;
      case "open" -> 1.0;
      default -> -1.0;
    };
  }

  /**
   * Gets the number of operations recorded with the given outcome.
   *
   * @param operation the operation name
   * @param status the outcome
   * @return operation count
   */
  public double getOperationCount(String operation, String status) {
    return requestCounter(operation, status).count();
  }

  public double getCacheHitCount() {
    return cacheHitCounter.count();
  }

  public double getCacheMissCount() {
    return cacheMissCounter.count();
  }

  public double getCircuitBreakerState() {
    return circuitBreakerState;
  }

  /**
   * Gets the mean latency of an operation in milliseconds.
   *
   * @param operation the operation name
   * @return mean latency in milliseconds
   */
  public double getMeanLatencyMs(String operation) {
    return latencyTimer(operation).mean(TimeUnit.MILLISECONDS);
  }

  /**
   * Gets the cache hit ratio.
   *
   * @return cache hit ratio (0.0 to 1.0)
   */
  public double getCacheHitRatio() {
    double hits = getCacheHitCount();
    double total = hits + getCacheMissCount();
    return total > 0 ? hits / total : 0.0;
  }

  private Counter requestCounter(String operation, String status) {
    return Counter.builder(REQUESTS_TOTAL)
        .description("Total number of client registry operations")
        .tag("operation", operation)
        .tag("status", status)
        .tag("registry", registryName)
        .register(meterRegistry);
  }

  private Timer latencyTimer(String operation) {
    return Timer.builder(LATENCY_SECONDS)
        .description("Latency of client registry operations")
        .tag("operation", operation)
        .tag("registry", registryName)
        .register(meterRegistry);
  }
}
