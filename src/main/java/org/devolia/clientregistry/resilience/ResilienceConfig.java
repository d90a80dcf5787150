package org.devolia.clientregistry.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the circuit breaker guarding the client store.
 *
 * <p>Failed store calls are never retried. The breaker only makes calls fail fast while the
 * database is unhealthy:
 *
 * <ul>
 *   <li>Failure rate threshold, in percent of the sliding window
 *   <li>Recovery timeout before half-open trial calls are allowed
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ResilienceConfig {

  private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

  public static final boolean DEFAULT_CIRCUIT_BREAKER_ENABLED = true;
  public static final int DEFAULT_CIRCUIT_BREAKER_FAILURE_THRESHOLD = 50;
  public static final long DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS = 30000;

  private static final int SLIDING_WINDOW_SIZE = 10;
  private static final int MINIMUM_NUMBER_OF_CALLS = 5;

  private final boolean circuitBreakerEnabled;
  private final int circuitBreakerFailureThreshold;
  private final Duration circuitBreakerRecoveryTimeout;

  /**
   * Constructor with configuration values.
   *
   * @param circuitBreakerEnabled whether circuit breaker is enabled (default: true)
   * @param circuitBreakerFailureThreshold failure rate in percent that opens the breaker
   *     (default: 50)
   * @param circuitBreakerRecoveryTimeoutMs recovery timeout in milliseconds (default: 30000)
   */
  public ResilienceConfig(
      boolean circuitBreakerEnabled,
      int circuitBreakerFailureThreshold,
      long circuitBreakerRecoveryTimeoutMs) {

    this.circuitBreakerEnabled = circuitBreakerEnabled;
    this.circuitBreakerFailureThreshold = circuitBreakerFailureThreshold;
    this.circuitBreakerRecoveryTimeout = Duration.ofMillis(circuitBreakerRecoveryTimeoutMs);

    logger.debug(
        "Resilience configuration initialized - CircuitBreaker: enabled={}, threshold={}%, "
            + "recovery={}ms",
        circuitBreakerEnabled,
        circuitBreakerFailureThreshold,
        circuitBreakerRecoveryTimeoutMs);
  }

  /**
   * Creates configuration with default values.
   *
   * @return default resilience configuration
   */
  public static ResilienceConfig defaultConfig() {
    return new ResilienceConfig(
        DEFAULT_CIRCUIT_BREAKER_ENABLED,
        DEFAULT_CIRCUIT_BREAKER_FAILURE_THRESHOLD,
        DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS);
  }

  /**
   * Builds the circuit breaker for the named store.
   *
   * @param name the breaker name
   * @return the circuit breaker, or null when disabled
   */
  public CircuitBreaker buildCircuitBreaker(String name) {
    if (!circuitBreakerEnabled) {
      logger.debug("Circuit breaker disabled for: {}", name);
      return null;
    }

    CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .failureRateThreshold(circuitBreakerFailureThreshold)
            .waitDurationInOpenState(circuitBreakerRecoveryTimeout)
            .recordException(ExceptionClassifier::isCircuitBreakerFailure)
            .slidingWindowSize(SLIDING_WINDOW_SIZE)
            .minimumNumberOfCalls(MINIMUM_NUMBER_OF_CALLS)
            .build();

    return CircuitBreaker.of(name, config);
  }

  public boolean isCircuitBreakerEnabled() {
    return circuitBreakerEnabled;
  }

  public int getCircuitBreakerFailureThreshold() {
    return circuitBreakerFailureThreshold;
  }

  public Duration getCircuitBreakerRecoveryTimeout() {
    return circuitBreakerRecoveryTimeout;
  }

  /**
   * Validates the resilience configuration.
   *
   * @throws IllegalArgumentException if configuration is invalid
   */
  public void validate() {
    if (circuitBreakerFailureThreshold <= 0 || circuitBreakerFailureThreshold > 100) {
      throw new IllegalArgumentException(
          "Circuit breaker failure threshold must be between 1 and 100: "
              + circuitBreakerFailureThreshold);
    }

    if (circuitBreakerRecoveryTimeout.isNegative() || circuitBreakerRecoveryTimeout.isZero()) {
      throw new IllegalArgumentException(
          "Circuit breaker recovery timeout must be positive: " + circuitBreakerRecoveryTimeout);
    }

    logger.debug("Resilience configuration validation passed");
  }
}
