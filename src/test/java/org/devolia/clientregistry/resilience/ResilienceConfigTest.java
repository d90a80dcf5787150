package org.devolia.clientregistry.resilience;

import static org.junit.jupiter.api.Assertions.*;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.devolia.clientregistry.store.ClientStoreException;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ResilienceConfig.
 *
 * @author Devolia
 * @since 1.0.0
 */
class ResilienceConfigTest {

  @Test
  void testDefaultConfiguration() {
    ResilienceConfig config = ResilienceConfig.defaultConfig();

    assertTrue(config.isCircuitBreakerEnabled());
    assertEquals(50, config.getCircuitBreakerFailureThreshold());
    assertEquals(Duration.ofSeconds(30), config.getCircuitBreakerRecoveryTimeout());
    assertDoesNotThrow(config::validate);
  }

  @Test
  void testCircuitBreakerCreation() {
    CircuitBreaker circuitBreaker = ResilienceConfig.defaultConfig().buildCircuitBreaker("store");

    assertNotNull(circuitBreaker);
    assertEquals("store", circuitBreaker.getName());
    assertEquals(CircuitBreaker.State.CLOSED, circuitBreaker.getState());
  }

  @Test
  void testDisabledCircuitBreaker() {
    assertNull(new ResilienceConfig(false, 50, 30000).buildCircuitBreaker("store"));
  }

  @Test
  void testCircuitBreakerOpensOnStoreFailuresOnly() {
    CircuitBreaker circuitBreaker =
        new ResilienceConfig(true, 50, 60000).buildCircuitBreaker("store");

    // Duplicates are ignored by the breaker
    for (int i = 0; i < 10; i++) {
      circuitBreaker.onError(
          0,
          TimeUnit.NANOSECONDS,
          new ClientStoreException("dup", new SQLException("dup", "23505")));
    }
    assertEquals(CircuitBreaker.State.CLOSED, circuitBreaker.getState());

    for (int i = 0; i < 10; i++) {
      circuitBreaker.onError(
          0,
          TimeUnit.NANOSECONDS,
          new ClientStoreException("down", new SQLException("down", "08006")));
    }
    assertEquals(CircuitBreaker.State.OPEN, circuitBreaker.getState());
  }

  @Test
  void testValidation() {
    assertThrows(
        IllegalArgumentException.class, () -> new ResilienceConfig(true, 0, 1000).validate());
    assertThrows(
        IllegalArgumentException.class, () -> new ResilienceConfig(true, 101, 1000).validate());
    assertThrows(
        IllegalArgumentException.class, () -> new ResilienceConfig(true, 50, 0).validate());
  }
}
