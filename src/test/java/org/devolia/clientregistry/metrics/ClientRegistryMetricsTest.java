package org.devolia.clientregistry.metrics;

import static org.junit.jupiter.api.Assertions.*;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ClientRegistryMetrics.
 *
 * @author Devolia
 * @since 1.0.0
 */
class ClientRegistryMetricsTest {

  private MeterRegistry meterRegistry;
  private ClientRegistryMetrics metrics;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    metrics = new ClientRegistryMetrics(meterRegistry, "test-registry");
  }

  @Test
  void testRecordOperation() {
    metrics.recordOperation("register", "success", TimeUnit.MILLISECONDS.toNanos(20));
    metrics.recordOperation("register", "success", TimeUnit.MILLISECONDS.toNanos(40));
    metrics.recordOperation("register", "conflict", TimeUnit.MILLISECONDS.toNanos(30));

    assertEquals(2.0, metrics.getOperationCount("register", "success"));
    assertEquals(1.0, metrics.getOperationCount("register", "conflict"));
    assertEquals(0.0, metrics.getOperationCount("delete", "success"));
    assertEquals(30.0, metrics.getMeanLatencyMs("register"), 0.001);
  }

  @Test
  void testMetersAreTagged() {
    metrics.recordOperation("get", "not_found", 1000);

    assertNotNull(
        meterRegistry
            .find("client_registry_requests_total")
            .tag("operation", "get")
            .tag("status", "not_found")
            .tag("registry", "test-registry")
            .counter());
    assertNotNull(
        meterRegistry
            .find("client_registry_latency_seconds")
            .tag("operation", "get")
            .timer());
  }

  @Test
  void testCacheHitRatio() {
    assertEquals(0.0, metrics.getCacheHitRatio());

    metrics.incrementCacheHit();
    metrics.incrementCacheHit();
    metrics.incrementCacheHit();
    metrics.incrementCacheMiss();

    assertEquals(3.0, metrics.getCacheHitCount());
    assertEquals(1.0, metrics.getCacheMissCount());
    assertEquals(0.75, metrics.getCacheHitRatio(), 0.001);
  }

  @Test
  void testCircuitBreakerState() {
    metrics.recordCircuitBreakerState("open");
    assertEquals(1.0, metrics.getCircuitBreakerState());
    assertEquals(
        1.0,
        meterRegistry.find("client_registry_circuit_breaker_state").gauge().value(),
        0.001);

    metrics.recordCircuitBreakerState("half_open");
    assertEquals(0.5, metrics.getCircuitBreakerState());

    metrics.recordCircuitBreakerState("closed");
    assertEquals(0.0, metrics.getCircuitBreakerState());
  }

  @Test
  void testDefaultRegistryName() {
    ClientRegistryMetrics unnamed = new ClientRegistryMetrics(new SimpleMeterRegistry(), null);
    unnamed.recordOperation("list", "success", 1);

    assertEquals(1.0, unnamed.getOperationCount("list", "success"));
  }
}
