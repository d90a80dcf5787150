package org.devolia.clientregistry.config;

import static org.junit.jupiter.api.Assertions.*;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.Map;
import org.devolia.clientregistry.TestDatabases;
import org.devolia.clientregistry.model.RegisterClientRequest;
import org.junit.jupiter.api.Test;

/**
 * Tests for ClientRegistryFactory configuration handling and startup.
 *
 * @author Devolia
 * @since 1.0.0
 */
class ClientRegistryFactoryTest {

  private static Map<String, String> validConfig() {
    Map<String, String> config = new HashMap<>();
    config.put(ClientRegistryFactory.CONFIG_DB_URL, TestDatabases.newH2Url());
    config.put(ClientRegistryFactory.CONFIG_DB_USER, "sa");
    config.put(ClientRegistryFactory.CONFIG_DB_INIT_SCHEMA, "true");
    config.put(ClientRegistryFactory.CONFIG_SECRET_KEY, TestDatabases.secretKey(5));
    return config;
  }

  @Test
  void testMissingDatabaseUrl() {
    Map<String, String> config = validConfig();
    config.remove(ClientRegistryFactory.CONFIG_DB_URL);
    ClientRegistryFactory factory = new ClientRegistryFactory();

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> factory.init(RegistrySettings.of(config)));
    assertTrue(e.getMessage().contains("db.url"));
  }

  @Test
  void testMissingSecretKey() {
    Map<String, String> config = validConfig();
    config.remove(ClientRegistryFactory.CONFIG_SECRET_KEY);
    ClientRegistryFactory factory = new ClientRegistryFactory();

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> factory.init(RegistrySettings.of(config)));
    assertTrue(e.getMessage().contains("secret.key"));
  }

  @Test
  void testInvalidValues() {
    ClientRegistryFactory factory = new ClientRegistryFactory();

    Map<String, String> badKey = validConfig();
    badKey.put(ClientRegistryFactory.CONFIG_SECRET_KEY, "c2hvcnQ=");
    assertThrows(IllegalStateException.class, () -> factory.init(RegistrySettings.of(badKey)));

    Map<String, String> badTtl = validConfig();
    badTtl.put(ClientRegistryFactory.CONFIG_CACHE_TTL, "0");
    assertThrows(IllegalStateException.class, () -> factory.init(RegistrySettings.of(badTtl)));

    Map<String, String> badThreshold = validConfig();
    badThreshold.put(ClientRegistryFactory.CONFIG_CB_THRESHOLD, "150");
    assertThrows(
        IllegalStateException.class, () -> factory.init(RegistrySettings.of(badThreshold)));

    Map<String, String> notANumber = validConfig();
    notANumber.put(ClientRegistryFactory.CONFIG_CACHE_MAX, "many");
    assertThrows(
        IllegalStateException.class, () -> factory.init(RegistrySettings.of(notANumber)));

    Map<String, String> badUrl = validConfig();
    badUrl.put(ClientRegistryFactory.CONFIG_DB_URL, "h2:mem:x");
    assertThrows(IllegalStateException.class, () -> factory.init(RegistrySettings.of(badUrl)));
  }

  @Test
  void testDefaults() {
    ClientRegistryFactory factory = new ClientRegistryFactory();
    factory.init(RegistrySettings.of(validConfig()));

    assertEquals("client-registry", factory.getName());
    assertEquals(300, factory.getCacheConfig().getCacheTtl());
    assertEquals(1000, factory.getCacheConfig().getCacheMaxSize());
    assertTrue(factory.getResilienceConfig().isCircuitBreakerEnabled());
    assertEquals(10, factory.getDatabaseConfig().getPoolMaxSize());
  }

  @Test
  void testCreateBeforeInit() {
    assertThrows(IllegalStateException.class, () -> new ClientRegistryFactory().create());
  }

  @Test
  void testCreateStartsWorkingRegistry() {
    ClientRegistryFactory factory = new ClientRegistryFactory();
    factory.init(RegistrySettings.of(validConfig()));

    try (ClientRegistry registry = factory.create(new SimpleMeterRegistry())) {
      assertEquals("client-registry", registry.getName());
      assertEquals(0, registry.getSecretIndex().size());

      String token =
          registry.getService().register(new RegisterClientRequest("123", "Acme")).getToken();

      assertEquals("Acme", registry.getService().authenticate(token).orElseThrow());
      assertEquals(1, registry.getService().listAll().size());
    }
  }

  @Test
  void testRestartRebuildsSecretIndex() {
    Map<String, String> config = validConfig();
    ClientRegistryFactory factory = new ClientRegistryFactory();
    factory.init(RegistrySettings.of(config));

    String token;
    try (ClientRegistry first = factory.create()) {
      token = first.getService().register(new RegisterClientRequest("123", "Acme")).getToken();

      // DB_CLOSE_DELAY=-1 keeps the in-memory database after the pool closes
      try (ClientRegistry second = factory.create()) {
        assertEquals(1, second.getSecretIndex().size());
        assertEquals("Acme", second.getService().authenticate(token).orElseThrow());
      }
    }
  }

  @Test
  void testCreateFailsWithoutSchema() {
    Map<String, String> config = validConfig();
    config.put(ClientRegistryFactory.CONFIG_DB_INIT_SCHEMA, "false");
    ClientRegistryFactory factory = new ClientRegistryFactory();
    factory.init(RegistrySettings.of(config));

    assertThrows(IllegalStateException.class, factory::create);
  }
}
