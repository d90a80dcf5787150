package org.devolia.clientregistry.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CacheKey.
 *
 * @author Devolia
 * @since 1.0.0
 */
class CacheKeyTest {

  @Test
  void testStringForms() {
    assertEquals("CLIENTES:ALL", CacheKey.allClients().asString());
    assertEquals("CLIENTES:12345678000199", CacheKey.client("12345678000199").asString());
  }

  @Test
  void testClientKeysCompareByCnpj() {
    assertEquals(CacheKey.client("111"), CacheKey.client("111"));
    assertEquals(CacheKey.client("111").hashCode(), CacheKey.client("111").hashCode());
    assertNotEquals(CacheKey.client("111"), CacheKey.client("222"));
  }

  @Test
  void testClientNamedAllDoesNotCollideWithListKey() {
    CacheKey<?> client = CacheKey.client("ALL");

    assertEquals(CacheKey.allClients().asString(), client.asString());
    assertNotEquals(CacheKey.allClients(), client);
  }

  @Test
  void testAffectedKeys() {
    List<CacheKey<?>> keys = CacheKey.affectedBy("111");

    assertEquals(2, keys.size());
    assertTrue(keys.contains(CacheKey.allClients()));
    assertTrue(keys.contains(CacheKey.client("111")));
  }

  @Test
  void testNullCnpjRejected() {
    assertThrows(NullPointerException.class, () -> CacheKey.client(null));
  }
}
