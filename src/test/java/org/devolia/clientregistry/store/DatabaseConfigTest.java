package org.devolia.clientregistry.store;

import static org.junit.jupiter.api.Assertions.*;

import io.agroal.api.AgroalDataSource;
import java.sql.Connection;
import java.time.Duration;
import org.devolia.clientregistry.TestDatabases;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DatabaseConfig.
 *
 * @author Devolia
 * @since 1.0.0
 */
class DatabaseConfigTest {

  @Test
  void testValidConfiguration() {
    DatabaseConfig config = new DatabaseConfig("jdbc:h2:mem:x", "sa", "", 1, 10, 5000);

    assertDoesNotThrow(config::validate);
    assertEquals("jdbc:h2:mem:x", config.getJdbcUrl());
    assertEquals("sa", config.getUser());
    assertEquals(1, config.getPoolMinSize());
    assertEquals(10, config.getPoolMaxSize());
    assertEquals(Duration.ofSeconds(5), config.getAcquisitionTimeout());
  }

  @Test
  void testInvalidConfiguration() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new DatabaseConfig(null, null, null, 1, 10, 5000).validate());
    assertThrows(
        IllegalArgumentException.class,
        () -> new DatabaseConfig("postgres://db", null, null, 1, 10, 5000).validate());
    assertThrows(
        IllegalArgumentException.class,
        () -> new DatabaseConfig("jdbc:h2:mem:x", null, null, -1, 10, 5000).validate());
    assertThrows(
        IllegalArgumentException.class,
        () -> new DatabaseConfig("jdbc:h2:mem:x", null, null, 5, 2, 5000).validate());
    assertThrows(
        IllegalArgumentException.class,
        () -> new DatabaseConfig("jdbc:h2:mem:x", null, null, 1, 10, 0).validate());
  }

  @Test
  void testMaskJdbcUrl() {
    assertEquals(
        "jdbc:postgresql://db:5432/clients?user=app&password=***&ssl=true",
        DatabaseConfig.maskJdbcUrl(
            "jdbc:postgresql://db:5432/clients?user=app&password=s3cr3t&ssl=true"));
    assertEquals(
        "jdbc:postgresql://app:***@db/clients",
        DatabaseConfig.maskJdbcUrl("jdbc:postgresql://app:s3cr3t@db/clients"));
    assertEquals(
        "jdbc:h2:mem:x;USER=sa;PASSWORD=***",
        DatabaseConfig.maskJdbcUrl("jdbc:h2:mem:x;USER=sa;PASSWORD=s3cr3t"));
    assertEquals(
        "jdbc:postgresql://db:5432/clients",
        DatabaseConfig.maskJdbcUrl("jdbc:postgresql://db:5432/clients"));
    assertNull(DatabaseConfig.maskJdbcUrl(null));
  }

  @Test
  void testInvalidUrlMessageHidesPassword() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new DatabaseConfig("postgres://db?password=s3cr3t", null, null, 1, 10, 5000)
                .validate());

    assertFalse(e.getMessage().contains("s3cr3t"));
  }

  @Test
  void testBuildDataSource() throws Exception {
    try (AgroalDataSource dataSource =
            new DatabaseConfig(TestDatabases.newH2Url(), "sa", "", 1, 2, 2000).buildDataSource();
        Connection conn = dataSource.getConnection()) {
      assertTrue(conn.isValid(1));
    }
  }
}
