package org.devolia.clientregistry;

import io.agroal.api.AgroalDataSource;
import java.sql.SQLException;
import java.util.Base64;
import java.util.UUID;
import org.devolia.clientregistry.store.DatabaseConfig;

/**
 * Shared fixtures for tests that need a database or a secret key.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class TestDatabases {

  private TestDatabases() {}

  /**
   * Gets the URL of a fresh, private H2 in-memory database.
   *
   * @return the JDBC URL
   */
  public static String newH2Url() {
    return "jdbc:h2:mem:clients-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
  }

  /**
   * Builds a small pool over a fresh H2 database.
   *
   * @return the pooled data source; the caller closes it
   * @throws SQLException if the pool cannot be created
   */
  public static AgroalDataSource newH2DataSource() throws SQLException {
    return new DatabaseConfig(newH2Url(), "sa", "", 1, 4, 2000).buildDataSource();
  }

  /**
   * Gets a base64 256-bit key filled with the given byte.
   *
   * @param fill the byte value
   * @return the encoded key
   */
  public static String secretKey(int fill) {
    byte[] key = new byte[32];
    java.util.Arrays.fill(key, (byte) fill);
    return Base64.getEncoder().encodeToString(key);
  }
}
