package org.devolia.clientregistry.store;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalDataSourceConfigurationSupplier;
import io.agroal.api.security.NamePrincipal;
import io.agroal.api.security.SimplePassword;
import java.sql.SQLException;
import java.time.Duration;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration and factory for the pooled client store connection.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class DatabaseConfig {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

  public static final int DEFAULT_POOL_MIN_SIZE = 1;
  public static final int DEFAULT_POOL_MAX_SIZE = 10;
  public static final long DEFAULT_ACQUISITION_TIMEOUT_MS = 5000;

  private static final Pattern PASSWORD_PARAMETER =
      Pattern.compile("((?:password|pwd)=)[^&;]*", Pattern.CASE_INSENSITIVE);
  private static final Pattern AUTHORITY_PASSWORD = Pattern.compile("(//[^:/@?;]+:)[^@/]*@");

  private final String jdbcUrl;
  private final String user;
  private final String password;
  private final int poolMinSize;
  private final int poolMaxSize;
  private final Duration acquisitionTimeout;

  /**
   * Constructor with configuration values.
   *
   * @param jdbcUrl the JDBC URL
   * @param user the database user, or null
   * @param password the database password, or null
   * @param poolMinSize minimum pooled connections
   * @param poolMaxSize maximum pooled connections
   * @param acquisitionTimeoutMs how long to wait for a free connection, in milliseconds
   */
  public DatabaseConfig(
      String jdbcUrl,
      String user,
      String password,
      int poolMinSize,
      int poolMaxSize,
      long acquisitionTimeoutMs) {
    this.jdbcUrl = jdbcUrl;
    this.user = user;
    this.password = password;
    this.poolMinSize = poolMinSize;
    this.poolMaxSize = poolMaxSize;
    this.acquisitionTimeout = Duration.ofMillis(acquisitionTimeoutMs);

    logger.debug(
        "Database configuration initialized - URL: {}, pool: {}..{}, acquisition timeout: {}ms",
        maskJdbcUrl(jdbcUrl),
        poolMinSize,
        poolMaxSize,
        acquisitionTimeoutMs);
  }

  /**
   * Builds the Agroal connection pool.
   *
   * @return the pooled data source; the caller closes it
   * @throws SQLException if the pool cannot be created
   */
  public AgroalDataSource buildDataSource() throws SQLException {
    AgroalDataSourceConfigurationSupplier configuration =
        new AgroalDataSourceConfigurationSupplier()
            .connectionPoolConfiguration(
                pool ->
                    pool.minSize(poolMinSize)
                        .initialSize(poolMinSize)
                        .maxSize(poolMaxSize)
                        .acquisitionTimeout(acquisitionTimeout)
                        .connectionFactoryConfiguration(
                            factory -> {
                              factory.jdbcUrl(jdbcUrl);
                              if (user != null) {
                                factory.principal(new NamePrincipal(user));
                              }
                              if (password != null) {
                                factory.credential(new SimplePassword(password));
                              }
                              return factory;
                            }));

    AgroalDataSource dataSource = AgroalDataSource.from(configuration);
    logger.info(
        "Built connection pool for {} (max {} connections)", maskJdbcUrl(jdbcUrl), poolMaxSize);
    return dataSource;
  }

  /**
   * Masks credentials embedded in a JDBC URL for logging: {@code password=} parameters and the
   * password of a {@code user:password@host} authority.
   *
   * @param jdbcUrl the JDBC URL, may be null
   * @return the URL with passwords replaced by {@code ***}
   */
  public static String maskJdbcUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      return null;
    }
    String masked = PASSWORD_PARAMETER.matcher(jdbcUrl).replaceAll("$1***");
    return AUTHORITY_PASSWORD.matcher(masked).replaceAll("$1***@");
  }

  public String getJdbcUrl() {
    return jdbcUrl;
  }

  public String getUser() {
    return user;
  }

  public int getPoolMinSize() {
    return poolMinSize;
  }

  public int getPoolMaxSize() {
    return poolMaxSize;
  }

  public Duration getAcquisitionTimeout() {
    return acquisitionTimeout;
  }

  /**
   * Validates the database configuration.
   *
   * @throws IllegalArgumentException if configuration is invalid
   */
  public void validate() {
    if (jdbcUrl == null || !jdbcUrl.trim().startsWith("jdbc:")) {
      throw new IllegalArgumentException(
          "JDBC URL must start with 'jdbc:': " + maskJdbcUrl(jdbcUrl));
    }

    if (poolMinSize < 0) {
      throw new IllegalArgumentException("Pool min size cannot be negative: " + poolMinSize);
    }

    if (poolMaxSize <= 0 || poolMaxSize < poolMinSize) {
      throw new IllegalArgumentException(
          "Pool max size must be positive and at least the min size: " + poolMaxSize);
    }

    if (acquisitionTimeout.isNegative() || acquisitionTimeout.isZero()) {
      throw new IllegalArgumentException(
          "Acquisition timeout must be positive: " + acquisitionTimeout);
    }

    logger.debug("Database configuration validation passed");
  }
}
