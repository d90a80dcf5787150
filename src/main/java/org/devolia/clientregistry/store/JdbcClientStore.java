package org.devolia.clientregistry.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.devolia.clientregistry.model.Client;
import org.devolia.clientregistry.model.ClientView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDBC implementation of {@link ClientStore} over the {@code CLIENTES_API} table.
 *
 * <p>Writes run with auto-commit off and are committed explicitly; any failure rolls the
 * transaction back before the connection goes back to the pool.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class JdbcClientStore implements ClientStore {

  private static final Logger logger = LoggerFactory.getLogger(JdbcClientStore.class);

  static final String SCHEMA_RESOURCE = "/db/clientes_api.sql";

  private static final String SELECT_EXISTS = "SELECT 1 FROM CLIENTES_API WHERE CNPJ = ?";
  private static final String INSERT =
      "INSERT INTO CLIENTES_API (CNPJ, NOME, SECRET_ENC) VALUES (?, ?, ?)";
  private static final String SELECT_ALL = "SELECT CNPJ, NOME FROM CLIENTES_API ORDER BY NOME";
  private static final String SELECT_BY_CNPJ =
      "SELECT CNPJ, NOME FROM CLIENTES_API WHERE CNPJ = ?";
  private static final String SELECT_SECRET_FOR_UPDATE =
      "SELECT SECRET_ENC FROM CLIENTES_API WHERE CNPJ = ? FOR UPDATE";
  private static final String DELETE = "DELETE FROM CLIENTES_API WHERE CNPJ = ?";
  private static final String SELECT_SECRETS = "SELECT SECRET_ENC, NOME FROM CLIENTES_API";

  private final DataSource dataSource;

  public JdbcClientStore(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource cannot be null");
  }

  @Override
  public boolean insertIfAbsent(Client client) {
    return inTransaction(
        "insert client",
        conn -> {
          try (PreparedStatement exists = conn.prepareStatement(SELECT_EXISTS)) {
            exists.setString(1, client.getCnpj());
            try (ResultSet rs = exists.executeQuery()) {
              if (rs.next()) {
                logger.debug("Client already present: {}", client.getCnpj());
                return false;
              }
            }
          }

          try (PreparedStatement insert = conn.prepareStatement(INSERT)) {
            insert.setString(1, client.getCnpj());
            insert.setString(2, client.getNome());
            insert.setString(3, client.getSecretEncrypted());
            insert.executeUpdate();
          }
          logger.debug("Inserted client: {}", client.getCnpj());
          return true;
        });
  }

  @Override
  public List<ClientView> findAll() {
    List<ClientView> clients = new ArrayList<>();

    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(SELECT_ALL);
        ResultSet rs = stmt.executeQuery()) {

      while (rs.next()) {
        clients.add(new ClientView(rs.getString(1), rs.getString(2)));
      }

    } catch (SQLException e) {
      throw new ClientStoreException("Failed to list clients", e);
    }

    logger.debug("Listed {} clients", clients.size());
    return clients;
  }

  @Override
  public Optional<ClientView> findByCnpj(String cnpj) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(SELECT_BY_CNPJ)) {

      stmt.setString(1, cnpj);

      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new ClientView(rs.getString(1), rs.getString(2)));
      }

    } catch (SQLException e) {
      throw new ClientStoreException("Failed to find client", e);
    }
  }

  @Override
  public Optional<String> delete(String cnpj) {
    return inTransaction(
        "delete client",
        conn -> {
          String secretEncrypted;
          try (PreparedStatement select = conn.prepareStatement(SELECT_SECRET_FOR_UPDATE)) {
            select.setString(1, cnpj);
            try (ResultSet rs = select.executeQuery()) {
              if (!rs.next()) {
                return Optional.empty();
              }
              secretEncrypted = rs.getString(1);
            }
          }

          try (PreparedStatement delete = conn.prepareStatement(DELETE)) {
            delete.setString(1, cnpj);
            if (delete.executeUpdate() == 0) {
              return Optional.empty();
            }
          }
          logger.debug("Deleted client: {}", cnpj);
          return Optional.of(secretEncrypted);
        });
  }

  @Override
  public Map<String, String> findAllSecrets() {
    Map<String, String> secrets = new LinkedHashMap<>();

    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(SELECT_SECRETS);
        ResultSet rs = stmt.executeQuery()) {

      while (rs.next()) {
        secrets.put(rs.getString(1), rs.getString(2));
      }

    } catch (SQLException e) {
      throw new ClientStoreException("Failed to read client secrets", e);
    }

    return secrets;
  }

  /**
   * Creates the {@code CLIENTES_API} table if it does not exist.
   *
   * @throws ClientStoreException if the script cannot be read or executed
   */
  public void createSchema() {
    String script = readSchemaScript();

    try (Connection conn = dataSource.getConnection();
        Statement stmt = conn.createStatement()) {

      for (String sql : script.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }

    } catch (SQLException e) {
      throw new ClientStoreException("Failed to create schema", e);
    }

    logger.info("Client store schema ready");
  }

  private String readSchemaScript() {
    try (InputStream in = JdbcClientStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
      if (in == null) {
        throw new ClientStoreException(
            "Schema script not found: " + SCHEMA_RESOURCE, (Throwable) null);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ClientStoreException("Failed to read schema script", e);
    }
  }

  private <T> T inTransaction(String action, SqlWork<T> work) {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      throw new ClientStoreException("Failed to " + action, e);
    }
  }

  private static void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException rollbackFailure) {
      failure.addSuppressed(rollbackFailure);
    }
  }

  @FunctionalInterface
  private interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
  }
}
