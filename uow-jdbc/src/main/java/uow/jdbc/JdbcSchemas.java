package uow.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Creates the batch and allocation tables from the bundled {@code schema/*.sql} scripts.
 *
 * <p>The script is picked from the JDBC URL: {@code jdbc:h2:} uses {@code schema/h2.sql},
 * {@code jdbc:postgresql:} uses {@code schema/postgresql.sql}. Scripts use
 * {@code CREATE TABLE IF NOT EXISTS} and can run repeatedly.
 */
public final class JdbcSchemas {
  private static final Map<String, String> SCRIPTS_BY_PREFIX = Map.of(
      "jdbc:h2:", "/schema/h2.sql",
      "jdbc:postgresql:", "/schema/postgresql.sql");

  private JdbcSchemas() {
  }

  /**
   * Creates the tables in the database behind {@code dataSource}.
   *
   * @throws IllegalStateException if the database is unsupported or the script fails
   */
  public static void create(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      create(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to create schema", e);
    }
  }

  /**
   * Creates the tables using {@code conn}, committing if it is not in auto-commit mode.
   */
  public static void create(Connection conn) throws SQLException {
    String script = load(scriptFor(conn.getMetaData().getURL()));
    try (Statement stmt = conn.createStatement()) {
      for (String sql : script.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
    if (!conn.getAutoCommit()) {
      conn.commit();
    }
  }

  /**
   * Returns the classpath location of the schema script for a JDBC URL.
   *
   * @throws IllegalArgumentException if no script matches
   */
  public static String scriptFor(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, String> entry : SCRIPTS_BY_PREFIX.entrySet()) {
      if (url.startsWith(entry.getKey())) {
        return entry.getValue();
      }
    }
    throw new IllegalArgumentException("No schema script for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + SCRIPTS_BY_PREFIX.keySet());
  }

  private static String load(String path) {
    try (InputStream is = JdbcSchemas.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IllegalStateException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + path, e);
    }
  }
}
