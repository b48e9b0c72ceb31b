package uow.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSchemasTest {

  @Test
  void scriptForKnownUrls() {
    assertEquals("/schema/h2.sql", JdbcSchemas.scriptFor("jdbc:h2:mem:test"));
    assertEquals("/schema/postgresql.sql", JdbcSchemas.scriptFor("jdbc:postgresql://localhost:5432/db"));
    assertEquals("/schema/h2.sql", JdbcSchemas.scriptFor("JDBC:H2:mem:upper"));
  }

  @Test
  void scriptForUnsupportedUrlThrows() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
        JdbcSchemas.scriptFor("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(e.getMessage().contains("jdbc:oracle"));
  }

  @Test
  void scriptForNullOrEmptyThrows() {
    assertThrows(IllegalArgumentException.class, () -> JdbcSchemas.scriptFor(null));
    assertThrows(IllegalArgumentException.class, () -> JdbcSchemas.scriptFor(""));
  }

  @Test
  void createBuildsBothTablesAndIsRepeatable() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:schema_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

    JdbcSchemas.create(ds);
    JdbcSchemas.create(ds);

    try (Connection conn = ds.getConnection()) {
      assertTrue(tableExists(conn, "BATCHES"));
      assertTrue(tableExists(conn, "ALLOCATIONS"));
    }
  }

  @Test
  void createOnTransactionalConnectionCommits() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:schema_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

    try (Connection conn = ds.getConnection()) {
      conn.setAutoCommit(false);
      JdbcSchemas.create(conn);
      conn.rollback();
    }

    try (Connection conn = ds.getConnection()) {
      assertTrue(tableExists(conn, "BATCHES"));
    }
  }

  private static boolean tableExists(Connection conn, String table) throws SQLException {
    try (ResultSet rs = conn.getMetaData().getTables(null, null, table, null)) {
      return rs.next();
    }
  }
}
