package uow.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies the JDBC connections a unit of work runs its transactions on.
 *
 * <p>Callers own the returned connection and are responsible for closing it.
 *
 * @see uow.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
