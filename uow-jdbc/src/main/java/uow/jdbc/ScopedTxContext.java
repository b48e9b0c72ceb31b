package uow.jdbc;

import uow.ScopeMisuseException;
import uow.spi.TxContext;

import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} for one scope. Deactivated once commit runs, whatever its outcome, or
 * on release, after which repositories built on it fail fast instead of touching a
 * connection they no longer own.
 */
public final class ScopedTxContext implements TxContext {
  private final Connection connection;
  private boolean active = true;

  public ScopedTxContext(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public boolean isActive() {
    return active;
  }

  @Override
  public Connection currentConnection() {
    if (!active) {
      throw new ScopeMisuseException("Scope already committed or released; its repositories are no longer usable");
    }
    return connection;
  }

  /**
   * Marks the scope as ended. Does not close the connection.
   */
  public void deactivate() {
    active = false;
  }
}
