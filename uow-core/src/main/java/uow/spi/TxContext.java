package uow.spi;

import java.sql.Connection;

/**
 * The transactional resource of one open scope, as seen by the repositories bound to it.
 *
 * <p>Repositories hold a non-owning reference: they read {@link #currentConnection()} on
 * every call and never open, commit or close the connection themselves. Once the scope is
 * released the context goes inactive and every further access fails.
 */
public interface TxContext {

  /**
   * Returns {@code true} while the owning scope is open.
   */
  boolean isActive();

  /**
   * Returns the JDBC connection of the owning scope.
   *
   * @throws uow.ScopeMisuseException if the scope has been released
   */
  Connection currentConnection();
}
