package uow.jdbc;

/**
 * What {@link JdbcUnitOfWork} does with its connection when a scope is released.
 */
public enum ReleasePolicy {
  /**
   * Keep the connection open and reuse it for the next scope of the same unit of work.
   * It is closed by {@link JdbcUnitOfWork#close()}, or replaced if a rollback failed.
   */
  RETAIN,
  /**
   * Close the connection at the end of every scope; the next scope obtains a fresh one.
   */
  CLOSE
}
