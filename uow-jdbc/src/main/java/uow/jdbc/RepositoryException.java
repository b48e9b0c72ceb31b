package uow.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcBatchRepository} and
 * {@link JdbcTemplate}.
 */
public final class RepositoryException extends RuntimeException {
  public RepositoryException(String message, Throwable cause) {
    super(message, cause);
  }
}
