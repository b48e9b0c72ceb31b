package uow;

/**
 * Base type for failures reported by the storage behind a {@link UnitOfWork}.
 *
 * @see CommitException
 * @see RollbackException
 */
public class UnitOfWorkException extends RuntimeException {
  public UnitOfWorkException(String message) {
    super(message);
  }

  public UnitOfWorkException(String message, Throwable cause) {
    super(message, cause);
  }
}
