package uow;

/**
 * Thrown by {@link UnitOfWork#release()} when discarding uncommitted work fails.
 *
 * <p>Under try-with-resources this is attached as a suppressed exception to whatever
 * failure is already leaving the scope body, never in place of it.
 */
public final class RollbackException extends UnitOfWorkException {
  public RollbackException(String message, Throwable cause) {
    super(message, cause);
  }
}
