package uow;

/**
 * Thrown when the underlying storage rejects a commit (constraint violation, lost
 * connection, serialization conflict).
 *
 * <p>The scope stays open and uncommitted, so releasing it rolls the work back.
 * Commits are never retried.
 */
public final class CommitException extends UnitOfWorkException {
  public CommitException(String message, Throwable cause) {
    super(message, cause);
  }
}
