package uow;

/**
 * Programming error: a {@link UnitOfWork} operation was invoked outside a valid open
 * scope, or a second scope was acquired before the first was released.
 */
public final class ScopeMisuseException extends IllegalStateException {
  public ScopeMisuseException(String message) {
    super(message);
  }
}
