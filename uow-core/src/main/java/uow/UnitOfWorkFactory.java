package uow;

/**
 * Creates independent {@link UnitOfWork} instances, one per use-case invocation.
 *
 * <p>Instances are not thread-safe; concurrent callers each obtain their own.
 */
@FunctionalInterface
public interface UnitOfWorkFactory {

  /**
   * Creates a new unit of work. No storage resource is touched until
   * {@link UnitOfWork#acquire()}.
   */
  UnitOfWork create();
}
