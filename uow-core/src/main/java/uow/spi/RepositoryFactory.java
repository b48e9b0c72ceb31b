package uow.spi;

/**
 * Builds a repository bound to the transactional resource of a freshly opened scope.
 *
 * <p>Called once per {@code acquire()}. Implementations only bind; they must not perform
 * I/O.
 *
 * @param <R> repository type
 */
@FunctionalInterface
public interface RepositoryFactory<R> {

  R create(TxContext txContext);
}
