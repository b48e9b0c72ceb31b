package uow;

import uow.repository.BatchRepository;

/**
 * Transactional boundary grouping repository writes into one all-or-nothing outcome.
 *
 * <p>Rollback is the default: work becomes durable only through an explicit
 * {@link #commit()}. Every other way out of a scope (an exception, an early return, a
 * forgotten commit) leaves storage untouched. Use via try-with-resources on the returned
 * {@link Scope}:
 * <pre>{@code
 * try (Scope scope = unitOfWork.acquire()) {
 *     scope.batches().add(batch);
 *     scope.commit();
 * }
 * }</pre>
 *
 * <p>An instance holds at most one open scope and is not safe for concurrent use.
 * Concurrent use-cases each take their own instance from a {@link UnitOfWorkFactory}.
 *
 * @see Scope
 * @see AbstractUnitOfWork
 */
public interface UnitOfWork extends AutoCloseable {

  /**
   * Opens a new scope. Each call after a release yields an independent scope.
   *
   * @return the scope handle; close it to release
   * @throws ScopeMisuseException if a scope of this instance is still open
   * @throws UnitOfWorkException  if the storage resource cannot be obtained
   */
  Scope acquire();

  /**
   * Makes every write performed through this scope's repositories durable. Calling it
   * again after success has no effect.
   *
   * @throws ScopeMisuseException if no scope is open
   * @throws CommitException      if the storage rejects the transaction; the scope stays
   *                              uncommitted and release rolls it back
   */
  void commit();

  /**
   * Ends the open scope: rolls back unless committed. Does nothing if no scope is open.
   *
   * @throws RollbackException if the rollback itself fails
   */
  void release();

  /**
   * Returns the batch repository bound to the open scope.
   *
   * @throws ScopeMisuseException before {@link #acquire()} or after {@link #release()}
   */
  BatchRepository batches();

  /**
   * Returns the lifecycle state of this instance.
   */
  ScopeState state();

  /**
   * Returns {@code true} while a scope is open.
   */
  default boolean isOpen() {
    return state() == ScopeState.OPEN;
  }

  /**
   * Returns {@code true} once the current (or last) scope committed.
   */
  boolean isCommitted();

  /**
   * Identifies the current (or last) scope; each {@link #acquire()} yields a new value.
   * Zero until the first scope opens.
   */
  long scopeId();

  /**
   * Runs {@code work} in a fresh scope and releases it on every exit path. The body
   * still has to call {@link Scope#commit()} for its writes to persist.
   *
   * @param work the scope body
   * @param <T>  result type
   * @return whatever {@code work} returned
   */
  default <T> T execute(ScopeCallback<T> work) {
    try (Scope scope = acquire()) {
      return work.doInScope(scope);
    }
  }

  /**
   * Releases any open scope, then disposes resources the instance kept between scopes.
   */
  @Override
  void close();
}
