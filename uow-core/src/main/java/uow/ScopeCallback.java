package uow;

/**
 * Work executed inside a scope by {@link UnitOfWork#execute(ScopeCallback)}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ScopeCallback<T> {

  /**
   * Runs the body of the scope. Nothing is persisted unless the body calls
   * {@link Scope#commit()}.
   *
   * @param scope the open scope
   * @return the result handed back to the caller
   */
  T doInScope(Scope scope);
}
