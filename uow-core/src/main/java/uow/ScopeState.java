package uow;

/**
 * Lifecycle states of a {@link UnitOfWork}.
 *
 * <pre>
 * UNREGISTERED --acquire--&gt; OPEN --release--&gt; CLOSED --acquire--&gt; OPEN ...
 * </pre>
 *
 * Whether an open scope has committed is tracked separately by
 * {@link UnitOfWork#isCommitted()}.
 */
public enum ScopeState {
  /** Never acquired. */
  UNREGISTERED,
  /** A scope is open and repositories may be used. */
  OPEN,
  /** The last scope was released. */
  CLOSED
}
