package uow;

import uow.repository.BatchRepository;
import uow.spi.MetricsExporter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scope state machine shared by storage-backed units of work.
 *
 * <p>Subclasses bind a real transaction in {@link #doBegin()}, {@link #doCommit()} and
 * {@link #doRollback()}; this class enforces the open/closed checks, the committed flag,
 * and the rule that every open scope reaches {@link ScopeState#CLOSED} exactly once.
 *
 * <p>A failed commit is final for its scope: the only valid call left is release, which
 * rolls back.
 */
public abstract class AbstractUnitOfWork implements UnitOfWork {
  private static final Logger logger = Logger.getLogger(AbstractUnitOfWork.class.getName());

  private final MetricsExporter metrics;
  private ScopeState state = ScopeState.UNREGISTERED;
  private boolean committed;
  private boolean commitFailed;
  private long scopeId;
  private BatchRepository batches;

  protected AbstractUnitOfWork(MetricsExporter metrics) {
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  @Override
  public final Scope acquire() {
    if (state == ScopeState.OPEN) {
      throw new ScopeMisuseException("Scope already open; release it before acquiring again");
    }
    BatchRepository repository = doBegin();
    committed = false;
    commitFailed = false;
    batches = repository;
    state = ScopeState.OPEN;
    scopeId++;
    metrics.incrementScopeOpened();
    logger.log(Level.FINE, "Scope {0} opened on {1}", new Object[] {scopeId, this});
    return new Scope(this, scopeId);
  }

  @Override
  public final void commit() {
    requireOpen("commit");
    if (committed) {
      return;
    }
    if (commitFailed) {
      throw new ScopeMisuseException("Commit already failed in this scope; release it");
    }
    try {
      doCommit();
    } catch (CommitException e) {
      commitFailed = true;
      batches = null;
      metrics.incrementCommitFailure();
      throw e;
    }
    committed = true;
    metrics.incrementCommitted();
  }

  @Override
  public final void release() {
    if (state != ScopeState.OPEN) {
      return;
    }
    RollbackException failure = null;
    try {
      if (!committed) {
        doRollback();
        metrics.incrementRolledBack();
      }
    } catch (RollbackException e) {
      metrics.incrementRollbackFailure();
      logger.log(Level.WARNING, "Rollback failed while releasing scope", e);
      failure = e;
    } finally {
      state = ScopeState.CLOSED;
      batches = null;
      boolean outcome = committed;
      runSafely("cleanup", () -> doCleanupAfterCompletion(outcome));
      metrics.incrementScopeClosed();
    }
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public final BatchRepository batches() {
    requireOpen("batches");
    if (commitFailed) {
      throw new ScopeMisuseException("Commit already failed in this scope; release it");
    }
    return batches;
  }

  @Override
  public final ScopeState state() {
    return state;
  }

  @Override
  public final boolean isCommitted() {
    return committed;
  }

  @Override
  public final long scopeId() {
    return scopeId;
  }

  @Override
  public final void close() {
    try {
      release();
    } finally {
      runSafely("close", this::doClose);
    }
  }

  /**
   * Obtains the transactional resource, begins the transaction, and builds the
   * repositories bound to it.
   *
   * @throws UnitOfWorkException if the resource cannot be obtained
   */
  protected abstract BatchRepository doBegin();

  /**
   * Persists the open transaction.
   *
   * @throws CommitException if the storage rejects it
   */
  protected abstract void doCommit();

  /**
   * Discards the open transaction.
   *
   * @throws RollbackException if the storage fails to roll back
   */
  protected abstract void doRollback();

  /**
   * Invoked once per scope after commit or rollback, whatever their outcome.
   * Exceptions are logged and swallowed.
   *
   * @param committed whether the scope committed
   */
  protected void doCleanupAfterCompletion(boolean committed) {
  }

  /**
   * Disposes resources retained across scopes. Exceptions are logged and swallowed.
   */
  protected void doClose() {
  }

  private void runSafely(String phase, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Unit of work " + phase + " failed", e);
    }
  }

  private void requireOpen(String operation) {
    if (state != ScopeState.OPEN) {
      throw new ScopeMisuseException("Cannot call " + operation + "() without an open scope (state " + state + ")");
    }
  }
}
