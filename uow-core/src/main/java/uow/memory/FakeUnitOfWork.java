package uow.memory;

import uow.Scope;
import uow.ScopeMisuseException;
import uow.ScopeState;
import uow.UnitOfWork;
import uow.model.Batch;
import uow.repository.BatchRepository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory {@link UnitOfWork} for exercising use-case logic without a database.
 *
 * <p>Every scope works on the same {@link InMemoryBatchRepository}. Commit only raises a
 * flag; rollback does nothing because repository writes already hit the map. The handle
 * returned by {@link #batches()} is bound to its scope and fails with
 * {@link ScopeMisuseException} once that scope is released.
 *
 * <p>{@link #isCommitted()} stays {@code true} after release so tests can assert on it.
 */
public final class FakeUnitOfWork implements UnitOfWork {
  private final InMemoryBatchRepository batches;
  private ScopeState state = ScopeState.UNREGISTERED;
  private boolean committed;
  private long scopeId;

  public FakeUnitOfWork() {
    this(new InMemoryBatchRepository());
  }

  public FakeUnitOfWork(InMemoryBatchRepository batches) {
    this.batches = Objects.requireNonNull(batches, "batches");
  }

  @Override
  public Scope acquire() {
    if (state == ScopeState.OPEN) {
      throw new ScopeMisuseException("Scope already open; release it before acquiring again");
    }
    state = ScopeState.OPEN;
    scopeId++;
    return new Scope(this, scopeId);
  }

  @Override
  public void commit() {
    requireOpen("commit");
    committed = true;
  }

  @Override
  public void release() {
    if (state == ScopeState.OPEN) {
      state = ScopeState.CLOSED;
    }
  }

  @Override
  public BatchRepository batches() {
    requireOpen("batches");
    return new ScopedBatches(scopeId);
  }

  @Override
  public ScopeState state() {
    return state;
  }

  @Override
  public boolean isCommitted() {
    return committed;
  }

  @Override
  public long scopeId() {
    return scopeId;
  }

  /**
   * Returns the backing repository regardless of scope state, for assertions.
   */
  public InMemoryBatchRepository store() {
    return batches;
  }

  @Override
  public void close() {
    release();
  }

  private void requireOpen(String operation) {
    if (state != ScopeState.OPEN) {
      throw new ScopeMisuseException("Cannot call " + operation + "() without an open scope (state " + state + ")");
    }
  }

  private final class ScopedBatches implements BatchRepository {
    private final long owner;

    ScopedBatches(long owner) {
      this.owner = owner;
    }

    @Override
    public void add(Batch batch) {
      check();
      batches.add(batch);
    }

    @Override
    public Optional<Batch> get(String reference) {
      check();
      return batches.get(reference);
    }

    @Override
    public List<Batch> list() {
      check();
      return batches.list();
    }

    private void check() {
      if (state != ScopeState.OPEN || scopeId != owner) {
        throw new ScopeMisuseException("Repository of scope " + owner + " used after its scope was released");
      }
    }
  }
}
