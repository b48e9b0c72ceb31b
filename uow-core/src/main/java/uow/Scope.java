package uow;

import uow.repository.BatchRepository;

import java.util.Objects;

/**
 * Handle on one open scope of a {@link UnitOfWork}. Closing it releases the scope,
 * which rolls back unless {@link #commit()} succeeded.
 *
 * <p>A handle is bound to the scope it was acquired for. Once that scope has ended,
 * whether the handle was closed or the owner released it directly and possibly opened
 * a newer scope, {@link #batches()} and {@link #commit()} fail with
 * {@link ScopeMisuseException} and {@link #close()} does nothing.
 */
public final class Scope implements AutoCloseable {
  private final UnitOfWork owner;
  private final long id;
  private boolean closed;

  public Scope(UnitOfWork owner, long id) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.id = id;
  }

  public BatchRepository batches() {
    requireOpen();
    return owner.batches();
  }

  public void commit() {
    requireOpen();
    owner.commit();
  }

  public boolean isCommitted() {
    return isCurrent() && owner.isCommitted();
  }

  public boolean isClosed() {
    return closed || !isCurrent() || !owner.isOpen();
  }

  public UnitOfWork unitOfWork() {
    return owner;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (isCurrent()) {
      owner.release();
    }
  }

  private boolean isCurrent() {
    return owner.scopeId() == id;
  }

  private void requireOpen() {
    if (closed) {
      throw new ScopeMisuseException("Scope already released");
    }
    if (!isCurrent()) {
      throw new ScopeMisuseException("Scope " + id + " was superseded by scope " + owner.scopeId());
    }
  }
}
