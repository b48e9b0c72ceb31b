package uow.spi;

/**
 * Observability hook for exporting unit-of-work counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of scopes opened by {@code acquire()}.
   */
  void incrementScopeOpened();

  /**
   * Increments the count of scopes released, whatever their outcome.
   */
  void incrementScopeClosed();

  /**
   * Increments the count of successful commits.
   */
  void incrementCommitted();

  /**
   * Increments the count of scopes rolled back on release.
   */
  void incrementRolledBack();

  /**
   * Increments the count of commits rejected by the storage.
   */
  void incrementCommitFailure();

  /**
   * Increments the count of rollbacks that themselves failed.
   */
  void incrementRollbackFailure();

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementScopeOpened() {
    }

    @Override
    public void incrementScopeClosed() {
    }

    @Override
    public void incrementCommitted() {
    }

    @Override
    public void incrementRolledBack() {
    }

    @Override
    public void incrementCommitFailure() {
    }

    @Override
    public void incrementRollbackFailure() {
    }
  }
}
