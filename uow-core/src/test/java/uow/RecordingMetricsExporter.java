package uow;

import uow.spi.MetricsExporter;

class RecordingMetricsExporter implements MetricsExporter {
  int opened;
  int closed;
  int committed;
  int rolledBack;
  int commitFailures;
  int rollbackFailures;

  @Override
  public void incrementScopeOpened() {
    opened++;
  }

  @Override
  public void incrementScopeClosed() {
    closed++;
  }

  @Override
  public void incrementCommitted() {
    committed++;
  }

  @Override
  public void incrementRolledBack() {
    rolledBack++;
  }

  @Override
  public void incrementCommitFailure() {
    commitFailures++;
  }

  @Override
  public void incrementRollbackFailure() {
    rollbackFailures++;
  }
}
