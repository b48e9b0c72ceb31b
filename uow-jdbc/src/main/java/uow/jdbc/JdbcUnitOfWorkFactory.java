package uow.jdbc;

import uow.UnitOfWorkFactory;
import uow.repository.BatchRepository;
import uow.spi.ConnectionProvider;
import uow.spi.MetricsExporter;
import uow.spi.RepositoryFactory;

import java.util.Objects;

/**
 * Creates a new {@link JdbcUnitOfWork} per call, all sharing one configuration.
 */
public final class JdbcUnitOfWorkFactory implements UnitOfWorkFactory {
  private final ConnectionProvider connectionProvider;
  private final ReleasePolicy releasePolicy;
  private final RepositoryFactory<? extends BatchRepository> repositoryFactory;
  private final MetricsExporter metrics;

  public JdbcUnitOfWorkFactory(ConnectionProvider connectionProvider) {
    this(connectionProvider, ReleasePolicy.RETAIN, JdbcBatchRepository::new, MetricsExporter.NOOP);
  }

  public JdbcUnitOfWorkFactory(
      ConnectionProvider connectionProvider,
      ReleasePolicy releasePolicy,
      RepositoryFactory<? extends BatchRepository> repositoryFactory,
      MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.releasePolicy = Objects.requireNonNull(releasePolicy, "releasePolicy");
    this.repositoryFactory = Objects.requireNonNull(repositoryFactory, "repositoryFactory");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  @Override
  public JdbcUnitOfWork create() {
    return new JdbcUnitOfWork(connectionProvider, releasePolicy, repositoryFactory, metrics);
  }
}
