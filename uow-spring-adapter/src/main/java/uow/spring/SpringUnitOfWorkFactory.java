package uow.spring;

import uow.UnitOfWorkFactory;
import uow.repository.BatchRepository;
import uow.spi.MetricsExporter;
import uow.spi.RepositoryFactory;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Creates {@link SpringUnitOfWork} instances sharing one transaction manager.
 */
public final class SpringUnitOfWorkFactory implements UnitOfWorkFactory {
  private final PlatformTransactionManager transactionManager;
  private final DataSource dataSource;
  private final RepositoryFactory<? extends BatchRepository> repositoryFactory;
  private final MetricsExporter metrics;

  public SpringUnitOfWorkFactory(
      PlatformTransactionManager transactionManager,
      DataSource dataSource,
      RepositoryFactory<? extends BatchRepository> repositoryFactory,
      MetricsExporter metrics) {
    this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.repositoryFactory = Objects.requireNonNull(repositoryFactory, "repositoryFactory");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  @Override
  public SpringUnitOfWork create() {
    return new SpringUnitOfWork(transactionManager, dataSource, repositoryFactory, metrics);
  }
}
