package uow.spring.boot;

import uow.UnitOfWorkFactory;
import uow.jdbc.DataSourceConnectionProvider;
import uow.jdbc.JdbcBatchRepository;
import uow.jdbc.JdbcSchemas;
import uow.jdbc.JdbcUnitOfWorkFactory;
import uow.repository.BatchRepository;
import uow.spi.ConnectionProvider;
import uow.spi.MetricsExporter;
import uow.spi.RepositoryFactory;
import uow.spring.SpringUnitOfWorkFactory;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * Auto-configuration for the unit of work.
 *
 * <p>Wires a {@link UnitOfWorkFactory} from a {@link DataSource} and
 * {@link UnitOfWorkProperties}: {@code uow.mode=jdbc} (default) hands out
 * {@link uow.jdbc.JdbcUnitOfWork} instances, {@code uow.mode=spring} hands out
 * {@link uow.spring.SpringUnitOfWork} instances bound to the application's
 * {@link PlatformTransactionManager}.
 *
 * @see UnitOfWorkProperties
 * @see UnitOfWorkMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(UnitOfWorkFactory.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(UnitOfWorkProperties.class)
public class UnitOfWorkAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(UnitOfWorkFactory.class)
  public UnitOfWorkFactory unitOfWorkFactory(UnitOfWorkProperties props,
      DataSource dataSource,
      ConnectionProvider connectionProvider,
      ObjectProvider<PlatformTransactionManager> transactionManagerProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    if (props.isInitializeSchema()) {
      JdbcSchemas.create(dataSource);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    RepositoryFactory<BatchRepository> repositories =
        JdbcBatchRepository.factory(props.getBatchTable(), props.getAllocationTable());

    return switch (props.getMode()) {
      case JDBC -> new JdbcUnitOfWorkFactory(
          connectionProvider, props.getReleasePolicy(), repositories, metrics);
      case SPRING -> {
        PlatformTransactionManager transactionManager = transactionManagerProvider.getIfAvailable();
        if (transactionManager == null) {
          throw new IllegalStateException(
              "uow.mode=spring requires a PlatformTransactionManager bean");
        }
        yield new SpringUnitOfWorkFactory(transactionManager, dataSource, repositories, metrics);
      }
    };
  }
}
