/**
 * Service Provider Interfaces (SPI) for plugging storage into a unit of work.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to supply connections, bind repositories to a scope, and export metrics.
 *
 * @see uow.spi.ConnectionProvider
 * @see uow.spi.TxContext
 * @see uow.spi.RepositoryFactory
 * @see uow.spi.MetricsExporter
 */
package uow.spi;
