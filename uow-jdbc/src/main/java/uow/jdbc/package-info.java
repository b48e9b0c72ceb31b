/**
 * JDBC implementation of the unit of work.
 *
 * <p>{@link uow.jdbc.JdbcUnitOfWork} runs each scope as one transaction on a connection
 * from a {@link uow.spi.ConnectionProvider}; {@link uow.jdbc.JdbcBatchRepository} stores
 * batches and their allocations on that connection. {@link uow.jdbc.ReleasePolicy}
 * decides whether a released scope keeps or closes its connection.
 *
 * @see uow.jdbc.JdbcUnitOfWork
 * @see uow.jdbc.JdbcBatchRepository
 * @see uow.jdbc.JdbcUnitOfWorkFactory
 */
package uow.jdbc;
