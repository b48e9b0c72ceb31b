package uow.spring;

import uow.AbstractUnitOfWork;
import uow.CommitException;
import uow.RollbackException;
import uow.UnitOfWorkException;
import uow.jdbc.JdbcBatchRepository;
import uow.jdbc.RepositoryException;
import uow.jdbc.ScopedTxContext;
import uow.repository.BatchRepository;
import uow.spi.Flushable;
import uow.spi.MetricsExporter;
import uow.spi.RepositoryFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Unit of work whose scopes are Spring-managed transactions.
 *
 * <p>{@link #acquire()} starts a transaction through the {@link PlatformTransactionManager}
 * and binds repositories to the transactional connection obtained via
 * {@link DataSourceUtils}. Scopes always run in a new transaction
 * ({@link TransactionDefinition#PROPAGATION_REQUIRES_NEW}), suspending any transaction
 * already active on the thread, so the scope alone decides the outcome of its writes.
 * Connection lifetime belongs to the transaction manager. Repositories of a scope stop
 * working once {@link #commit()} is attempted.
 *
 * @see AbstractUnitOfWork
 */
public final class SpringUnitOfWork extends AbstractUnitOfWork {
  private static final Logger logger = Logger.getLogger(SpringUnitOfWork.class.getName());

  private final PlatformTransactionManager transactionManager;
  private final DataSource dataSource;
  private final TransactionDefinition definition;
  private final RepositoryFactory<? extends BatchRepository> repositoryFactory;

  private TransactionStatus status;
  private Connection connection;
  private ScopedTxContext txContext;
  private BatchRepository repository;

  public SpringUnitOfWork(PlatformTransactionManager transactionManager, DataSource dataSource) {
    this(transactionManager, dataSource, JdbcBatchRepository::new, MetricsExporter.NOOP);
  }

  public SpringUnitOfWork(
      PlatformTransactionManager transactionManager,
      DataSource dataSource,
      RepositoryFactory<? extends BatchRepository> repositoryFactory,
      MetricsExporter metrics) {
    super(metrics);
    this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.repositoryFactory = Objects.requireNonNull(repositoryFactory, "repositoryFactory");
    this.definition = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  protected BatchRepository doBegin() {
    TransactionStatus started;
    try {
      started = transactionManager.getTransaction(definition);
    } catch (TransactionException e) {
      throw new UnitOfWorkException("Failed to open scope", e);
    }
    Connection conn;
    try {
      conn = DataSourceUtils.getConnection(dataSource);
    } catch (DataAccessException e) {
      transactionManager.rollback(started);
      throw new UnitOfWorkException("Failed to open scope", e);
    }
    status = started;
    connection = conn;
    txContext = new ScopedTxContext(conn);
    repository = repositoryFactory.create(txContext);
    return repository;
  }

  @Override
  protected void doCommit() {
    try {
      if (repository instanceof Flushable flushable) {
        flushable.flush();
      }
    } catch (RepositoryException e) {
      releaseHandle();
      throw new CommitException("Commit failed", e);
    }
    releaseHandle();
    try {
      transactionManager.commit(status);
    } catch (TransactionException | DataAccessException e) {
      throw new CommitException("Commit failed", e);
    }
  }

  @Override
  protected void doRollback() {
    releaseHandle();
    if (status.isCompleted()) {
      // a failed commit already completed the transaction
      logger.log(Level.FINE, "Transaction already completed, nothing to roll back");
      return;
    }
    try {
      transactionManager.rollback(status);
    } catch (TransactionException | DataAccessException e) {
      throw new RollbackException("Rollback failed", e);
    }
  }

  @Override
  protected void doCleanupAfterCompletion(boolean committed) {
    releaseHandle();
    txContext = null;
    repository = null;
    status = null;
  }

  // Hands the connection back while the transaction is still bound, so the manager
  // alone closes it on completion.
  private void releaseHandle() {
    if (connection != null) {
      txContext.deactivate();
      DataSourceUtils.releaseConnection(connection, dataSource);
      connection = null;
    }
  }

  @Override
  public String toString() {
    return "SpringUnitOfWork[" + state() + "]";
  }
}
