package uow.jdbc;

import uow.AbstractUnitOfWork;
import uow.CommitException;
import uow.RollbackException;
import uow.UnitOfWorkException;
import uow.repository.BatchRepository;
import uow.spi.ConnectionProvider;
import uow.spi.Flushable;
import uow.spi.MetricsExporter;
import uow.spi.RepositoryFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Unit of work running each scope as one JDBC transaction on a connection from a
 * {@link ConnectionProvider}.
 *
 * <p>No connection is obtained until {@link #acquire()}. Each scope disables auto-commit,
 * builds its repositories on a fresh {@link ScopedTxContext}, and ends with
 * {@link Connection#commit()} (on {@link #commit()}) or {@link Connection#rollback()} (on
 * release without commit). A successful commit ends the scope's repositories: later calls
 * on them fail with {@link uow.ScopeMisuseException}. What happens to the connection
 * afterwards is decided by the {@link ReleasePolicy}.
 *
 * <pre>{@code
 * try (JdbcUnitOfWork uow = new JdbcUnitOfWork(new DataSourceConnectionProvider(ds));
 *      Scope scope = uow.acquire()) {
 *     scope.batches().add(new Batch("batch1", "sku1", 100, null));
 *     scope.commit();
 * }
 * }</pre>
 *
 * @see ReleasePolicy
 * @see JdbcUnitOfWorkFactory
 */
public final class JdbcUnitOfWork extends AbstractUnitOfWork {
  private static final Logger logger = Logger.getLogger(JdbcUnitOfWork.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ReleasePolicy releasePolicy;
  private final RepositoryFactory<? extends BatchRepository> repositoryFactory;

  private Connection connection;
  private ScopedTxContext txContext;
  private BatchRepository repository;
  private boolean discardConnection;

  /**
   * Creates a unit of work with {@link ReleasePolicy#RETAIN}, the default batch tables,
   * and no metrics.
   */
  public JdbcUnitOfWork(ConnectionProvider connectionProvider) {
    this(connectionProvider, ReleasePolicy.RETAIN, JdbcBatchRepository::new, MetricsExporter.NOOP);
  }

  /**
   * @param connectionProvider source of connections
   * @param releasePolicy      connection handling on release
   * @param repositoryFactory  binds the batch repository to each scope
   * @param metrics            metrics exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
   */
  public JdbcUnitOfWork(
      ConnectionProvider connectionProvider,
      ReleasePolicy releasePolicy,
      RepositoryFactory<? extends BatchRepository> repositoryFactory,
      MetricsExporter metrics) {
    super(metrics);
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.releasePolicy = Objects.requireNonNull(releasePolicy, "releasePolicy");
    this.repositoryFactory = Objects.requireNonNull(repositoryFactory, "repositoryFactory");
  }

  public ReleasePolicy releasePolicy() {
    return releasePolicy;
  }

  @Override
  protected BatchRepository doBegin() {
    Connection conn = retainedConnection();
    boolean fresh = conn == null;
    try {
      if (fresh) {
        conn = connectionProvider.getConnection();
      }
      conn.setAutoCommit(false);
    } catch (SQLException e) {
      if (fresh && conn != null) {
        closeQuietly(conn, false);
      }
      throw new UnitOfWorkException("Failed to open scope", e);
    }
    connection = conn;
    discardConnection = false;
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
      connection.commit();
    } catch (SQLException | RepositoryException e) {
      txContext.deactivate();
      throw new CommitException("Commit failed", e);
    }
    txContext.deactivate();
  }

  @Override
  protected void doRollback() {
    try {
      connection.rollback();
    } catch (SQLException e) {
      discardConnection = true;
      throw new RollbackException("Rollback failed", e);
    }
  }

  @Override
  protected void doCleanupAfterCompletion(boolean committed) {
    txContext.deactivate();
    txContext = null;
    repository = null;
    if (discardConnection) {
      closeConnection(false);
    } else if (releasePolicy == ReleasePolicy.CLOSE) {
      closeConnection(true);
    }
  }

  @Override
  protected void doClose() {
    closeConnection(true);
  }

  private Connection retainedConnection() {
    if (connection == null) {
      return null;
    }
    try {
      if (!connection.isClosed()) {
        return connection;
      }
    } catch (SQLException e) {
      logger.log(Level.FINE, "Retained connection unusable, obtaining a new one", e);
    }
    connection = null;
    return null;
  }

  private void closeConnection(boolean restoreAutoCommit) {
    Connection conn = connection;
    connection = null;
    if (conn != null) {
      closeQuietly(conn, restoreAutoCommit);
    }
  }

  private static void closeQuietly(Connection conn, boolean restoreAutoCommit) {
    if (restoreAutoCommit) {
      try {
        conn.setAutoCommit(true);
      } catch (SQLException e) {
        logger.log(Level.FINE, "Failed to restore auto-commit", e);
      }
    }
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close connection", e);
    }
  }

  @Override
  public String toString() {
    return "JdbcUnitOfWork[" + releasePolicy + ", " + state() + "]";
  }
}
