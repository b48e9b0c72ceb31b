package uow.jdbc;

import uow.model.Batch;
import uow.model.OrderLine;
import uow.repository.BatchRepository;
import uow.spi.Flushable;
import uow.spi.RepositoryFactory;
import uow.spi.TxContext;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link BatchRepository} over two tables: one row per batch and one row per allocated
 * order line.
 *
 * <p>Every batch added or loaded during the scope is kept in an identity map, so repeated
 * lookups return the same instance and allocation changes made through the domain model
 * are written by {@link #flush()} when the unit of work commits. All statements run on
 * the scope's connection; none of them commits.
 *
 * @see TableNames
 */
public final class JdbcBatchRepository implements BatchRepository, Flushable {
  private final TxContext txContext;
  private final String batchTable;
  private final String allocationTable;
  private final Map<String, Tracked> identityMap = new LinkedHashMap<>();

  public JdbcBatchRepository(TxContext txContext) {
    this(txContext, TableNames.DEFAULT_BATCH_TABLE, TableNames.DEFAULT_ALLOCATION_TABLE);
  }

  public JdbcBatchRepository(TxContext txContext, String batchTable, String allocationTable) {
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.batchTable = TableNames.validate(batchTable);
    this.allocationTable = TableNames.validate(allocationTable);
  }

  /**
   * Returns a factory binding repositories on the given tables.
   *
   * @throws IllegalArgumentException if a table name is invalid
   */
  public static RepositoryFactory<BatchRepository> factory(String batchTable, String allocationTable) {
    TableNames.validate(batchTable);
    TableNames.validate(allocationTable);
    return txContext -> new JdbcBatchRepository(txContext, batchTable, allocationTable);
  }

  @Override
  public void add(Batch batch) {
    Objects.requireNonNull(batch, "batch");
    Connection conn = txContext.currentConnection();
    JdbcTemplate.update(conn,
        "INSERT INTO " + batchTable + " (reference, sku, purchased_quantity, eta) VALUES (?, ?, ?, ?)",
        batch.reference(), batch.sku(), batch.purchasedQuantity(), batch.eta());
    for (OrderLine line : batch.allocations()) {
      insertAllocation(conn, batch.reference(), line);
    }
    identityMap.put(batch.reference(), new Tracked(batch));
  }

  @Override
  public Optional<Batch> get(String reference) {
    Objects.requireNonNull(reference, "reference");
    Connection conn = txContext.currentConnection();
    Tracked tracked = identityMap.get(reference);
    if (tracked != null) {
      return Optional.of(tracked.batch);
    }
    List<BatchRow> rows = JdbcTemplate.query(conn,
        "SELECT reference, sku, purchased_quantity, eta FROM " + batchTable + " WHERE reference = ?",
        JdbcBatchRepository::mapBatch, reference);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    List<AllocationRow> allocations = JdbcTemplate.query(conn,
        "SELECT batch_reference, orderid, sku, qty FROM " + allocationTable + " WHERE batch_reference = ?",
        JdbcBatchRepository::mapAllocation, reference);
    return Optional.of(track(rows.get(0), lines(allocations)));
  }

  @Override
  public List<Batch> list() {
    Connection conn = txContext.currentConnection();
    List<BatchRow> rows = JdbcTemplate.query(conn,
        "SELECT reference, sku, purchased_quantity, eta FROM " + batchTable + " ORDER BY reference",
        JdbcBatchRepository::mapBatch);
    Map<String, List<OrderLine>> allocationsByBatch = new HashMap<>();
    for (AllocationRow row : JdbcTemplate.query(conn,
        "SELECT batch_reference, orderid, sku, qty FROM " + allocationTable,
        JdbcBatchRepository::mapAllocation)) {
      allocationsByBatch.computeIfAbsent(row.batchReference(), k -> new ArrayList<>()).add(row.line());
    }
    List<Batch> batches = new ArrayList<>(rows.size());
    for (BatchRow row : rows) {
      Tracked tracked = identityMap.get(row.reference());
      if (tracked != null) {
        batches.add(tracked.batch);
      } else {
        batches.add(track(row, allocationsByBatch.getOrDefault(row.reference(), List.of())));
      }
    }
    return batches;
  }

  /**
   * Writes allocation changes of every batch seen in this scope.
   */
  @Override
  public void flush() {
    Connection conn = txContext.currentConnection();
    for (Tracked tracked : identityMap.values()) {
      Set<OrderLine> current = tracked.batch.allocations();
      for (OrderLine line : tracked.persisted) {
        if (!current.contains(line)) {
          JdbcTemplate.update(conn,
              "DELETE FROM " + allocationTable
                  + " WHERE batch_reference = ? AND orderid = ? AND sku = ? AND qty = ?",
              tracked.batch.reference(), line.orderId(), line.sku(), line.quantity());
        }
      }
      for (OrderLine line : current) {
        if (!tracked.persisted.contains(line)) {
          insertAllocation(conn, tracked.batch.reference(), line);
        }
      }
      tracked.persisted = new LinkedHashSet<>(current);
    }
  }

  private void insertAllocation(Connection conn, String batchReference, OrderLine line) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + allocationTable + " (batch_reference, orderid, sku, qty) VALUES (?, ?, ?, ?)",
        batchReference, line.orderId(), line.sku(), line.quantity());
  }

  private Batch track(BatchRow row, List<OrderLine> allocations) {
    Batch batch = Batch.restore(row.reference(), row.sku(), row.purchasedQuantity(), row.eta(), allocations);
    identityMap.put(batch.reference(), new Tracked(batch));
    return batch;
  }

  private static List<OrderLine> lines(List<AllocationRow> rows) {
    List<OrderLine> lines = new ArrayList<>(rows.size());
    for (AllocationRow row : rows) {
      lines.add(row.line());
    }
    return lines;
  }

  private static BatchRow mapBatch(ResultSet rs) throws SQLException {
    return new BatchRow(
        rs.getString("reference"),
        rs.getString("sku"),
        rs.getInt("purchased_quantity"),
        rs.getObject("eta", LocalDate.class));
  }

  private static AllocationRow mapAllocation(ResultSet rs) throws SQLException {
    return new AllocationRow(
        rs.getString("batch_reference"),
        new OrderLine(rs.getString("orderid"), rs.getString("sku"), rs.getInt("qty")));
  }

  private record BatchRow(String reference, String sku, int purchasedQuantity, LocalDate eta) {
  }

  private record AllocationRow(String batchReference, OrderLine line) {
  }

  private static final class Tracked {
    private final Batch batch;
    private Set<OrderLine> persisted;

    private Tracked(Batch batch) {
      this.batch = batch;
      this.persisted = new LinkedHashSet<>(batch.allocations());
    }
  }
}
