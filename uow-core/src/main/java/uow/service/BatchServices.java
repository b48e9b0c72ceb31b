package uow.service;

import uow.Scope;
import uow.UnitOfWork;
import uow.model.Allocations;
import uow.model.Batch;
import uow.model.OrderLine;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stock allocation use-cases. Each call opens one scope on the given unit of work,
 * commits explicitly on success, and lets any failure propagate after the scope has
 * rolled back.
 */
public final class BatchServices {
  private static final Logger logger = Logger.getLogger(BatchServices.class.getName());

  /**
   * Registers a new batch of stock.
   *
   * @param eta expected arrival, {@code null} for warehouse stock
   */
  public static void addBatch(String reference, String sku, int quantity, LocalDate eta, UnitOfWork uow) {
    Objects.requireNonNull(uow, "uow");
    Batch batch = new Batch(reference, sku, quantity, eta);
    try (Scope scope = uow.acquire()) {
      scope.batches().add(batch);
      scope.commit();
    }
    logger.log(Level.FINE, "Added batch {0}", reference);
  }

  /**
   * Allocates an order line to the preferred batch stocking its SKU.
   *
   * @return the reference of the chosen batch
   * @throws InvalidSkuException             if no batch stocks {@code sku}
   * @throws uow.model.OutOfStockException   if no batch has enough stock
   */
  public static String allocate(String orderId, String sku, int quantity, UnitOfWork uow) {
    Objects.requireNonNull(uow, "uow");
    OrderLine line = new OrderLine(orderId, sku, quantity);
    try (Scope scope = uow.acquire()) {
      List<Batch> batches = scope.batches().list();
      if (!isValidSku(sku, batches)) {
        throw new InvalidSkuException(sku);
      }
      String reference = Allocations.allocate(line, batches);
      scope.commit();
      logger.log(Level.FINE, "Allocated {0} to batch {1}", new Object[] {orderId, reference});
      return reference;
    }
  }

  /**
   * Removes an order line from the batch it was allocated to.
   *
   * @return {@code true} if the line was allocated to that batch
   * @throws InvalidBatchException if the batch does not exist
   */
  public static boolean deallocate(String orderId, String sku, int quantity, String reference, UnitOfWork uow) {
    Objects.requireNonNull(uow, "uow");
    OrderLine line = new OrderLine(orderId, sku, quantity);
    try (Scope scope = uow.acquire()) {
      Batch batch = scope.batches().get(reference)
          .orElseThrow(() -> new InvalidBatchException(reference));
      boolean removed = batch.deallocate(line);
      scope.commit();
      return removed;
    }
  }

  private static boolean isValidSku(String sku, List<Batch> batches) {
    for (Batch batch : batches) {
      if (batch.sku().equals(sku)) {
        return true;
      }
    }
    return false;
  }

  private BatchServices() {}
}
