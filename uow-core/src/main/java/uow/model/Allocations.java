package uow.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Domain service choosing which batch takes an order line.
 */
public final class Allocations {

  /**
   * Allocates {@code line} to the preferred batch that can take it.
   *
   * @param line    the order line
   * @param batches candidate batches, in any order
   * @return the reference of the batch that took the line
   * @throws OutOfStockException if no batch can take it
   */
  public static String allocate(OrderLine line, Collection<Batch> batches) {
    Objects.requireNonNull(line, "line");
    List<Batch> sorted = new ArrayList<>(batches);
    sorted.sort(Batch.PREFERENCE);
    for (Batch batch : sorted) {
      if (batch.canAllocate(line)) {
        batch.allocate(line);
        return batch.reference();
      }
    }
    throw new OutOfStockException(line.sku());
  }

  private Allocations() {}
}
