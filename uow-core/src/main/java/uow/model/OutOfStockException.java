package uow.model;

/**
 * No batch can take an order line.
 */
public final class OutOfStockException extends RuntimeException {
  private final String sku;

  public OutOfStockException(String sku) {
    super("Out of stock for sku " + sku);
    this.sku = sku;
  }

  public String sku() {
    return sku;
  }
}
