package uow.service;

/**
 * The requested SKU is not stocked by any batch.
 */
public final class InvalidSkuException extends RuntimeException {
  public InvalidSkuException(String sku) {
    super("Invalid sku " + sku);
  }
}
