package uow.model;

import java.util.Objects;

/**
 * A customer order line: a quantity of one SKU requested by one order.
 *
 * @param orderId  order identifier
 * @param sku      stock-keeping unit
 * @param quantity requested quantity, positive
 */
public record OrderLine(String orderId, String sku, int quantity) {

  public OrderLine {
    Objects.requireNonNull(orderId, "orderId");
    Objects.requireNonNull(sku, "sku");
    if (quantity <= 0) {
      throw new IllegalArgumentException("quantity must be > 0");
    }
  }
}
