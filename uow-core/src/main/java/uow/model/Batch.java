package uow.model;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A batch of stock for one SKU, identified by its reference.
 *
 * <p>A batch without an ETA is already in the warehouse; batches with an ETA are
 * shipments on their way. {@link #PREFERENCE} orders warehouse stock first, then by
 * earliest arrival.
 */
public final class Batch {

  /** Warehouse stock first, then shipments by ascending ETA. */
  public static final Comparator<Batch> PREFERENCE =
      Comparator.comparing(Batch::eta, Comparator.nullsFirst(Comparator.naturalOrder()));

  private final String reference;
  private final String sku;
  private final int purchasedQuantity;
  private final LocalDate eta;
  private final Set<OrderLine> allocations = new LinkedHashSet<>();

  /**
   * @param reference         batch identity
   * @param sku               the SKU stocked by this batch
   * @param purchasedQuantity units purchased, not negative
   * @param eta               expected arrival; {@code null} for warehouse stock
   */
  public Batch(String reference, String sku, int purchasedQuantity, LocalDate eta) {
    this.reference = Objects.requireNonNull(reference, "reference");
    this.sku = Objects.requireNonNull(sku, "sku");
    if (purchasedQuantity < 0) {
      throw new IllegalArgumentException("purchasedQuantity must be >= 0");
    }
    this.purchasedQuantity = purchasedQuantity;
    this.eta = eta;
  }

  /**
   * Rebuilds a stored batch with its allocations, bypassing {@link #canAllocate}.
   */
  public static Batch restore(String reference, String sku, int purchasedQuantity, LocalDate eta,
      Collection<OrderLine> allocations) {
    Batch batch = new Batch(reference, sku, purchasedQuantity, eta);
    batch.allocations.addAll(allocations);
    return batch;
  }

  public String reference() {
    return reference;
  }

  public String sku() {
    return sku;
  }

  public int purchasedQuantity() {
    return purchasedQuantity;
  }

  public LocalDate eta() {
    return eta;
  }

  public Set<OrderLine> allocations() {
    return Collections.unmodifiableSet(allocations);
  }

  public boolean canAllocate(OrderLine line) {
    return sku.equals(line.sku()) && availableQuantity() >= line.quantity();
  }

  /**
   * Allocates {@code line} if it fits. Allocating the same line twice has no effect.
   *
   * @return {@code true} if the line is allocated to this batch afterwards
   */
  public boolean allocate(OrderLine line) {
    if (allocations.contains(line)) {
      return true;
    }
    if (!canAllocate(line)) {
      return false;
    }
    allocations.add(line);
    return true;
  }

  /**
   * Removes {@code line} if it was allocated here.
   *
   * @return {@code true} if the line was removed
   */
  public boolean deallocate(OrderLine line) {
    return allocations.remove(line);
  }

  public int allocatedQuantity() {
    int total = 0;
    for (OrderLine line : allocations) {
      total += line.quantity();
    }
    return total;
  }

  public int availableQuantity() {
    return purchasedQuantity - allocatedQuantity();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Batch other)) return false;
    return reference.equals(other.reference);
  }

  @Override
  public int hashCode() {
    return reference.hashCode();
  }

  @Override
  public String toString() {
    return "Batch{" + reference + ", sku=" + sku + ", purchased=" + purchasedQuantity
        + ", available=" + availableQuantity() + ", eta=" + eta + '}';
  }
}
