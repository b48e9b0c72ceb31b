package uow.service;

import org.junit.jupiter.api.Test;
import uow.memory.FakeUnitOfWork;
import uow.memory.InMemoryBatchRepository;
import uow.model.Batch;
import uow.model.OrderLine;
import uow.model.OutOfStockException;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchServicesTest {

  @Test
  void addBatch() {
    FakeUnitOfWork uow = new FakeUnitOfWork();

    BatchServices.addBatch("b1", "CRUNCHY-ARMCHAIR", 100, null, uow);

    assertTrue(uow.store().get("b1").isPresent());
    assertEquals(100, uow.store().get("b1").get().purchasedQuantity());
    assertTrue(uow.isCommitted());
  }

  @Test
  void allocateReturnsAllocation() {
    FakeUnitOfWork uow = new FakeUnitOfWork();
    BatchServices.addBatch("batch1", "COMPLICATED-LAMP", 100, null, uow);

    String reference = BatchServices.allocate("o1", "COMPLICATED-LAMP", 10, uow);

    assertEquals("batch1", reference);
    assertEquals(90, uow.store().get("batch1").get().availableQuantity());
  }

  @Test
  void allocateErrorsForInvalidSku() {
    FakeUnitOfWork uow = new FakeUnitOfWork(
        new InMemoryBatchRepository(List.of(new Batch("b1", "AREALSKU", 100, null))));

    InvalidSkuException e = assertThrows(InvalidSkuException.class, () ->
        BatchServices.allocate("o1", "NONEXISTENTSKU", 10, uow));

    assertEquals("Invalid sku NONEXISTENTSKU", e.getMessage());
    assertFalse(uow.isCommitted());
  }

  @Test
  void allocateCommits() {
    FakeUnitOfWork uow = new FakeUnitOfWork(
        new InMemoryBatchRepository(List.of(new Batch("b1", "OMINOUS-MIRROR", 100, null))));

    BatchServices.allocate("o1", "OMINOUS-MIRROR", 10, uow);

    assertTrue(uow.isCommitted());
  }

  @Test
  void allocateOutOfStockDoesNotCommit() {
    FakeUnitOfWork uow = new FakeUnitOfWork(
        new InMemoryBatchRepository(List.of(new Batch("b1", "TINY-VASE", 5, null))));

    assertThrows(OutOfStockException.class, () ->
        BatchServices.allocate("o1", "TINY-VASE", 10, uow));

    assertFalse(uow.isCommitted());
    assertFalse(uow.isOpen());
  }

  @Test
  void prefersWarehouseBatchesToShipments() {
    FakeUnitOfWork uow = new FakeUnitOfWork();
    BatchServices.addBatch("in-stock-batch", "RETRO-CLOCK", 100, null, uow);
    BatchServices.addBatch("shipment-batch", "RETRO-CLOCK", 100, LocalDate.now().plusDays(1), uow);

    assertEquals("in-stock-batch", BatchServices.allocate("oref", "RETRO-CLOCK", 10, uow));
    assertEquals(90, uow.store().get("in-stock-batch").get().availableQuantity());
    assertEquals(100, uow.store().get("shipment-batch").get().availableQuantity());
  }

  @Test
  void deallocateRemovesLine() {
    FakeUnitOfWork uow = new FakeUnitOfWork();
    BatchServices.addBatch("b1", "BLUE-PLINTH", 100, null, uow);
    BatchServices.allocate("o1", "BLUE-PLINTH", 10, uow);

    assertTrue(BatchServices.deallocate("o1", "BLUE-PLINTH", 10, "b1", uow));

    Batch batch = uow.store().get("b1").get();
    assertEquals(Set.of(), batch.allocations());
    assertFalse(batch.allocations().contains(new OrderLine("o1", "BLUE-PLINTH", 10)));
  }

  @Test
  void deallocateUnknownBatchThrows() {
    FakeUnitOfWork uow = new FakeUnitOfWork();

    assertThrows(InvalidBatchException.class, () ->
        BatchServices.deallocate("o1", "BLUE-PLINTH", 10, "missing", uow));
  }
}
