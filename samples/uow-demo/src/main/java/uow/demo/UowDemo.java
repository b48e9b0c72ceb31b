package uow.demo;

import uow.Scope;
import uow.jdbc.DataSourceConnectionProvider;
import uow.jdbc.JdbcSchemas;
import uow.jdbc.JdbcUnitOfWork;
import uow.jdbc.JdbcUnitOfWorkFactory;
import uow.model.Batch;
import uow.service.BatchServices;

import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * Simple demo showing unit-of-work usage against an in-memory H2 database.
 *
 * Run with: mvn -pl samples/uow-demo exec:java
 */
public final class UowDemo {
  private static final Logger log = LoggerFactory.getLogger(UowDemo.class);

  public static void main(String[] args) {
    // 1. Setup H2 in-memory database
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:uow_demo;DB_CLOSE_DELAY=-1");
    JdbcSchemas.create(dataSource);

    JdbcUnitOfWorkFactory uowFactory = new JdbcUnitOfWorkFactory(new DataSourceConnectionProvider(dataSource));

    // 2. Register stock through the service layer
    try (JdbcUnitOfWork uow = uowFactory.create()) {
      BatchServices.addBatch("in-stock-batch", "SMALL-TABLE", 20, null, uow);
      BatchServices.addBatch("shipment-batch", "SMALL-TABLE", 100, LocalDate.now().plusDays(7), uow);
    }

    // 3. Allocate: warehouse stock is preferred over shipments
    try (JdbcUnitOfWork uow = uowFactory.create()) {
      String reference = BatchServices.allocate("order-1", "SMALL-TABLE", 10, uow);
      log.info("order-1 allocated to {}", reference);
      reference = BatchServices.allocate("order-2", "SMALL-TABLE", 15, uow);
      log.info("order-2 allocated to {}", reference);
    }

    // 4. A scope left without commit is rolled back
    try (JdbcUnitOfWork uow = uowFactory.create()) {
      try (Scope scope = uow.acquire()) {
        scope.batches().add(new Batch("forgotten-batch", "SMALL-TABLE", 5, null));
      }
      try (Scope scope = uow.acquire()) {
        log.info("forgotten-batch present after release without commit: {}",
            scope.batches().get("forgotten-batch").isPresent());
      }
    }

    // 5. A failing body rolls back too
    try (JdbcUnitOfWork uow = uowFactory.create()) {
      BatchServices.allocate("order-3", "SMALL-TABLE", 1_000, uow);
    } catch (RuntimeException e) {
      log.info("order-3 rejected: {}", e.getMessage());
    }

    try (JdbcUnitOfWork uow = uowFactory.create(); Scope scope = uow.acquire()) {
      for (Batch batch : scope.batches().list()) {
        log.info("{}", batch);
      }
    }
  }

  private UowDemo() {}
}
