package uow.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uow.Scope;
import uow.model.Batch;
import uow.service.BatchServices;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private JdbcUnitOfWorkFactory factory;

  @BeforeEach
  void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("uow-test-pool");

    hikariDs = new HikariDataSource(config);
    JdbcSchemas.create(hikariDs);
    factory = new JdbcUnitOfWorkFactory(new DataSourceConnectionProvider(hikariDs));
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void noConnectionLeaksAfterManyScopes() {
    for (int i = 0; i < 20; i++) {
      try (JdbcUnitOfWork uow = factory.create()) {
        BatchServices.addBatch("batch-" + i, "LAMP", 10, null, uow);
        try (Scope scope = uow.acquire()) {
          scope.batches().add(new Batch("discarded-" + i, "LAMP", 10, null));
        }
      }
    }

    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
    try (JdbcUnitOfWork uow = factory.create(); Scope scope = uow.acquire()) {
      assertEquals(20, scope.batches().list().size());
    }
  }

  @Test
  void retainedConnectionHeldUntilClose() {
    JdbcUnitOfWork uow = factory.create();
    BatchServices.addBatch("batch1", "LAMP", 10, null, uow);

    assertEquals(1, hikariDs.getHikariPoolMXBean().getActiveConnections());

    uow.close();
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void closePolicyReturnsConnectionOnRelease() {
    JdbcUnitOfWorkFactory closing = new JdbcUnitOfWorkFactory(new DataSourceConnectionProvider(hikariDs),
        ReleasePolicy.CLOSE, JdbcBatchRepository::new, null);
    JdbcUnitOfWork uow = closing.create();

    try (Scope scope = uow.acquire()) {
      assertEquals(1, hikariDs.getHikariPoolMXBean().getActiveConnections());
      scope.commit();
    }

    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void concurrentUnitsOfWorkAreIsolated() throws Exception {
    try (JdbcUnitOfWork uow = factory.create()) {
      for (int i = 0; i < 4; i++) {
        BatchServices.addBatch("batch-" + i, "SKU-" + i, 100, null, uow);
      }
    }

    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        String sku = "SKU-" + i;
        String orderId = "order-" + i;
        results.add(executor.submit(() -> {
          try (JdbcUnitOfWork uow = factory.create()) {
            return BatchServices.allocate(orderId, sku, 10, uow);
          }
        }));
      }
      for (int i = 0; i < 4; i++) {
        assertEquals("batch-" + i, results.get(i).get(5, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }

    try (JdbcUnitOfWork uow = factory.create(); Scope scope = uow.acquire()) {
      for (Batch batch : scope.batches().list()) {
        assertEquals(90, batch.availableQuantity(), batch.reference());
      }
    }
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }
}
