package uow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uow.AbstractUnitOfWork;
import uow.Scope;
import uow.memory.InMemoryBatchRepository;
import uow.repository.BatchRepository;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementScopeOpened() {
    exporter.incrementScopeOpened();
    exporter.incrementScopeOpened();
    assertEquals(2.0, counter("uow.scope.opened").count());
    assertEquals(2.0, gauge("uow.scope.active").value());
  }

  @Test
  void incrementScopeClosedLowersActiveGauge() {
    exporter.incrementScopeOpened();
    exporter.incrementScopeClosed();
    assertEquals(1.0, counter("uow.scope.opened").count());
    assertEquals(0.0, gauge("uow.scope.active").value());
  }

  @Test
  void incrementCommitted() {
    exporter.incrementCommitted();
    assertEquals(1.0, counter("uow.commit").count());
  }

  @Test
  void incrementRolledBack() {
    exporter.incrementRolledBack();
    exporter.incrementRolledBack();
    assertEquals(2.0, counter("uow.rollback").count());
  }

  @Test
  void incrementCommitFailure() {
    exporter.incrementCommitFailure();
    assertEquals(1.0, counter("uow.commit.failure").count());
  }

  @Test
  void incrementRollbackFailure() {
    exporter.incrementRollbackFailure();
    assertEquals(1.0, counter("uow.rollback.failure").count());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "orders.uow");
    custom.incrementScopeOpened();
    custom.incrementCommitted();

    assertEquals(1.0, counter("orders.uow.scope.opened").count());
    assertEquals(1.0, counter("orders.uow.commit").count());
    assertEquals(1.0, gauge("orders.uow.scope.active").value());
    assertEquals(0.0, counter("uow.commit").count());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "uow."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterEvents() {
    exporter.incrementScopeOpened();
    exporter.close();

    assertNull(registry.find("uow.scope.opened").counter());
    assertNull(registry.find("uow.scope.active").gauge());
    assertDoesNotThrow(exporter::incrementCommitted);
  }

  @Test
  void recordsUnitOfWorkLifecycle() {
    InMemoryUnitOfWork uow = new InMemoryUnitOfWork(exporter);

    try (Scope scope = uow.acquire()) {
      assertEquals(1.0, gauge("uow.scope.active").value());
      scope.commit();
    }
    try (Scope ignored = uow.acquire()) {
      // released without commit
    }

    assertEquals(2.0, counter("uow.scope.opened").count());
    assertEquals(1.0, counter("uow.commit").count());
    assertEquals(1.0, counter("uow.rollback").count());
    assertEquals(0.0, gauge("uow.scope.active").value());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }

  private static final class InMemoryUnitOfWork extends AbstractUnitOfWork {
    private InMemoryUnitOfWork(MicrometerMetricsExporter metrics) {
      super(metrics);
    }

    @Override
    protected BatchRepository doBegin() {
      return new InMemoryBatchRepository();
    }

    @Override
    protected void doCommit() {
    }

    @Override
    protected void doRollback() {
    }
  }
}
