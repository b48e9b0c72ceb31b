package uow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import uow.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code uow.scope.opened}: scopes opened</li>
 *   <li>{@code uow.commit}: successful commits</li>
 *   <li>{@code uow.rollback}: scopes rolled back on release</li>
 *   <li>{@code uow.commit.failure}: commits rejected by the database</li>
 *   <li>{@code uow.rollback.failure}: rollbacks that failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code uow.scope.active}: scopes currently open</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter scopesOpened;
  private final Counter commits;
  private final Counter rollbacks;
  private final Counter commitFailures;
  private final Counter rollbackFailures;
  private final Gauge activeScopesGauge;

  private final AtomicInteger activeScopes = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "uow"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "uow");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for applications running
   * several independently configured units of work.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.uow"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.scopesOpened = Counter.builder(namePrefix + ".scope.opened")
        .description("Scopes opened")
        .register(registry);
    this.commits = Counter.builder(namePrefix + ".commit")
        .description("Successful commits")
        .register(registry);
    this.rollbacks = Counter.builder(namePrefix + ".rollback")
        .description("Scopes rolled back on release")
        .register(registry);
    this.commitFailures = Counter.builder(namePrefix + ".commit.failure")
        .description("Commits rejected by the database")
        .register(registry);
    this.rollbackFailures = Counter.builder(namePrefix + ".rollback.failure")
        .description("Rollbacks that failed")
        .register(registry);

    this.activeScopesGauge = Gauge.builder(namePrefix + ".scope.active", activeScopes, AtomicInteger::get)
        .description("Scopes currently open")
        .register(registry);
  }

  @Override
  public void incrementScopeOpened() {
    if (closed) return;
    scopesOpened.increment();
    activeScopes.incrementAndGet();
  }

  @Override
  public void incrementScopeClosed() {
    if (closed) return;
    activeScopes.decrementAndGet();
  }

  @Override
  public void incrementCommitted() {
    if (closed) return;
    commits.increment();
  }

  @Override
  public void incrementRolledBack() {
    if (closed) return;
    rollbacks.increment();
  }

  @Override
  public void incrementCommitFailure() {
    if (closed) return;
    commitFailures.increment();
  }

  @Override
  public void incrementRollbackFailure() {
    if (closed) return;
    rollbackFailures.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(scopesOpened, commits, rollbacks,
        commitFailures, rollbackFailures, activeScopesGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
