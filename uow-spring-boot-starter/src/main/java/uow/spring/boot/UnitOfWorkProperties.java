package uow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import uow.jdbc.ReleasePolicy;
import uow.jdbc.TableNames;

/**
 * Configuration properties for the unit of work.
 *
 * @see UnitOfWorkAutoConfiguration
 */
@ConfigurationProperties(prefix = "uow")
public class UnitOfWorkProperties {

  /**
   * Transaction backend: plain JDBC connections, or the application's Spring
   * transaction manager.
   */
  private Mode mode = Mode.JDBC;

  /**
   * What JDBC mode does with a connection when a scope is released.
   */
  private ReleasePolicy releasePolicy = ReleasePolicy.RETAIN;

  /**
   * Table holding batches.
   */
  private String batchTable = TableNames.DEFAULT_BATCH_TABLE;

  /**
   * Table holding order line allocations.
   */
  private String allocationTable = TableNames.DEFAULT_ALLOCATION_TABLE;

  /**
   * Create the tables on startup from the bundled schema script.
   */
  private boolean initializeSchema = false;

  private final Metrics metrics = new Metrics();

  public Mode getMode() {
    return mode;
  }

  public void setMode(Mode mode) {
    this.mode = mode;
  }

  public ReleasePolicy getReleasePolicy() {
    return releasePolicy;
  }

  public void setReleasePolicy(ReleasePolicy releasePolicy) {
    this.releasePolicy = releasePolicy;
  }

  public String getBatchTable() {
    return batchTable;
  }

  public void setBatchTable(String batchTable) {
    this.batchTable = batchTable;
  }

  public String getAllocationTable() {
    return allocationTable;
  }

  public void setAllocationTable(String allocationTable) {
    this.allocationTable = allocationTable;
  }

  public boolean isInitializeSchema() {
    return initializeSchema;
  }

  public void setInitializeSchema(boolean initializeSchema) {
    this.initializeSchema = initializeSchema;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public enum Mode {
    JDBC,
    SPRING
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "uow";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
