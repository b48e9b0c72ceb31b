package uow.spi;

/**
 * Implemented by repositories that buffer changes to loaded entities. The unit of work
 * flushes them on its connection right before committing.
 */
public interface Flushable {

  /**
   * Writes pending changes through the scope's connection.
   */
  void flush();
}
