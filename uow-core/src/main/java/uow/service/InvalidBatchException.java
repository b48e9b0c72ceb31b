package uow.service;

/**
 * The referenced batch does not exist.
 */
public final class InvalidBatchException extends RuntimeException {
  public InvalidBatchException(String reference) {
    super("Unknown batch " + reference);
  }
}
