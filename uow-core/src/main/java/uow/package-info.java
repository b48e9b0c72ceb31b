/**
 * Unit of Work: a scoped transactional boundary over repositories.
 *
 * <p>{@link uow.UnitOfWork} is the contract, {@link uow.Scope} the try-with-resources
 * handle that guarantees release, and {@link uow.AbstractUnitOfWork} the state machine
 * storage-backed implementations build on. Failures are unchecked:
 * {@link uow.ScopeMisuseException} for programming errors, {@link uow.CommitException}
 * and {@link uow.RollbackException} for storage failures.
 *
 * @see uow.UnitOfWork
 * @see uow.Scope
 */
package uow;
