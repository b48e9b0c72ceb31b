/**
 * Repository interfaces exposed by a {@link uow.UnitOfWork} scope.
 */
package uow.repository;
