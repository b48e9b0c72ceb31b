/**
 * Use-case orchestration over a {@link uow.UnitOfWork}.
 *
 * @see uow.service.BatchServices
 */
package uow.service;
