/**
 * Stock allocation model: {@link uow.model.Batch}, {@link uow.model.OrderLine} and the
 * {@link uow.model.Allocations} domain service.
 */
package uow.model;
