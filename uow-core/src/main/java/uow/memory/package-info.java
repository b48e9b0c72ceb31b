/**
 * In-memory unit of work for use-case tests.
 */
package uow.memory;
