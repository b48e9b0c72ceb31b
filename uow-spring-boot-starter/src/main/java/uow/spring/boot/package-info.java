/**
 * Spring Boot auto-configuration for the unit of work.
 *
 * @see uow.spring.boot.UnitOfWorkAutoConfiguration
 * @see uow.spring.boot.UnitOfWorkProperties
 */
package uow.spring.boot;
