/**
 * Spring transaction integration for the unit of work.
 *
 * <p>{@link uow.spring.SpringUnitOfWork} runs each scope as a transaction of a Spring
 * {@link org.springframework.transaction.PlatformTransactionManager}, so repositories
 * share the connection Spring binds to the thread.
 *
 * @see uow.spring.SpringUnitOfWork
 */
package uow.spring;
