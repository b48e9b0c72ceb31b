package uow.repository;

import uow.model.Batch;

/**
 * Repository of {@link Batch} entities keyed by batch reference.
 */
public interface BatchRepository extends Repository<String, Batch> {
}
