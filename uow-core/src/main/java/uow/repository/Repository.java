package uow.repository;

import java.util.List;
import java.util.Optional;

/**
 * Add/get/list access to one entity type, bound to the transactional resource of a
 * single scope.
 *
 * <p>A repository never outlives its scope; after release every call fails with
 * {@link uow.ScopeMisuseException}.
 *
 * @param <K> identity key type
 * @param <E> entity type
 */
public interface Repository<K, E> {

  /**
   * Adds a new entity. The write becomes durable only when the scope commits.
   */
  void add(E entity);

  /**
   * Looks an entity up by identity.
   *
   * @return the entity, or empty if none exists
   */
  Optional<E> get(K key);

  /**
   * Returns every entity visible to the scope.
   */
  List<E> list();
}
