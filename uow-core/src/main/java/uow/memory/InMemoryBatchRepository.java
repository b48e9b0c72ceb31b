package uow.memory;

import uow.model.Batch;
import uow.repository.BatchRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link BatchRepository} over a plain map. Writes land immediately; there is nothing
 * to roll back.
 */
public final class InMemoryBatchRepository implements BatchRepository {
  private final Map<String, Batch> batches = new LinkedHashMap<>();

  public InMemoryBatchRepository() {
  }

  public InMemoryBatchRepository(Collection<Batch> initial) {
    initial.forEach(this::add);
  }

  @Override
  public void add(Batch batch) {
    Objects.requireNonNull(batch, "batch");
    batches.put(batch.reference(), batch);
  }

  @Override
  public Optional<Batch> get(String reference) {
    return Optional.ofNullable(batches.get(reference));
  }

  @Override
  public List<Batch> list() {
    return new ArrayList<>(batches.values());
  }

  public int size() {
    return batches.size();
  }
}
