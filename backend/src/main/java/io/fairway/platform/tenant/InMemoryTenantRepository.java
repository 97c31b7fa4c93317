package io.fairway.platform.tenant;

import io.fairway.platform.persistence.InMemoryVersionedStore;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Tenants keyed by id with a global slug index. Slug reservation is atomic per slug. */
@Repository
public class InMemoryTenantRepository implements TenantRepository {

  private final InMemoryVersionedStore<UUID, Tenant> store =
      new InMemoryVersionedStore<>("Tenant");
  private final Map<String, UUID> slugIndex = new ConcurrentHashMap<>();

  @Override
  public boolean insert(Tenant tenant) {
    if (slugIndex.putIfAbsent(tenant.getSlug(), tenant.getId()) != null) {
      return false;
    }
    store.save(tenant.getId(), tenant);
    return true;
  }

  @Override
  public Tenant save(Tenant tenant) {
    var previous = store.find(tenant.getId());
    if (previous.isPresent() && !previous.get().getSlug().equals(tenant.getSlug())) {
      if (slugIndex.putIfAbsent(tenant.getSlug(), tenant.getId()) != null) {
        throw new IllegalStateException("Slug already reserved: " + tenant.getSlug());
      }
      try {
        store.save(tenant.getId(), tenant);
      } catch (RuntimeException e) {
        slugIndex.remove(tenant.getSlug(), tenant.getId());
        throw e;
      }
      slugIndex.remove(previous.get().getSlug(), tenant.getId());
      return tenant;
    }
    return store.save(tenant.getId(), tenant);
  }

  @Override
  public Optional<Tenant> findById(UUID id) {
    return store.find(id);
  }

  @Override
  public Optional<Tenant> findBySlug(String slug) {
    return Optional.ofNullable(slugIndex.get(slug)).flatMap(store::find);
  }

  @Override
  public List<Tenant> findByParentId(UUID parentId) {
    return store.findAll(t -> Objects.equals(parentId, t.getParentId()));
  }

  @Override
  public List<Tenant> findAll() {
    return store.findAll(t -> true);
  }
}
