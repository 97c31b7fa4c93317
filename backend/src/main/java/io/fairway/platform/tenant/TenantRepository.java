package io.fairway.platform.tenant;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TenantRepository {

  /**
   * Saves the tenant with an optimistic version check. Inserting a tenant whose slug is already
   * taken returns false and stores nothing.
   */
  boolean insert(Tenant tenant);

  Tenant save(Tenant tenant);

  Optional<Tenant> findById(UUID id);

  Optional<Tenant> findBySlug(String slug);

  List<Tenant> findByParentId(UUID parentId);

  List<Tenant> findAll();
}
