package io.fairway.platform.customer;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CustomerRepository {

  /** Stores a new customer; returns false when the tenant already has one with that email. */
  boolean insert(Customer customer);

  Customer save(Customer customer);

  Optional<Customer> findById(UUID id);

  Optional<Customer> findByTenantIdAndEmail(String tenantId, String email);

  List<Customer> findByTenantId(String tenantId);
}
