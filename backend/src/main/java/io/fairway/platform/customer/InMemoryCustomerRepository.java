package io.fairway.platform.customer;

import io.fairway.platform.persistence.InMemoryVersionedStore;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCustomerRepository implements CustomerRepository {

  private record EmailKey(String tenantId, String email) {}

  private final InMemoryVersionedStore<UUID, Customer> store =
      new InMemoryVersionedStore<>("Customer");
  private final Map<EmailKey, UUID> emailIndex = new ConcurrentHashMap<>();

  @Override
  public boolean insert(Customer customer) {
    var key = new EmailKey(customer.getTenantId(), customer.getEmail());
    if (emailIndex.putIfAbsent(key, customer.getId()) != null) {
      return false;
    }
    store.save(customer.getId(), customer);
    return true;
  }

  @Override
  public Customer save(Customer customer) {
    return store.save(customer.getId(), customer);
  }

  @Override
  public Optional<Customer> findById(UUID id) {
    return store.find(id);
  }

  @Override
  public Optional<Customer> findByTenantIdAndEmail(String tenantId, String email) {
    var key = new EmailKey(tenantId, Customer.normalizeEmail(email));
    return Optional.ofNullable(emailIndex.get(key)).flatMap(store::find);
  }

  @Override
  public List<Customer> findByTenantId(String tenantId) {
    return store.findAll(c -> c.getTenantId().equals(tenantId)).stream()
        .sorted(Comparator.comparing(Customer::getCreatedAt).thenComparing(Customer::getEmail))
        .toList();
  }
}
