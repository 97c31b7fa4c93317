package io.fairway.platform.invoice;

import io.fairway.platform.persistence.InMemoryVersionedStore;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryInvoiceRepository implements InvoiceRepository {

  private static final Comparator<Invoice> NEWEST_FIRST =
      Comparator.comparing(Invoice::getCreatedAt)
          .reversed()
          .thenComparing(Invoice::getInvoiceNumber);

  private final InMemoryVersionedStore<UUID, Invoice> store =
      new InMemoryVersionedStore<>("Invoice");
  private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

  @Override
  public Invoice save(Invoice invoice) {
    return store.save(invoice.getId(), invoice);
  }

  @Override
  public Optional<Invoice> findById(UUID id) {
    return store.find(id);
  }

  @Override
  public List<Invoice> findByTenantId(String tenantId) {
    return sorted(store.findAll(i -> i.getTenantId().equals(tenantId)));
  }

  @Override
  public List<Invoice> findBySubscriptionId(UUID subscriptionId) {
    return sorted(store.findAll(i -> subscriptionId.equals(i.getSubscriptionId())));
  }

  @Override
  public Optional<Invoice> findRenewal(UUID subscriptionId, Instant periodStart) {
    return store
        .findAll(
            i ->
                subscriptionId.equals(i.getSubscriptionId())
                    && Objects.equals(periodStart, i.getPeriodStart())
                    && i.getStatus() != InvoiceStatus.VOID)
        .stream()
        .findFirst();
  }

  @Override
  public List<Invoice> findByStatus(InvoiceStatus status) {
    return sorted(store.findAll(i -> i.getStatus() == status));
  }

  @Override
  public String nextInvoiceNumber(String tenantId) {
    long next = counters.computeIfAbsent(tenantId, k -> new AtomicLong()).incrementAndGet();
    return String.format("INV-%04d", next);
  }

  private static List<Invoice> sorted(List<Invoice> invoices) {
    return invoices.stream().sorted(NEWEST_FIRST).toList();
  }
}
