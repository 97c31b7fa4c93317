package io.fairway.platform.invoice;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface InvoiceRepository {

  Invoice save(Invoice invoice);

  Optional<Invoice> findById(UUID id);

  List<Invoice> findByTenantId(String tenantId);

  List<Invoice> findBySubscriptionId(UUID subscriptionId);

  /** Non-void renewal invoice of a subscription for the period starting at {@code periodStart}. */
  Optional<Invoice> findRenewal(UUID subscriptionId, Instant periodStart);

  List<Invoice> findByStatus(InvoiceStatus status);

  /** Next sequential number for the tenant: INV-0001, INV-0002, ... */
  String nextInvoiceNumber(String tenantId);
}
