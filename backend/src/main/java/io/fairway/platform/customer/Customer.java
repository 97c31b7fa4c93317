package io.fairway.platform.customer;

import io.fairway.platform.persistence.Versioned;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A paying party inside a tenant. Emails are unique per tenant, compared case-insensitively. A
 * customer may be linked to the platform user it represents; that user owns the customer's
 * subscriptions and invoices.
 */
public class Customer implements Versioned<Customer> {

  private UUID id;
  private String tenantId;
  private String email;
  private String displayName;
  private Map<String, String> metadata;
  private String defaultPaymentMethod;
  private String userId;
  private Instant createdAt;
  private Instant updatedAt;
  private long version;

  private Customer() {}

  public Customer(
      String tenantId,
      String email,
      String displayName,
      Map<String, String> metadata,
      String defaultPaymentMethod,
      Instant now) {
    this(tenantId, email, displayName, metadata, defaultPaymentMethod, null, now);
  }

  public Customer(
      String tenantId,
      String email,
      String displayName,
      Map<String, String> metadata,
      String defaultPaymentMethod,
      String userId,
      Instant now) {
    this.id = UUID.randomUUID();
    this.tenantId = tenantId;
    this.email = normalizeEmail(email);
    this.displayName = displayName;
    this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    this.defaultPaymentMethod = defaultPaymentMethod;
    this.userId = userId;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public static String normalizeEmail(String email) {
    return email == null ? null : email.trim().toLowerCase();
  }

  public void updatePaymentMethod(String paymentMethod, Instant now) {
    this.defaultPaymentMethod = paymentMethod;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getEmail() {
    return email;
  }

  public String getDisplayName() {
    return displayName;
  }

  public Map<String, String> getMetadata() {
    return Map.copyOf(metadata);
  }

  public String getDefaultPaymentMethod() {
    return defaultPaymentMethod;
  }

  public String getUserId() {
    return userId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public long getVersion() {
    return version;
  }

  @Override
  public void assignVersion(long version) {
    this.version = version;
  }

  @Override
  public Customer copy() {
    var copy = new Customer();
    copy.id = id;
    copy.tenantId = tenantId;
    copy.email = email;
    copy.displayName = displayName;
    copy.metadata = new LinkedHashMap<>(metadata);
    copy.defaultPaymentMethod = defaultPaymentMethod;
    copy.userId = userId;
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    copy.version = version;
    return copy;
  }
}
