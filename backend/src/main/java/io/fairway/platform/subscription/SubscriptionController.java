package io.fairway.platform.subscription;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/subscriptions")
public class SubscriptionController {

  private final SubscriptionService subscriptionService;
  private final TierCatalog tierCatalog;

  public SubscriptionController(SubscriptionService subscriptionService, TierCatalog tierCatalog) {
    this.subscriptionService = subscriptionService;
    this.tierCatalog = tierCatalog;
  }

  @GetMapping("/tiers")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<Tier>> tiers() {
    return ResponseEntity.ok(tierCatalog.all());
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<List<SubscriptionResponse>> list(
      @RequestParam(required = false) UUID customerId) {
    var subscriptions =
        customerId != null
            ? subscriptionService.listForCustomer(customerId)
            : subscriptionService.listForCurrentTenant();
    return ResponseEntity.ok(subscriptions.stream().map(SubscriptionResponse::from).toList());
  }

  /** Members may read the subscriptions of the customer linked to their own user. */
  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'MEMBER')")
  public ResponseEntity<SubscriptionResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.get(id)));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<SubscriptionResponse> create(
      @Valid @RequestBody CreateSubscriptionRequest request) {
    var subscription =
        subscriptionService.create(
            request.customerId(),
            request.tierId(),
            request.billingCycle(),
            request.price(),
            request.trialDays() != null ? request.trialDays() : 0,
            request.paymentMethod());
    return ResponseEntity.created(URI.create("/api/admin/subscriptions/" + subscription.getId()))
        .body(SubscriptionResponse.from(subscription));
  }

  @PutMapping("/{id}/tier")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<SubscriptionResponse> changeTier(
      @PathVariable UUID id, @Valid @RequestBody ChangeTierRequest request) {
    return ResponseEntity.ok(
        SubscriptionResponse.from(
            subscriptionService.changeTier(id, request.tierId(), request.billingCycle())));
  }

  @PostMapping("/{id}/pause")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<SubscriptionResponse> pause(
      @PathVariable UUID id, @Valid @RequestBody PauseRequest request) {
    return ResponseEntity.ok(
        SubscriptionResponse.from(
            subscriptionService.pause(id, Duration.ofDays(request.days()))));
  }

  @PostMapping("/{id}/resume")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<SubscriptionResponse> resume(@PathVariable UUID id) {
    return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.resume(id)));
  }

  @PostMapping("/{id}/cancel")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<SubscriptionResponse> cancel(
      @PathVariable UUID id, @Valid @RequestBody CancelRequest request) {
    return ResponseEntity.ok(
        SubscriptionResponse.from(subscriptionService.cancel(id, request.reason())));
  }

  @PutMapping("/{id}/payment-method")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<SubscriptionResponse> updatePaymentMethod(
      @PathVariable UUID id, @Valid @RequestBody PaymentMethodRequest request) {
    return ResponseEntity.ok(
        SubscriptionResponse.from(
            subscriptionService.updatePaymentMethod(id, request.paymentMethod())));
  }

  // --- DTOs ---

  public record CreateSubscriptionRequest(
      @NotNull UUID customerId,
      @NotBlank String tierId,
      BillingCycle billingCycle,
      @PositiveOrZero BigDecimal price,
      @Min(0) Integer trialDays,
      String paymentMethod) {}

  public record ChangeTierRequest(@NotBlank String tierId, BillingCycle billingCycle) {}

  public record PauseRequest(@Positive int days) {}

  public record CancelRequest(@NotNull CancellationReason reason) {}

  public record PaymentMethodRequest(@NotBlank String paymentMethod) {}

  public record SubscriptionResponse(
      UUID id,
      String tenantId,
      UUID customerId,
      String tierId,
      String tierFamily,
      String stream,
      BillingCycle billingCycle,
      BigDecimal price,
      String currency,
      SubscriptionStatus status,
      Instant trialEndsAt,
      Instant currentPeriodStart,
      Instant currentPeriodEnd,
      Instant pausedUntil,
      Instant canceledAt,
      CancellationReason cancellationReason,
      int failedAttempts,
      Instant nextRetryAt,
      boolean dunning,
      boolean requiresManualIntervention,
      long version) {

    public static SubscriptionResponse from(Subscription s) {
      return new SubscriptionResponse(
          s.getId(),
          s.getTenantId(),
          s.getCustomerId(),
          s.getTierId(),
          s.getTierFamily(),
          s.getStream().name(),
          s.getBillingCycle(),
          s.getPrice(),
          s.getCurrency(),
          s.getStatus(),
          s.getTrialEndsAt(),
          s.getCurrentPeriodStart(),
          s.getCurrentPeriodEnd(),
          s.getPausedUntil(),
          s.getCanceledAt(),
          s.getCancellationReason(),
          s.getFailedAttempts(),
          s.getNextRetryAt(),
          s.isInDunning(),
          s.isRequiresManualIntervention(),
          s.getVersion());
    }
  }
}
