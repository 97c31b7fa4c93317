package io.fairway.platform.billing;

import io.fairway.platform.ledger.RevenueEvent;
import io.fairway.platform.ledger.RevenueEventType;
import io.fairway.platform.ledger.RevenueStream;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Charges, refunds and ledger corrections for the current tenant, plus billing-cycle control. */
@RestController
@RequestMapping("/api/admin/billing")
public class BillingController {

  private final BillingOrchestrator billingOrchestrator;

  public BillingController(BillingOrchestrator billingOrchestrator) {
    this.billingOrchestrator = billingOrchestrator;
  }

  @PostMapping("/charges")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<RevenueEvent> charge(@Valid @RequestBody ChargeCustomerRequest request) {
    var event =
        billingOrchestrator.chargeCustomer(
            request.customerId(),
            request.eventId(),
            request.type(),
            request.amount(),
            request.currency(),
            request.stream(),
            request.paymentMethod());
    return ResponseEntity.status(HttpStatus.CREATED).body(event);
  }

  @PostMapping("/setup-fees")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<RevenueEvent> setupFee(@Valid @RequestBody SetupFeeRequest request) {
    var event =
        billingOrchestrator.recordSetupFee(
            request.customerId(),
            request.eventId(),
            request.amount(),
            request.currency(),
            request.stream());
    return ResponseEntity.status(HttpStatus.CREATED).body(event);
  }

  @PostMapping("/refunds")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<RevenueEvent> refund(@Valid @RequestBody RefundRequest request) {
    var event =
        billingOrchestrator.refund(
            request.eventId(), request.refundId(), request.amount(), request.reason());
    return ResponseEntity.status(HttpStatus.CREATED).body(event);
  }

  @PostMapping("/events")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN')")
  public ResponseEntity<RevenueEvent> recordManualEvent(
      @Valid @RequestBody ManualEventRequest request) {
    var event =
        billingOrchestrator.recordManualEvent(
            new ManualRevenueEvent(
                request.id(),
                request.type(),
                request.amount(),
                request.currency(),
                request.occurredAt(),
                request.customerId(),
                request.subscriptionId(),
                request.stream(),
                request.reason(),
                request.metadata()));
    return ResponseEntity.status(HttpStatus.CREATED).body(event);
  }

  @PostMapping("/cycle")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<BillingCycleResult> runCycle() {
    return ResponseEntity.ok(billingOrchestrator.runAutomatedBillingCycle());
  }

  @PostMapping("/cycle/cancel")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<Map<String, Boolean>> cancelCycle() {
    return ResponseEntity.ok(Map.of("cancelRequested", billingOrchestrator.cancelRunningCycle()));
  }

  @PostMapping("/overdue")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<Map<String, Integer>> markOverdue() {
    return ResponseEntity.ok(Map.of("marked", billingOrchestrator.markOverdueInvoices()));
  }

  // --- DTOs ---

  public record ChargeCustomerRequest(
      @NotNull UUID customerId,
      String eventId,
      @NotNull RevenueEventType type,
      @NotNull @PositiveOrZero BigDecimal amount,
      @NotBlank String currency,
      RevenueStream stream,
      String paymentMethod) {}

  public record SetupFeeRequest(
      @NotNull UUID customerId,
      String eventId,
      @NotNull @PositiveOrZero BigDecimal amount,
      @NotBlank String currency,
      RevenueStream stream) {}

  public record RefundRequest(
      @NotBlank String eventId,
      String refundId,
      @NotNull @Positive BigDecimal amount,
      @NotBlank String reason) {}

  public record ManualEventRequest(
      String id,
      @NotNull RevenueEventType type,
      @NotNull BigDecimal amount,
      @NotBlank String currency,
      Instant occurredAt,
      String customerId,
      String subscriptionId,
      RevenueStream stream,
      @NotBlank String reason,
      Map<String, String> metadata) {}
}
