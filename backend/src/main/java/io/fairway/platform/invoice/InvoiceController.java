package io.fairway.platform.invoice;

import io.fairway.platform.billing.BillingOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/invoices")
public class InvoiceController {

  private final BillingOrchestrator billingOrchestrator;

  public InvoiceController(BillingOrchestrator billingOrchestrator) {
    this.billingOrchestrator = billingOrchestrator;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<List<InvoiceResponse>> list() {
    return ResponseEntity.ok(
        billingOrchestrator.listInvoices().stream().map(InvoiceResponse::from).toList());
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'MEMBER')")
  public ResponseEntity<InvoiceResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(InvoiceResponse.from(billingOrchestrator.getInvoice(id)));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<InvoiceResponse> create(@Valid @RequestBody CreateInvoiceRequest request) {
    var lines =
        request.lines().stream()
            .map(
                line ->
                    InvoiceLine.of(
                        line.description(),
                        line.unitAmount(),
                        line.quantity() != null ? line.quantity() : BigDecimal.ONE,
                        request.currency(),
                        line.type() != null ? line.type() : InvoiceLineType.MANUAL,
                        line.metadata()))
            .toList();
    var invoice =
        billingOrchestrator.createInvoice(
            request.customerId(),
            request.subscriptionId(),
            request.currency(),
            request.dueDate(),
            lines);
    return ResponseEntity.created(URI.create("/api/admin/invoices/" + invoice.getId()))
        .body(InvoiceResponse.from(invoice));
  }

  @PostMapping("/{id}/send")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<InvoiceResponse> send(@PathVariable UUID id) {
    return ResponseEntity.ok(InvoiceResponse.from(billingOrchestrator.sendInvoice(id)));
  }

  @PostMapping("/{id}/pay")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<InvoiceResponse> pay(
      @PathVariable UUID id, @RequestBody(required = false) PayInvoiceRequest request) {
    String paymentMethod = request != null ? request.paymentMethod() : null;
    return ResponseEntity.ok(
        InvoiceResponse.from(billingOrchestrator.payInvoice(id, paymentMethod)));
  }

  @PostMapping("/{id}/void")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN')")
  public ResponseEntity<InvoiceResponse> voidInvoice(@PathVariable UUID id) {
    return ResponseEntity.ok(InvoiceResponse.from(billingOrchestrator.voidInvoice(id)));
  }

  // --- DTOs ---

  public record CreateInvoiceRequest(
      @NotNull UUID customerId,
      UUID subscriptionId,
      @NotBlank String currency,
      LocalDate dueDate,
      @NotEmpty List<@Valid LineRequest> lines) {}

  public record LineRequest(
      @NotBlank String description,
      @NotNull @PositiveOrZero BigDecimal unitAmount,
      @PositiveOrZero BigDecimal quantity,
      InvoiceLineType type,
      Map<String, String> metadata) {}

  public record PayInvoiceRequest(String paymentMethod) {}

  public record InvoiceResponse(
      UUID id,
      String tenantId,
      UUID customerId,
      UUID subscriptionId,
      String invoiceNumber,
      InvoiceStatus status,
      String currency,
      BigDecimal total,
      List<InvoiceLine> lines,
      LocalDate dueDate,
      Instant periodStart,
      Instant periodEnd,
      int paymentAttempts,
      String paymentReference,
      Instant paidAt) {

    public static InvoiceResponse from(Invoice invoice) {
      return new InvoiceResponse(
          invoice.getId(),
          invoice.getTenantId(),
          invoice.getCustomerId(),
          invoice.getSubscriptionId(),
          invoice.getInvoiceNumber(),
          invoice.getStatus(),
          invoice.getCurrency(),
          invoice.getTotal(),
          invoice.getLines(),
          invoice.getDueDate(),
          invoice.getPeriodStart(),
          invoice.getPeriodEnd(),
          invoice.getPaymentAttempts(),
          invoice.getPaymentReference(),
          invoice.getPaidAt());
    }
  }
}
