package io.fairway.platform.customer;

import io.fairway.platform.billing.BillingOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/customers")
public class CustomerController {

  private final BillingOrchestrator billingOrchestrator;

  public CustomerController(BillingOrchestrator billingOrchestrator) {
    this.billingOrchestrator = billingOrchestrator;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<List<CustomerResponse>> list() {
    return ResponseEntity.ok(
        billingOrchestrator.listCustomers().stream().map(CustomerResponse::from).toList());
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<CustomerResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(CustomerResponse.from(billingOrchestrator.getCustomer(id)));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<CustomerResponse> create(
      @Valid @RequestBody CreateCustomerRequest request) {
    var customer =
        billingOrchestrator.createCustomer(
            request.email(),
            request.displayName(),
            request.metadata(),
            request.paymentMethod(),
            request.userId());
    return ResponseEntity.created(URI.create("/api/admin/customers/" + customer.getId()))
        .body(CustomerResponse.from(customer));
  }

  @PutMapping("/{id}/payment-method")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING')")
  public ResponseEntity<CustomerResponse> updatePaymentMethod(
      @PathVariable UUID id, @Valid @RequestBody PaymentMethodRequest request) {
    return ResponseEntity.ok(
        CustomerResponse.from(
            billingOrchestrator.updatePaymentMethod(id, request.paymentMethod())));
  }

  public record CreateCustomerRequest(
      @NotBlank @Email String email,
      @NotBlank String displayName,
      Map<String, String> metadata,
      String paymentMethod,
      String userId) {}

  public record PaymentMethodRequest(@NotBlank String paymentMethod) {}

  public record CustomerResponse(
      UUID id,
      String tenantId,
      String email,
      String displayName,
      Map<String, String> metadata,
      boolean hasPaymentMethod,
      String userId,
      Instant createdAt) {

    public static CustomerResponse from(Customer customer) {
      return new CustomerResponse(
          customer.getId(),
          customer.getTenantId(),
          customer.getEmail(),
          customer.getDisplayName(),
          customer.getMetadata(),
          customer.getDefaultPaymentMethod() != null,
          customer.getUserId(),
          customer.getCreatedAt());
    }
  }
}
