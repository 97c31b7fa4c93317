package io.fairway.platform.ledger;

import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.security.Action;
import io.fairway.platform.security.IsolationGuard;
import io.fairway.platform.security.ResourceType;
import io.fairway.platform.security.TargetResource;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side of the revenue ledger. Tenant-scoped reads go through the isolation guard; the
 * platform-wide metrics endpoint is restricted to platform admins.
 */
@RestController
@RequestMapping("/api/admin")
public class RevenueController {

  private final RevenueLedger revenueLedger;
  private final IsolationGuard isolationGuard;
  private final Clock clock;

  public RevenueController(
      RevenueLedger revenueLedger, IsolationGuard isolationGuard, Clock clock) {
    this.revenueLedger = revenueLedger;
    this.isolationGuard = isolationGuard;
    this.clock = clock;
  }

  @GetMapping("/tenants/{tenantId}/revenue/events")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'CHAIN_ADMIN')")
  public ResponseEntity<List<RevenueEvent>> events(
      @PathVariable UUID tenantId,
      @RequestParam(required = false) Set<RevenueEventType> type,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to,
      @RequestParam(required = false) String customerId,
      @RequestParam(required = false) String subscriptionId) {
    guard(tenantId);
    var query =
        new RevenueQuery(tenantId.toString(), type, range(from, to), customerId, subscriptionId);
    return ResponseEntity.ok(revenueLedger.query(query));
  }

  @GetMapping("/tenants/{tenantId}/revenue/metrics")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'CHAIN_ADMIN')")
  public ResponseEntity<LedgerMetrics> tenantMetrics(
      @PathVariable UUID tenantId,
      @RequestParam(required = false) RevenuePeriod period,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to) {
    guard(tenantId);
    return ResponseEntity.ok(metrics(tenantId.toString(), period, asOf, from, to));
  }

  @GetMapping("/revenue/metrics")
  @PreAuthorize("hasRole('PLATFORM_ADMIN')")
  public ResponseEntity<LedgerMetrics> platformMetrics(
      @RequestParam(required = false) RevenuePeriod period,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to) {
    return ResponseEntity.ok(metrics(null, period, asOf, from, to));
  }

  private LedgerMetrics metrics(
      String tenantId, RevenuePeriod period, Instant asOf, Instant from, Instant to) {
    if (period != null && (from != null || to != null)) {
      throw new InvalidRequestException(
          "Conflicting parameters", "Use either period/asOf or from/to, not both");
    }
    if (from != null || to != null) {
      return revenueLedger.metrics(tenantId, range(from, to));
    }
    RevenuePeriod effective = period != null ? period : RevenuePeriod.MONTHLY;
    return revenueLedger.metrics(tenantId, effective, asOf != null ? asOf : clock.instant());
  }

  private static DateRange range(Instant from, Instant to) {
    try {
      return new DateRange(from, to);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Invalid date range", e.getMessage());
    }
  }

  private void guard(UUID tenantId) {
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.REVENUE, tenantId, tenantId), Action.READ);
  }
}
