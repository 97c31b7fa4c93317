package io.fairway.platform.analytics;

import io.fairway.platform.exception.InvalidRequestException;
import io.fairway.platform.ledger.DateRange;
import io.fairway.platform.ledger.RevenuePeriod;
import io.fairway.platform.security.Action;
import io.fairway.platform.security.IsolationGuard;
import io.fairway.platform.security.ResourceType;
import io.fairway.platform.security.TargetResource;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
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
 * Revenue analytics of one tenant. {@code asOf} defaults to now; ranges default to the current
 * calendar month.
 */
@RestController
@RequestMapping("/api/admin/tenants/{tenantId}/analytics")
@PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'CHAIN_ADMIN')")
public class AnalyticsController {

  private final AnalyticsAggregator analyticsAggregator;
  private final IsolationGuard isolationGuard;
  private final Clock clock;

  public AnalyticsController(
      AnalyticsAggregator analyticsAggregator, IsolationGuard isolationGuard, Clock clock) {
    this.analyticsAggregator = analyticsAggregator;
    this.isolationGuard = isolationGuard;
    this.clock = clock;
  }

  @GetMapping("/mrr")
  public ResponseEntity<RecurringRevenue> mrr(
      @PathVariable UUID tenantId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf) {
    guard(tenantId);
    return ResponseEntity.ok(analyticsAggregator.mrr(tenantId.toString(), orNow(asOf)));
  }

  @GetMapping("/arpu")
  public ResponseEntity<AverageRevenue> arpu(
      @PathVariable UUID tenantId,
      @RequestParam(required = false) RevenuePeriod period,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to) {
    guard(tenantId);
    return ResponseEntity.ok(
        analyticsAggregator.arpu(tenantId.toString(), range(period, from, to)));
  }

  @GetMapping("/churn-risk")
  public ResponseEntity<ChurnRisk> churnRisk(
      @PathVariable UUID tenantId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf) {
    guard(tenantId);
    return ResponseEntity.ok(analyticsAggregator.churnRisk(tenantId.toString(), orNow(asOf)));
  }

  @GetMapping("/lifetime-value")
  public ResponseEntity<List<CustomerLifetimeValue>> lifetimeValues(
      @PathVariable UUID tenantId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf) {
    guard(tenantId);
    return ResponseEntity.ok(
        analyticsAggregator.lifetimeValues(tenantId.toString(), orNow(asOf)));
  }

  @GetMapping("/customers/{customerId}/lifetime-value")
  public ResponseEntity<CustomerLifetimeValue> lifetimeValue(
      @PathVariable UUID tenantId,
      @PathVariable String customerId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf) {
    guard(tenantId);
    return ResponseEntity.ok(
        analyticsAggregator.lifetimeValue(tenantId.toString(), customerId, orNow(asOf)));
  }

  @GetMapping("/forecast")
  public ResponseEntity<RevenueForecast> forecast(
      @PathVariable UUID tenantId,
      @RequestParam(defaultValue = "3") int months,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf) {
    guard(tenantId);
    return ResponseEntity.ok(
        analyticsAggregator.forecast(tenantId.toString(), orNow(asOf), months));
  }

  @GetMapping("/breakdown")
  public ResponseEntity<RevenueBreakdown> breakdown(
      @PathVariable UUID tenantId,
      @RequestParam(required = false) RevenuePeriod period,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to) {
    guard(tenantId);
    return ResponseEntity.ok(
        analyticsAggregator.breakdown(tenantId.toString(), range(period, from, to)));
  }

  private DateRange range(RevenuePeriod period, Instant from, Instant to) {
    if (from != null || to != null) {
      if (period != null) {
        throw new InvalidRequestException(
            "Conflicting parameters", "Use either period or from/to, not both");
      }
      try {
        return new DateRange(from, to);
      } catch (IllegalArgumentException e) {
        throw new InvalidRequestException("Invalid date range", e.getMessage());
      }
    }
    return (period != null ? period : RevenuePeriod.MONTHLY).containing(clock.instant());
  }

  private Instant orNow(Instant asOf) {
    return asOf != null ? asOf : clock.instant();
  }

  private void guard(UUID tenantId) {
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.ANALYTICS, tenantId, tenantId), Action.READ);
  }
}
