package io.fairway.platform.usage;

import io.fairway.platform.security.Action;
import io.fairway.platform.security.IsolationGuard;
import io.fairway.platform.security.ResourceType;
import io.fairway.platform.security.TargetResource;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Usage and quota views of one tenant. Chain admins may read their direct children. */
@RestController
@RequestMapping("/api/admin/tenants/{tenantId}/usage")
public class UsageController {

  private final UsageMeter usageMeter;
  private final QuotaLimitResolver quotaLimitResolver;
  private final OverageCalculator overageCalculator;
  private final IsolationGuard isolationGuard;

  public UsageController(
      UsageMeter usageMeter,
      QuotaLimitResolver quotaLimitResolver,
      OverageCalculator overageCalculator,
      IsolationGuard isolationGuard) {
    this.usageMeter = usageMeter;
    this.quotaLimitResolver = quotaLimitResolver;
    this.overageCalculator = overageCalculator;
    this.isolationGuard = isolationGuard;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'MEMBER', 'CHAIN_ADMIN')")
  public ResponseEntity<UsageSummary> currentUsage(@PathVariable UUID tenantId) {
    guard(tenantId, Action.READ);
    return ResponseEntity.ok(usageMeter.currentUsage(tenantId.toString()));
  }

  @GetMapping("/quotas")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'MEMBER', 'CHAIN_ADMIN')")
  public ResponseEntity<List<QuotaCheck>> quotas(@PathVariable UUID tenantId) {
    guard(tenantId, Action.READ);
    var checks =
        Arrays.stream(QuotaType.values())
            .map(type -> usageMeter.checkQuota(tenantId.toString(), type))
            .toList();
    return ResponseEntity.ok(checks);
  }

  @GetMapping("/records")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'CHAIN_ADMIN')")
  public ResponseEntity<List<UsageRecord>> records(
      @PathVariable UUID tenantId,
      @RequestParam(defaultValue = "HOUR") Granularity granularity,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to) {
    guard(tenantId, Action.READ);
    return ResponseEntity.ok(usageMeter.records(tenantId.toString(), granularity, from, to));
  }

  /** Overage the current month would incur if billed now. */
  @GetMapping("/overage")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'BILLING', 'CHAIN_ADMIN')")
  public ResponseEntity<OverageSummary> overage(@PathVariable UUID tenantId) {
    guard(tenantId, Action.READ);
    String id = tenantId.toString();
    var allowance = quotaLimitResolver.allowance(id);
    if (allowance.isEmpty()) {
      return ResponseEntity.noContent().build();
    }
    var current = usageMeter.currentUsage(id);
    var actual = new EnumMap<QuotaType, Long>(QuotaType.class);
    actual.put(QuotaType.API_CALLS, current.calls());
    actual.put(QuotaType.BANDWIDTH, current.bytes());
    actual.put(QuotaType.STORAGE, usageMeter.storedBytes(id));
    return ResponseEntity.ok(overageCalculator.calculate(allowance.get(), actual));
  }

  @PutMapping("/storage")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN')")
  public ResponseEntity<QuotaCheck> recordStorage(
      @PathVariable UUID tenantId, @RequestBody StorageReport report) {
    guard(tenantId, Action.WRITE);
    usageMeter.recordStorage(tenantId.toString(), report.bytes());
    return ResponseEntity.ok(usageMeter.checkQuota(tenantId.toString(), QuotaType.STORAGE));
  }

  public record StorageReport(long bytes) {}

  private void guard(UUID tenantId, Action action) {
    isolationGuard.validateBoundary(
        TargetResource.of(ResourceType.USAGE, tenantId, tenantId), action);
  }
}
