package io.fairway.platform.usage;

import io.fairway.platform.multitenancy.TenantContext;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion endpoint for gateways and sidecars that meter calls outside this process. Always
 * answers 202: malformed entries are dropped and logged by the meter.
 */
@RestController
@RequestMapping("/api/metering")
public class MeteringController {

  private final UsageMeter usageMeter;

  public MeteringController(UsageMeter usageMeter) {
    this.usageMeter = usageMeter;
  }

  @PostMapping("/calls")
  public ResponseEntity<IngestionResponse> recordCalls(@RequestBody List<MeteredCall> calls) {
    String tenantId = TenantContext.requireTenantId();
    for (MeteredCall call : calls) {
      usageMeter.recordCall(
          tenantId, call.endpoint(), call.statusCode(), call.latencyMillis(), call.bytes());
    }
    return ResponseEntity.accepted().body(new IngestionResponse(calls.size()));
  }

  public record MeteredCall(String endpoint, int statusCode, long latencyMillis, long bytes) {}

  public record IngestionResponse(int accepted) {}
}
