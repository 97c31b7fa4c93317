package io.fairway.platform.export;

import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TenantExportController {

  private final TenantExportService tenantExportService;

  public TenantExportController(TenantExportService tenantExportService) {
    this.tenantExportService = tenantExportService;
  }

  @GetMapping("/api/admin/tenants/{tenantId}/export")
  @PreAuthorize("hasAnyRole('OWNER', 'ADMIN', 'CHAIN_ADMIN')")
  public ResponseEntity<TenantExport> export(@PathVariable UUID tenantId) {
    var export = tenantExportService.export(tenantId);
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            "attachment; filename=\"tenant-" + export.tenant().slug() + "-export.json\"")
        .body(export);
  }
}
