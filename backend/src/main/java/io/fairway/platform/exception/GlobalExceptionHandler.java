package io.fairway.platform.exception;

import io.fairway.platform.audit.AuditEventBuilder;
import io.fairway.platform.audit.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Renders every error as an RFC-7807 problem. The typed {@link
 * org.springframework.web.ErrorResponseException} subclasses are handled by the base class; this
 * adds role denials, boundary denials and processor failures.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("security.access_denied")
            .entityType("security")
            .entityId(UUID.randomUUID())
            .details(
                Map.of(
                    "path", request.getRequestURI(),
                    "method", request.getMethod(),
                    "reason", "insufficient_role"))
            .build());

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  // Already audited by the isolation guard; only the request path is added to the log here.
  @ExceptionHandler(CrossTenantViolationException.class)
  public ResponseEntity<ProblemDetail> handleCrossTenant(
      CrossTenantViolationException ex, HttpServletRequest request) {
    log.warn(
        "Cross-tenant request rejected: path={}, method={}, requestingTenant={}, owningTenant={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getRequestingTenantId(),
        ex.getOwningTenantId());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(PaymentProcessorException.class)
  public ResponseEntity<ProblemDetail> handlePaymentProcessor(PaymentProcessorException ex) {
    log.error(
        "Payment processor failure (idempotencyKey={}): {}",
        ex.getIdempotencyKey(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ex.getBody());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    log.debug("Rejected invalid argument: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.badRequest().body(problem);
  }
}
