package io.fairway.platform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A request crossed a tenant boundary. Never downgraded to not-found so callers can tell "denied"
 * apart from "absent".
 */
public class CrossTenantViolationException extends ErrorResponseException {

  private final String requestingTenantId;
  private final String owningTenantId;

  public CrossTenantViolationException(
      String requestingTenantId, String owningTenantId, String resource) {
    super(HttpStatus.FORBIDDEN, createProblem(resource), null);
    this.requestingTenantId = requestingTenantId;
    this.owningTenantId = owningTenantId;
  }

  public String getRequestingTenantId() {
    return requestingTenantId;
  }

  public String getOwningTenantId() {
    return owningTenantId;
  }

  private static ProblemDetail createProblem(String resource) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Cross-tenant access denied");
    problem.setDetail("Access to " + resource + " is outside the requesting tenant's boundary");
    return problem;
  }
}
