package io.fairway.platform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a tenant resource limit would be exceeded (child tenants, custom domains, or a child
 * limit above its parent's).
 */
public class PlanLimitExceededException extends ErrorResponseException {

  public PlanLimitExceededException(String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Plan limit exceeded");
    problem.setDetail(detail);
    problem.setProperty("upgradeUrl", "/settings/billing");
    return problem;
  }
}
