package io.fairway.platform.persistence;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class StaleVersionException extends ErrorResponseException {

  public StaleVersionException(String entityType, Object id, long expected, long actual) {
    super(HttpStatus.CONFLICT, createProblem(entityType, id, expected, actual), null);
  }

  private static ProblemDetail createProblem(
      String entityType, Object id, long expected, long actual) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail(
        entityType
            + " "
            + id
            + " was modified concurrently (version "
            + expected
            + " is stale, current is "
            + actual
            + "). Please retry.");
    return problem;
  }
}
