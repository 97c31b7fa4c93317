package io.fairway.platform.exception;

import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class RateLimitExceededException extends ErrorResponseException {

  private final Duration retryAfter;

  public RateLimitExceededException(String tenantId, String endpoint, Duration retryAfter) {
    super(HttpStatus.TOO_MANY_REQUESTS, createProblem(tenantId, endpoint, retryAfter), null);
    this.retryAfter = retryAfter;
    getHeaders().set("Retry-After", Long.toString(retryAfterSeconds(retryAfter)));
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }

  private static long retryAfterSeconds(Duration retryAfter) {
    long seconds = retryAfter.toSeconds();
    return retryAfter.toMillis() % 1000 == 0 ? seconds : seconds + 1;
  }

  private static ProblemDetail createProblem(
      String tenantId, String endpoint, Duration retryAfter) {
    var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Rate limit exceeded");
    problem.setDetail("Tenant " + tenantId + " exceeded the request ceiling for " + endpoint);
    problem.setProperty("retryAfterSeconds", retryAfterSeconds(retryAfter));
    return problem;
  }
}
