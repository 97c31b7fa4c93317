package io.fairway.platform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The processor returned an error or did not answer in time. The outcome is ambiguous: retry with
 * the same idempotency key, never treat it as a decline.
 */
public class PaymentProcessorException extends ErrorResponseException {

  private final String idempotencyKey;

  public PaymentProcessorException(String detail, String idempotencyKey) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail, idempotencyKey), null);
    this.idempotencyKey = idempotencyKey;
  }

  public String getIdempotencyKey() {
    return idempotencyKey;
  }

  private static ProblemDetail createProblem(String detail, String idempotencyKey) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Payment processor unavailable");
    problem.setDetail(detail);
    problem.setProperty("idempotencyKey", idempotencyKey);
    problem.setProperty("retryable", true);
    return problem;
  }
}
