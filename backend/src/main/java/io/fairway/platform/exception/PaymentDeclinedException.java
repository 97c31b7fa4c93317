package io.fairway.platform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The processor definitively declined a charge. Recoverable by retry or customer action. */
public class PaymentDeclinedException extends ErrorResponseException {

  private final String processorReference;

  public PaymentDeclinedException(String detail, String processorReference) {
    super(HttpStatus.PAYMENT_REQUIRED, createProblem(detail, processorReference), null);
    this.processorReference = processorReference;
  }

  public String getProcessorReference() {
    return processorReference;
  }

  private static ProblemDetail createProblem(String detail, String processorReference) {
    var problem = ProblemDetail.forStatus(HttpStatus.PAYMENT_REQUIRED);
    problem.setTitle("Payment declined");
    problem.setDetail(detail);
    if (processorReference != null) {
      problem.setProperty("processorReference", processorReference);
    }
    return problem;
  }
}
