package io.fairway.platform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A revenue event id was reused with a different payload. Replaying an identical event is not an
 * error and never raises this.
 */
public class DuplicateEventException extends ErrorResponseException {

  private final String eventId;

  public DuplicateEventException(String eventId) {
    super(HttpStatus.CONFLICT, createProblem(eventId), null);
    this.eventId = eventId;
  }

  public String getEventId() {
    return eventId;
  }

  private static ProblemDetail createProblem(String eventId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Duplicate revenue event");
    problem.setDetail(
        "Revenue event " + eventId + " was already recorded with a different payload");
    problem.setProperty("eventId", eventId);
    return problem;
  }
}
