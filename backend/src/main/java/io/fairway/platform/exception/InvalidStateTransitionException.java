package io.fairway.platform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A lifecycle transition that the state machine does not permit from the current state. */
public class InvalidStateTransitionException extends ErrorResponseException {

  private final String currentState;
  private final String attemptedTransition;

  public InvalidStateTransitionException(
      String entityType, Object currentState, String attemptedTransition) {
    super(
        HttpStatus.CONFLICT,
        createProblem(entityType, String.valueOf(currentState), attemptedTransition),
        null);
    this.currentState = String.valueOf(currentState);
    this.attemptedTransition = attemptedTransition;
  }

  public String getCurrentState() {
    return currentState;
  }

  public String getAttemptedTransition() {
    return attemptedTransition;
  }

  private static ProblemDetail createProblem(
      String entityType, String currentState, String attemptedTransition) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Invalid " + entityType + " state transition");
    problem.setDetail(
        "Cannot " + attemptedTransition + " " + entityType + " in status " + currentState);
    problem.setProperty("currentState", currentState);
    problem.setProperty("attemptedTransition", attemptedTransition);
    return problem;
  }
}
