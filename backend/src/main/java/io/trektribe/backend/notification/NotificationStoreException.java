package io.trektribe.backend.notification;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The backing store rejected or could not complete an operation. The problem body is deliberately
 * generic; the cause is kept for logging only.
 */
public class NotificationStoreException extends ErrorResponseException {

  private final String operation;

  public NotificationStoreException(String operation, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(operation), cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }

  private static ProblemDetail createProblem(String operation) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    if ("insert".equals(operation)) {
      problem.setTitle("Notification could not be recorded");
      problem.setDetail("The notification could not be recorded. Please retry later.");
    } else {
      problem.setTitle("Notification could not be updated");
      problem.setDetail("The notification request could not be completed. Please retry later.");
    }
    return problem;
  }
}
