package io.trektribe.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when an ownership-scoped lookup finds nothing. The detail never distinguishes an id that
 * does not exist from one that belongs to another recipient.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String title, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(title, detail), null);
  }

  public static ResourceNotFoundException notification(UUID id) {
    return new ResourceNotFoundException(
        "Notification not found", "No notification found with id " + id);
  }

  public static ResourceNotFoundException notifications() {
    return new ResourceNotFoundException(
        "Notification not found", "One or more notifications were not found");
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
