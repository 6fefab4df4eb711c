package io.trektribe.backend.exception;

import io.trektribe.backend.notification.NotificationStoreException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(NotificationStoreException.class)
  public ResponseEntity<ProblemDetail> handleStoreFailure(
      NotificationStoreException ex, HttpServletRequest request) {
    log.error(
        "Notification store failure: path={}, method={}, operation={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getOperation(),
        ex.getCause());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ex.getBody());
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ProblemDetail> handleDataAccess(
      DataAccessException ex, HttpServletRequest request) {
    log.error(
        "Unhandled data access failure: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Service unavailable");
    problem.setDetail("The request could not be completed. Please retry later.");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }
}
