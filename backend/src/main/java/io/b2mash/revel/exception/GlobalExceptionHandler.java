package io.b2mash.revel.exception;

import io.b2mash.revel.notification.context.InvalidNotificationContextException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidNotificationContextException.class)
  public ResponseEntity<ProblemDetail> handleInvalidContext(
      InvalidNotificationContextException ex, HttpServletRequest request) {
    log.warn(
        "Rejected notification context: path={}, type={}, reason={}",
        request.getRequestURI(),
        ex.getNotificationType(),
        ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Invalid notification context");
    problem.setDetail(ex.getMessage());
    problem.setProperty("violations", ex.getViolations());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
  }
}
