package io.b2mash.b2b.backing.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(BackingException.class)
  public ResponseEntity<ProblemDetail> handleBackingException(
      BackingException ex, HttpServletRequest request) {
    log.warn(
        "{}: path={}, method={}, errors={}",
        ex.getKind().label(),
        request.getRequestURI(),
        request.getMethod(),
        ex.getErrors().size());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    var messages =
        ex.getBindingResult().getAllErrors().stream()
            .map(
                error ->
                    error instanceof FieldError fieldError
                        ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                        : error.getDefaultMessage())
            .toList();
    var validation =
        new ValidationFailedException(messages.isEmpty() ? List.of("Invalid request") : messages);
    log.warn("ValidationFailed: {} invalid field(s)", messages.size());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .headers(headers)
        .body(validation.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    return conflict();
  }

  @ExceptionHandler(PessimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handlePessimisticLock(
      PessimisticLockingFailureException ex) {
    log.warn("Lock acquisition failed: {}", ex.getMessage());
    return conflict();
  }

  private ResponseEntity<ProblemDetail> conflict() {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    problem.setProperty(
        "errors",
        List.of(ApiError.of(ErrorKind.CAPACITY_EXCEEDED, "Resource is busy, please retry")));
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
