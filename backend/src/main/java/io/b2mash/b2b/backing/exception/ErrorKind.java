package io.b2mash.b2b.backing.exception;

import org.springframework.http.HttpStatus;

/** Error categories reported to clients in the {@code errors} array of a problem response. */
public enum ErrorKind {
  NOT_FOUND("NotFound", HttpStatus.NOT_FOUND),
  UNAUTHORIZED("Unauthorized", HttpStatus.FORBIDDEN),
  VALIDATION_FAILED("ValidationFailed", HttpStatus.BAD_REQUEST),
  CAPACITY_EXCEEDED("CapacityExceeded", HttpStatus.CONFLICT),
  PAYMENT_ERROR("PaymentError", HttpStatus.PAYMENT_REQUIRED);

  private final String label;
  private final HttpStatus status;

  ErrorKind(String label, HttpStatus status) {
    this.label = label;
    this.status = status;
  }

  public String label() {
    return label;
  }

  public HttpStatus status() {
    return status;
  }
}
