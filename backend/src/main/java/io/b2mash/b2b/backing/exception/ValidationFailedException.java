package io.b2mash.b2b.backing.exception;

import java.util.List;

public class ValidationFailedException extends BackingException {

  public ValidationFailedException(String detail) {
    this(List.of(detail));
  }

  public ValidationFailedException(List<String> problems) {
    super(ErrorKind.VALIDATION_FAILED, "Validation failed", List.copyOf(problems));
  }
}
