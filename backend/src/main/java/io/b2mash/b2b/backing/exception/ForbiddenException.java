package io.b2mash.b2b.backing.exception;

import java.util.List;

/** The actor is known (or anonymous) but not allowed to perform the operation. */
public class ForbiddenException extends BackingException {

  public ForbiddenException(String title, String detail) {
    super(ErrorKind.UNAUTHORIZED, title, List.of(detail));
  }
}
