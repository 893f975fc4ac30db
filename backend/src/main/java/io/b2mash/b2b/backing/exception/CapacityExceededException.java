package io.b2mash.b2b.backing.exception;

import java.util.List;

public class CapacityExceededException extends BackingException {

  public CapacityExceededException(String tierName) {
    super(
        ErrorKind.CAPACITY_EXCEEDED,
        "Capacity exceeded",
        List.of("No more tickets left for " + tierName));
  }
}
