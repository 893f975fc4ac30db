package io.b2mash.b2b.backing.exception;

import java.util.List;

public class ResourceNotFoundException extends BackingException {

  public ResourceNotFoundException(String resourceType, Object id) {
    this(
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id: " + id);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail);
  }

  private ResourceNotFoundException(String title, String detail) {
    super(ErrorKind.NOT_FOUND, title, List.of(detail));
  }
}
