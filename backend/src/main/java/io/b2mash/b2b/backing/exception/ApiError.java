package io.b2mash.b2b.backing.exception;

public record ApiError(String kind, String message) {

  public static ApiError of(ErrorKind kind, String message) {
    return new ApiError(kind.label(), message);
  }
}
