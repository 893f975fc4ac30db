package io.b2mash.b2b.backing.exception;

import java.util.List;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base class for errors surfaced by the order and membership pipeline. The problem body carries an
 * ordered {@code errors} property of {@link ApiError} entries; the detail is the first message.
 */
public abstract class BackingException extends ErrorResponseException {

  private final ErrorKind kind;
  private final List<ApiError> errors;

  protected BackingException(ErrorKind kind, String title, List<String> messages) {
    super(kind.status(), createProblem(kind, title, messages), null);
    this.kind = kind;
    this.errors = messages.stream().map(message -> ApiError.of(kind, message)).toList();
  }

  public ErrorKind getKind() {
    return kind;
  }

  public List<ApiError> getErrors() {
    return errors;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(ErrorKind kind, String title, List<String> messages) {
    if (messages.isEmpty()) {
      throw new IllegalArgumentException("At least one error message is required");
    }
    var problem = ProblemDetail.forStatus(kind.status());
    problem.setTitle(title);
    problem.setDetail(messages.get(0));
    problem.setProperty(
        "errors", messages.stream().map(message -> ApiError.of(kind, message)).toList());
    return problem;
  }
}
