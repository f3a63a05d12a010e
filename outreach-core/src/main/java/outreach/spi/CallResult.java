package outreach.spi;

import java.util.Objects;

/**
 * Outcome of a call to an external collaborator (chat platform, payment gateway, analytics sink).
 *
 * <p>Collaborators report failures as values instead of throwing, and callers decide whether
 * to log and continue, enqueue a retry, or surface a message to the user.
 *
 * @param <T> the success payload type
 */
public sealed interface CallResult<T> permits CallResult.Success, CallResult.Failure {

  static <T> CallResult<T> success(T value) {
    return new Success<>(value);
  }

  static CallResult<Void> ok() {
    return new Success<>(null);
  }

  static <T> CallResult<T> failure(ErrorKind kind, String message) {
    return new Failure<>(kind, message);
  }

  boolean isSuccess();

  /**
   * Successful call carrying an optional value.
   */
  record Success<T>(T value) implements CallResult<T> {
    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  /**
   * Failed call.
   */
  record Failure<T>(ErrorKind kind, String message) implements CallResult<T> {
    public Failure {
      Objects.requireNonNull(kind, "kind");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }
  }
}
