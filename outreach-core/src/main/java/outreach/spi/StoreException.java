package outreach.spi;

/**
 * Unchecked exception raised by {@link KeyValueStore} implementations.
 *
 * <p>The {@link Kind} tells call sites whether retrying later can help.
 */
public class StoreException extends RuntimeException {

  /** Failure classification. */
  public enum Kind {
    /** Store unreachable or timed out; a later attempt may succeed. */
    UNAVAILABLE,
    /** Key holds a different data type than the operation expects. */
    WRONG_TYPE,
    /** Anything else reported by the backend. */
    FAILURE
  }

  private final Kind kind;

  public StoreException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public StoreException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isTransient() {
    return kind == Kind.UNAVAILABLE;
  }
}
