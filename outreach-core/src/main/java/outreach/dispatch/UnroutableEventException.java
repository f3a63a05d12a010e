package outreach.dispatch;

/**
 * Thrown when no handler is registered for an event's kind.
 */
public class UnroutableEventException extends RuntimeException {

  public UnroutableEventException(String message) {
    super(message);
  }
}
