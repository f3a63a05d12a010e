package outreach;

/**
 * Explicit tag of an {@link InboundEvent}; handlers are looked up by kind.
 */
public enum EventKind {
  /** The subject (re)started the conversation. */
  START,
  /** Free text or a command other than start. */
  MESSAGE,
  /** The subject chose a plan; attribute {@code amount} carries the price. */
  BUY,
  /** The subject asked to re-check a payment. */
  VERIFY_PAYMENT,
  /** Any other button press; attribute {@code data} carries the raw callback data. */
  CALLBACK
}
