package outreach.spi;

/**
 * Classification of a failed external call.
 */
public enum ErrorKind {
  /** Network error, timeout or 5xx; may succeed later. */
  TRANSIENT,
  /** The recipient refuses messages (blocked the bot, chat not found, deactivated). */
  FORBIDDEN,
  /** The referenced object does not exist on the remote side. */
  NOT_FOUND,
  /** The remote side rejected the request as invalid. */
  REJECTED,
  /** The remote answer could not be understood. */
  MALFORMED
}
