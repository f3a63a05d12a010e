package outreach.dispatch;

import outreach.InboundEvent;

/**
 * Turns a raw queue payload into an {@link InboundEvent}.
 *
 * @see FlatEventDecoder
 */
@FunctionalInterface
public interface EventDecoder {

  /**
   * @return the decoded event, or {@code null} if the payload is valid but carries nothing to
   *     handle (for example a channel update type the engine ignores)
   * @throws IllegalArgumentException if the payload is malformed
   */
  InboundEvent decode(String raw);
}
