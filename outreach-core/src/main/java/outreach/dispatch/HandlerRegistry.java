package outreach.dispatch;

import outreach.EventHandler;
import outreach.EventKind;

/**
 * Lookup table from {@link EventKind} to the handler that processes it.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * @return the handler for {@code kind}, or {@code null} if none is registered
   */
  EventHandler handlerFor(EventKind kind);
}
