package outreach.dispatch;

import outreach.EventHandler;
import outreach.EventKind;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry holding one handler per {@link EventKind}.
 *
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register(EventKind.START, startHandler)
 *     .register(EventKind.BUY, checkoutHandler);
 * }</pre>
 *
 * <p>Registering a kind again replaces the previous handler.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  private final Map<EventKind, EventHandler> handlers = new ConcurrentHashMap<>();

  /**
   * @return this registry for chaining
   */
  public DefaultHandlerRegistry register(EventKind kind, EventHandler handler) {
    handlers.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(handler, "handler"));
    return this;
  }

  /**
   * Registers the handler only if the kind has none yet.
   *
   * @return this registry for chaining
   */
  public DefaultHandlerRegistry registerIfAbsent(EventKind kind, EventHandler handler) {
    handlers.putIfAbsent(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(handler, "handler"));
    return this;
  }

  @Override
  public EventHandler handlerFor(EventKind kind) {
    return handlers.get(kind);
  }
}
