package outreach;

/**
 * Business reaction to one {@link InboundEvent}.
 *
 * <p>Handlers run concurrently on dispatch tasks. Any exception is caught and logged by the
 * dispatch loop; the event is not redelivered.
 *
 * @see outreach.dispatch.HandlerRegistry
 */
@FunctionalInterface
public interface EventHandler {

  void handle(InboundEvent event) throws Exception;
}
