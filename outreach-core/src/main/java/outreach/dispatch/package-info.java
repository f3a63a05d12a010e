/**
 * Event ingestion: the {@link outreach.dispatch.DispatchLoop} drains the durable queue with
 * bounded concurrency and routes each {@link outreach.InboundEvent} through a
 * {@link outreach.dispatch.HandlerRegistry}.
 *
 * <h2>Acknowledgement</h2>
 * <p>Popping moves the raw payload into a processing list named after the owner tag; the task
 * removes it when it finishes, whatever the outcome. A crash between pop and completion leaves
 * the payload in that list, and the next {@code start()} with the same tag requeues it.
 */
package outreach.dispatch;
