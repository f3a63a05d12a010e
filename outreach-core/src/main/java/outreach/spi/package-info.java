/**
 * Service provider interfaces: the shared {@link outreach.spi.KeyValueStore}, the outbound
 * collaborators ({@link outreach.spi.ChatSender}, {@link outreach.spi.NotificationSink},
 * {@link outreach.spi.PaymentGateway}) and the {@link outreach.spi.MetricsExporter} hook.
 *
 * <p>Outbound collaborators return {@link outreach.spi.CallResult} values; the store raises
 * {@link outreach.spi.StoreException}.
 */
package outreach.spi;
