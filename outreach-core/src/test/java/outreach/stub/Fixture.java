package outreach.stub;

import outreach.delivery.AccessDelivery;
import outreach.funnel.FunnelRecorder;
import outreach.payment.CheckoutService;
import outreach.payment.PaymentReconciler;
import outreach.payment.PaymentRepository;
import outreach.retry.NotificationPublisher;
import outreach.retry.RetryQueue;
import outreach.retry.SinkNames;
import outreach.schedule.DueTimeScheduler;
import outreach.spi.NotificationSink;
import outreach.store.InMemoryKeyValueStore;
import outreach.store.StoreKeys;
import outreach.subject.SubjectRepository;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payment-side components wired over one in-memory store with stub collaborators.
 */
public final class Fixture {
    public final MutableClock clock = MutableClock.atEpochSecond(1_700_000_000L);
    public final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
    public final StoreKeys keys = new StoreKeys();
    public final CountingMetrics metrics = new CountingMetrics();
    public final RecordingChatSender chat = new RecordingChatSender();
    public final StubPaymentGateway gateway = new StubPaymentGateway();
    public final RecordingSink orders;
    public final RecordingSink events = new RecordingSink();

    public final SubjectRepository subjects = new SubjectRepository(store, keys, "bot-a", Duration.ofDays(60), clock);
    public final PaymentRepository payments = new PaymentRepository(store, keys, clock);
    public final FunnelRecorder funnel = new FunnelRecorder(store, keys, clock);
    public final DueTimeScheduler scheduler;
    public final AccessDelivery delivery;
    public final RetryQueue retryQueue;
    public final NotificationPublisher publisher;
    public final PaymentReconciler reconciler;
    public final CheckoutService checkouts;

    public Fixture() {
        this(0);
    }

    /**
     * @param orderFailures sends the order sink fails before it starts recording
     */
    public Fixture(int orderFailures) {
        orders = new RecordingSink(orderFailures);
        scheduler = DueTimeScheduler.builder()
                .store(store)
                .keys(keys)
                .subjects(subjects)
                .action(subjectId -> true)
                .clock(clock)
                .metrics(metrics)
                .build();
        delivery = AccessDelivery.builder()
                .store(store)
                .keys(keys)
                .subjects(subjects)
                .chatSender(chat)
                .portalUrl("https://portal.example/access")
                .clock(clock)
                .build();
        Map<String, NotificationSink> sinks = new LinkedHashMap<>();
        sinks.put(SinkNames.ANALYTICS_ORDER, orders);
        sinks.put(SinkNames.ANALYTICS_EVENT, events);
        sinks.put(SinkNames.ACCESS_DELIVERY, delivery.asRetrySink());
        RetryQueue.Builder rb = RetryQueue.builder().store(store).keys(keys).clock(clock).metrics(metrics);
        sinks.forEach(rb::sink);
        retryQueue = rb.build();
        publisher = new NotificationPublisher(sinks, retryQueue);
        reconciler = PaymentReconciler.builder()
                .payments(payments)
                .subjects(subjects)
                .scheduler(scheduler)
                .delivery(delivery)
                .publisher(publisher)
                .funnel(funnel)
                .metrics(metrics)
                .clock(clock)
                .build();
        checkouts = new CheckoutService(payments, gateway, funnel, CheckoutService.DEFAULT_REUSE_WINDOW, clock);
    }
}
