package outreach;

import outreach.delivery.AccessDelivery;
import outreach.dispatch.DefaultHandlerRegistry;
import outreach.dispatch.DispatchLoop;
import outreach.dispatch.EventDecoder;
import outreach.funnel.FunnelRecorder;
import outreach.handler.CallbackHandler;
import outreach.handler.ChatReplies;
import outreach.handler.CheckoutHandler;
import outreach.handler.FollowupAction;
import outreach.handler.MessageHandler;
import outreach.handler.Messages;
import outreach.handler.StartHandler;
import outreach.handler.VerifyPaymentHandler;
import outreach.ops.OpsReporter;
import outreach.payment.CheckoutService;
import outreach.payment.PaymentReconciler;
import outreach.payment.PaymentRepository;
import outreach.payment.PendingPaymentPoller;
import outreach.retry.NotificationPublisher;
import outreach.retry.RetryPolicy;
import outreach.retry.RetryQueue;
import outreach.retry.SinkNames;
import outreach.schedule.DueTimeScheduler;
import outreach.spi.ChatSender;
import outreach.spi.KeyValueStore;
import outreach.spi.MetricsExporter;
import outreach.spi.NotificationSink;
import outreach.spi.PaymentGateway;
import outreach.store.StoreKeys;
import outreach.subject.SubjectRepository;
import outreach.util.TrackedTasks;
import outreach.webhook.FlatGatewayEventParser;
import outreach.webhook.GatewayEventParser;
import outreach.webhook.GatewayWebhookHandler;
import outreach.webhook.IngressReceiver;
import outreach.webhook.SignatureVerifier;

import java.math.BigDecimal;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the dispatch loop, the due-time scheduler, the payment
 * poller and the retry queue over one {@link KeyValueStore} into a single
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Outreach outreach = Outreach.builder()
 *     .store(store)
 *     .chatSender(chat)
 *     .paymentGateway(gateway)
 *     .portalUrl("https://example.com/portal")
 *     .build()) {
 *   outreach.start();
 *   outreach.ingress().accept(secretHeader, body);
 * }
 * }</pre>
 *
 * <p>Built-in handlers cover every {@link EventKind}; handlers passed to
 * {@link Builder#handler} replace them.
 */
public final class Outreach implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Outreach.class.getName());

  private final StoreKeys keys;
  private final SubjectRepository subjects;
  private final PaymentRepository payments;
  private final FunnelRecorder funnel;
  private final DefaultHandlerRegistry handlers;
  private final DispatchLoop dispatchLoop;
  private final DueTimeScheduler scheduler;
  private final PendingPaymentPoller poller;
  private final RetryQueue retryQueue;
  private final NotificationPublisher publisher;
  private final AccessDelivery delivery;
  private final CheckoutService checkouts;
  private final PaymentReconciler reconciler;
  private final IngressReceiver ingress;
  private final GatewayWebhookHandler gatewayWebhook;
  private final OpsReporter ops;
  private final TrackedTasks delayedTasks;
  private final MetricsExporter metrics;
  private final String consumerId;

  private boolean started;
  private boolean closed;

  private Outreach(Builder b) {
    KeyValueStore store = Objects.requireNonNull(b.store, "store");
    ChatSender chatSender = Objects.requireNonNull(b.chatSender, "chatSender");
    PaymentGateway gateway = Objects.requireNonNull(b.paymentGateway, "paymentGateway");
    Objects.requireNonNull(b.portalUrl, "portalUrl");
    Clock clock = b.clock != null ? b.clock : Clock.systemUTC();
    this.metrics = b.metrics != null ? b.metrics : MetricsExporter.NOOP;
    this.keys = b.keys != null ? b.keys : new StoreKeys();
    Messages messages = b.messages != null ? b.messages : Messages.defaults();
    this.consumerId = b.consumerId != null ? b.consumerId : localConsumerId();

    this.subjects = new SubjectRepository(store, keys, b.ownerTag, b.subjectTtl, clock);
    this.payments = new PaymentRepository(store, keys, clock);
    this.funnel = new FunnelRecorder(store, keys, clock);
    this.delayedTasks = new TrackedTasks("outreach-delayed-", b.drainTimeoutMs);

    DueTimeScheduler[] schedulerRef = new DueTimeScheduler[1];
    ChatReplies replies = new ChatReplies(chatSender, subjects, subjectId -> schedulerRef[0].unschedule(subjectId));
    this.scheduler = DueTimeScheduler.builder()
        .store(store)
        .keys(keys)
        .subjects(subjects)
        .action(new FollowupAction(subjects, payments, replies, messages, b.offerAmount))
        .clock(clock)
        .batchSize(b.schedulerBatchSize)
        .maxFirings(b.maxFirings)
        .idleIntervalMs(b.schedulerIdleIntervalMs)
        .errorBackoffMs(b.schedulerErrorBackoffMs)
        .metrics(metrics)
        .build();
    schedulerRef[0] = scheduler;

    this.delivery = AccessDelivery.builder()
        .store(store)
        .keys(keys)
        .subjects(subjects)
        .chatSender(chatSender)
        .portalUrl(b.portalUrl)
        .messageText(b.deliveryText)
        .buttonLabel(b.deliveryButton)
        .clock(clock)
        .build();

    Map<String, NotificationSink> sinks = new LinkedHashMap<>(b.sinks);
    sinks.put(SinkNames.ACCESS_DELIVERY, delivery.asRetrySink());
    RetryQueue.Builder rb = RetryQueue.builder()
        .store(store)
        .keys(keys)
        .maxAttempts(b.retryMaxAttempts)
        .batchSize(b.retryBatchSize)
        .intervalMs(b.retryIntervalMs)
        .retryPolicy(b.retryPolicy)
        .clock(clock)
        .metrics(metrics);
    sinks.forEach(rb::sink);
    this.retryQueue = rb.build();
    this.publisher = new NotificationPublisher(sinks, retryQueue);

    this.reconciler = PaymentReconciler.builder()
        .payments(payments)
        .subjects(subjects)
        .scheduler(scheduler)
        .delivery(delivery)
        .publisher(publisher)
        .funnel(funnel)
        .metrics(metrics)
        .clock(clock)
        .build();
    this.poller = PendingPaymentPoller.builder()
        .payments(payments)
        .gateway(gateway)
        .reconciler(reconciler)
        .sampleSize(b.pollSampleSize)
        .maxConcurrentLookups(b.maxConcurrentLookups)
        .intervalMs(b.pollIntervalMs)
        .build();
    this.checkouts = new CheckoutService(payments, gateway, funnel, b.checkoutReuseWindow, clock);

    CheckoutHandler checkoutHandler = new CheckoutHandler(subjects, checkouts, replies, messages, b.offerAmount);
    VerifyPaymentHandler verifyHandler = new VerifyPaymentHandler(payments, gateway, reconciler, replies, messages);
    this.handlers = new DefaultHandlerRegistry()
        .register(EventKind.START, new StartHandler(subjects, scheduler, delivery, funnel, replies,
            delayedTasks, messages, b.offerAmount, b.followupDelay, b.secondMessageDelay))
        .register(EventKind.BUY, checkoutHandler)
        .register(EventKind.VERIFY_PAYMENT, verifyHandler)
        .register(EventKind.CALLBACK,
            new CallbackHandler(checkoutHandler, verifyHandler, payments, replies, messages, funnel))
        .register(EventKind.MESSAGE, new MessageHandler(replies, messages));
    b.handlers.forEach(handlers::register);

    DispatchLoop.Builder db = DispatchLoop.builder()
        .store(store)
        .keys(keys)
        .handlerRegistry(handlers)
        .consumerId(consumerId)
        .maxConcurrency(b.maxConcurrency)
        .popTimeout(b.popTimeout)
        .drainTimeoutMs(b.drainTimeoutMs)
        .metrics(metrics);
    if (b.decoder != null) {
      db.decoder(b.decoder);
    }
    this.dispatchLoop = db.build();

    this.ingress = new IngressReceiver(store, keys, b.ingressSecret);
    this.gatewayWebhook = new GatewayWebhookHandler(new SignatureVerifier(b.webhookSecret),
        b.gatewayEventParser != null ? b.gatewayEventParser : new FlatGatewayEventParser(),
        payments, reconciler, metrics);
    this.ops = new OpsReporter(store, keys, consumerId, funnel);
  }

  private static String localConsumerId() {
    String host = System.getenv("HOSTNAME");
    if (host != null && !host.isBlank()) {
      return host;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      throw new IllegalStateException("Cannot resolve the local host name; set consumerId explicitly", e);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the background loops: retry drain, payment poller, due-time scheduler and, last,
   * the dispatch loop. If one fails to start, those already started are closed before
   * rethrowing.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("Outreach has been closed");
    }
    if (started) {
      return;
    }
    started = true;
    try {
      retryQueue.start();
      poller.start();
      scheduler.start();
      dispatchLoop.start();
    } catch (RuntimeException e) {
      close();
      throw e;
    }
    logger.log(Level.INFO, "Outreach started for owner {0} as consumer {1}",
        new Object[] {subjects.ownerTag(), consumerId});
  }

  /**
   * Shuts down components in order: dispatch loop, delayed sends, scheduler, poller, retry
   * queue. Metrics exporters that are {@link AutoCloseable} are closed last.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException first = null;
    AutoCloseable[] components = {dispatchLoop, delayedTasks, scheduler, poller, retryQueue};
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  public StoreKeys keys() {
    return keys;
  }

  public String consumerId() {
    return consumerId;
  }

  public SubjectRepository subjects() {
    return subjects;
  }

  public PaymentRepository payments() {
    return payments;
  }

  public FunnelRecorder funnel() {
    return funnel;
  }

  public DefaultHandlerRegistry handlers() {
    return handlers;
  }

  public DispatchLoop dispatchLoop() {
    return dispatchLoop;
  }

  public DueTimeScheduler scheduler() {
    return scheduler;
  }

  public PendingPaymentPoller poller() {
    return poller;
  }

  public RetryQueue retryQueue() {
    return retryQueue;
  }

  public NotificationPublisher publisher() {
    return publisher;
  }

  public AccessDelivery delivery() {
    return delivery;
  }

  public CheckoutService checkouts() {
    return checkouts;
  }

  public PaymentReconciler reconciler() {
    return reconciler;
  }

  public IngressReceiver ingress() {
    return ingress;
  }

  public GatewayWebhookHandler gatewayWebhook() {
    return gatewayWebhook;
  }

  public OpsReporter ops() {
    return ops;
  }

  /**
   * Builder for {@link Outreach}. Only the store, the chat sender, the payment gateway and the
   * portal URL are required; every other setting has a default.
   */
  public static final class Builder {
    private KeyValueStore store;
    private ChatSender chatSender;
    private PaymentGateway paymentGateway;
    private String portalUrl;
    private StoreKeys keys;
    private String ownerTag = "default";
    private String consumerId;
    private Clock clock;
    private MetricsExporter metrics;
    private EventDecoder decoder;
    private GatewayEventParser gatewayEventParser;
    private final Map<String, NotificationSink> sinks = new LinkedHashMap<>();
    private final Map<EventKind, EventHandler> handlers = new EnumMap<>(EventKind.class);
    private Messages messages;
    private BigDecimal offerAmount = new BigDecimal("19.90");
    private String deliveryText = "Payment confirmed. Here is your access:";
    private String deliveryButton = "Open portal";
    private String ingressSecret = "";
    private String webhookSecret = "";
    private Duration subjectTtl = Duration.ofDays(60);

    private int maxConcurrency = 100;
    private Duration popTimeout = Duration.ofSeconds(1);
    private long drainTimeoutMs = 5000;

    private int schedulerBatchSize = 50;
    private int maxFirings = 1;
    private long schedulerIdleIntervalMs = 1000;
    private long schedulerErrorBackoffMs = 2000;
    private Duration followupDelay = StartHandler.DEFAULT_FOLLOWUP_DELAY;
    private Duration secondMessageDelay = StartHandler.DEFAULT_SECOND_MESSAGE_DELAY;

    private int pollSampleSize = 50;
    private int maxConcurrentLookups = 10;
    private long pollIntervalMs = 20_000;
    private Duration checkoutReuseWindow = CheckoutService.DEFAULT_REUSE_WINDOW;

    private int retryMaxAttempts = 3;
    private int retryBatchSize = 10;
    private long retryIntervalMs = 30_000;
    private RetryPolicy retryPolicy;

    private Builder() {}

    /** Required. */
    public Builder store(KeyValueStore store) {
      this.store = store;
      return this;
    }

    /** Required. */
    public Builder chatSender(ChatSender chatSender) {
      this.chatSender = chatSender;
      return this;
    }

    /** Required. */
    public Builder paymentGateway(PaymentGateway paymentGateway) {
      this.paymentGateway = paymentGateway;
      return this;
    }

    /**
     * Sets the portal base URL sent to paying subjects.
     *
     * <p><b>Required.</b>
     */
    public Builder portalUrl(String portalUrl) {
      this.portalUrl = portalUrl;
      return this;
    }

    /** Optional. Defaults to {@link StoreKeys#DEFAULT_PREFIX}. */
    public Builder keys(StoreKeys keys) {
      this.keys = keys;
      return this;
    }

    /**
     * Sets the deployment tag written into subject records. Replicas of one deployment share
     * it.
     *
     * <p>Optional. Defaults to {@code "default"}.
     */
    public Builder ownerTag(String ownerTag) {
      this.ownerTag = Objects.requireNonNull(ownerTag, "ownerTag");
      return this;
    }

    /**
     * Sets the per-process id naming the dispatch processing list. Each replica needs its own,
     * kept across restarts.
     *
     * <p>Optional. Defaults to the {@code HOSTNAME} environment variable, else the local host
     * name.
     *
     * @see DispatchLoop.Builder#consumerId(String)
     */
    public Builder consumerId(String consumerId) {
      this.consumerId = Objects.requireNonNull(consumerId, "consumerId");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link outreach.dispatch.FlatEventDecoder}. */
    public Builder decoder(EventDecoder decoder) {
      this.decoder = decoder;
      return this;
    }

    /** Optional. Defaults to {@link FlatGatewayEventParser}. */
    public Builder gatewayEventParser(GatewayEventParser gatewayEventParser) {
      this.gatewayEventParser = gatewayEventParser;
      return this;
    }

    /**
     * Registers an outbound notification sink, typically {@link SinkNames#ANALYTICS_ORDER} or
     * {@link SinkNames#ANALYTICS_EVENT}.
     */
    public Builder sink(String name, NotificationSink sink) {
      sinks.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(sink, "sink"));
      return this;
    }

    /**
     * Registers a handler, replacing the built-in one for that kind.
     */
    public Builder handler(EventKind kind, EventHandler handler) {
      handlers.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public Builder messages(Messages messages) {
      this.messages = messages;
      return this;
    }

    /**
     * Sets the amount offered by the start message and the followup.
     *
     * <p>Optional. Defaults to {@code 19.90}. Must be &gt; 0.
     */
    public Builder offerAmount(BigDecimal offerAmount) {
      Objects.requireNonNull(offerAmount, "offerAmount");
      if (offerAmount.signum() <= 0) {
        throw new IllegalArgumentException("offerAmount must be > 0");
      }
      this.offerAmount = offerAmount;
      return this;
    }

    public Builder deliveryText(String deliveryText) {
      this.deliveryText = Objects.requireNonNull(deliveryText, "deliveryText");
      return this;
    }

    public Builder deliveryButton(String deliveryButton) {
      this.deliveryButton = Objects.requireNonNull(deliveryButton, "deliveryButton");
      return this;
    }

    /** Optional. Empty accepts every ingress request. */
    public Builder ingressSecret(String ingressSecret) {
      this.ingressSecret = ingressSecret == null ? "" : ingressSecret;
      return this;
    }

    /** Optional. Empty disables gateway signature checks. */
    public Builder webhookSecret(String webhookSecret) {
      this.webhookSecret = webhookSecret == null ? "" : webhookSecret;
      return this;
    }

    /** Optional. Defaults to 60 days. */
    public Builder subjectTtl(Duration subjectTtl) {
      this.subjectTtl = Objects.requireNonNull(subjectTtl, "subjectTtl");
      return this;
    }

    /** Optional. Defaults to {@code 100}. */
    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /** Optional. Defaults to 1 second. */
    public Builder popTimeout(Duration popTimeout) {
      this.popTimeout = Objects.requireNonNull(popTimeout, "popTimeout");
      return this;
    }

    /** Optional. Defaults to {@code 5000}. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /** Optional. Defaults to {@code 50}. */
    public Builder schedulerBatchSize(int schedulerBatchSize) {
      this.schedulerBatchSize = schedulerBatchSize;
      return this;
    }

    /** Optional. Defaults to {@code 1}. */
    public Builder maxFirings(int maxFirings) {
      this.maxFirings = maxFirings;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. */
    public Builder schedulerIdleIntervalMs(long schedulerIdleIntervalMs) {
      this.schedulerIdleIntervalMs = schedulerIdleIntervalMs;
      return this;
    }

    /** Optional. Defaults to {@code 2000}. */
    public Builder schedulerErrorBackoffMs(long schedulerErrorBackoffMs) {
      this.schedulerErrorBackoffMs = schedulerErrorBackoffMs;
      return this;
    }

    /** Optional. Defaults to 360 seconds. */
    public Builder followupDelay(Duration followupDelay) {
      this.followupDelay = Objects.requireNonNull(followupDelay, "followupDelay");
      return this;
    }

    /** Optional. Defaults to 5 seconds. */
    public Builder secondMessageDelay(Duration secondMessageDelay) {
      this.secondMessageDelay = Objects.requireNonNull(secondMessageDelay, "secondMessageDelay");
      return this;
    }

    /** Optional. Defaults to {@code 50}. */
    public Builder pollSampleSize(int pollSampleSize) {
      this.pollSampleSize = pollSampleSize;
      return this;
    }

    /** Optional. Defaults to {@code 10}. */
    public Builder maxConcurrentLookups(int maxConcurrentLookups) {
      this.maxConcurrentLookups = maxConcurrentLookups;
      return this;
    }

    /** Optional. Defaults to {@code 20000}. */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /** Optional. Defaults to 30 minutes. */
    public Builder checkoutReuseWindow(Duration checkoutReuseWindow) {
      this.checkoutReuseWindow = Objects.requireNonNull(checkoutReuseWindow, "checkoutReuseWindow");
      return this;
    }

    /** Optional. Defaults to {@code 3}. */
    public Builder retryMaxAttempts(int retryMaxAttempts) {
      this.retryMaxAttempts = retryMaxAttempts;
      return this;
    }

    /** Optional. Defaults to {@code 10}. */
    public Builder retryBatchSize(int retryBatchSize) {
      this.retryBatchSize = retryBatchSize;
      return this;
    }

    /** Optional. Defaults to {@code 30000}. */
    public Builder retryIntervalMs(long retryIntervalMs) {
      this.retryIntervalMs = retryIntervalMs;
      return this;
    }

    /** Optional. Defaults to {@link RetryPolicy#NEXT_CYCLE}. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Wires the components. Call {@link Outreach#start()} to start the background loops.
     */
    public Outreach build() {
      return new Outreach(this);
    }
  }
}
