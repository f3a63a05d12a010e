package outreach.handler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import outreach.EventKind;
import outreach.InboundEvent;
import outreach.payment.ExternalIds;
import outreach.payment.PaymentRecord;
import outreach.payment.PaymentStatus;
import outreach.schedule.SchedulingState;
import outreach.spi.CallResult;
import outreach.spi.ChatMessage;
import outreach.spi.ErrorKind;
import outreach.stub.Await;
import outreach.stub.Fixture;
import outreach.util.TrackedTasks;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlersTest {

    private static final BigDecimal PRICE = new BigDecimal("19.90");

    private Fixture f;
    private Messages messages;
    private ChatReplies replies;
    private TrackedTasks delayed;

    @BeforeEach
    void setUp() {
        f = new Fixture();
        messages = Messages.defaults();
        replies = new ChatReplies(f.chat, f.subjects, f.scheduler::unschedule);
        delayed = new TrackedTasks("test-delayed-", 1_000);
    }

    @AfterEach
    void tearDown() {
        delayed.close();
    }

    private StartHandler startHandler(Duration secondMessageDelay) {
        return new StartHandler(f.subjects, f.scheduler, f.delivery, f.funnel, replies, delayed, messages,
                PRICE, StartHandler.DEFAULT_FOLLOWUP_DELAY, secondMessageDelay);
    }

    private String checkout(String subjectId) {
        f.subjects.register(subjectId, "chat-" + subjectId);
        CallResult<PaymentRecord> created = f.checkouts.checkout(subjectId, PRICE);
        return ((CallResult.Success<PaymentRecord>) created).value().transactionId();
    }

    // ── Start ───────────────────────────────────────────────────────

    @Test
    void startSchedulesFollowupAndGreets() {
        startHandler(Duration.ofMillis(10)).handle(InboundEvent.of(EventKind.START, "42", "4200"));

        assertEquals(SchedulingState.SCHEDULED, f.scheduler.state("42"));
        assertEquals("bot-a", f.subjects.find("42").orElseThrow().ownerTag());
        ChatMessage welcome = f.chat.sent().get(0);
        assertEquals("4200", welcome.chatId());
        assertEquals(messages.welcome(), welcome.text());
        assertEquals("cta:buy:19.90", welcome.buttons().get(0).callbackData());
        assertEquals(1L, f.funnel.counters().get("start"));

        Await.until(() -> f.chat.sent().size() == 2, 5_000);
        assertEquals(messages.secondMessage(), f.chat.last().text());
    }

    @Test
    void startParameterAttributionIsStored() {
        startHandler(Duration.ofSeconds(30)).handle(new InboundEvent("u1", EventKind.START, "42", "4200",
                "/start utm_source=ads&utm_campaign=spring", Map.of()));

        assertEquals(Map.of("utm_source", "ads", "utm_campaign", "spring"), f.subjects.attribution("42"));
        assertEquals(SchedulingState.SCHEDULED, f.scheduler.state("42"));
    }

    @Test
    void startWithoutParameterStoresNoAttribution() {
        startHandler(Duration.ofSeconds(30)).handle(InboundEvent.of(EventKind.START, "42", "4200"));
        assertTrue(f.subjects.attribution("42").isEmpty());
    }

    @Test
    void restartResetsFollowupCycle() {
        StartHandler handler = startHandler(Duration.ofMillis(10));
        handler.handle(InboundEvent.of(EventKind.START, "42", "4200"));
        f.clock.advance(Duration.ofSeconds(361));
        f.scheduler.poll();
        assertEquals(SchedulingState.FIRED, f.scheduler.state("42"));

        handler.handle(InboundEvent.of(EventKind.START, "42", "4200"));

        assertEquals(SchedulingState.SCHEDULED, f.scheduler.state("42"));
    }

    @Test
    void startFromPaidSubjectResendsAccess() {
        f.subjects.register("42", "4200");
        f.reconciler.reconcile("42", "OK", ExternalIds.NONE);
        assertEquals(1, f.chat.sent().size());

        startHandler(Duration.ofMillis(10)).handle(InboundEvent.of(EventKind.START, "42", "4200"));

        assertEquals(2, f.chat.sent().size());
        assertTrue(f.chat.last().buttons().get(0).url().startsWith("https://portal.example/access?key="));
        assertEquals(SchedulingState.UNSCHEDULED, f.scheduler.state("42"));
    }

    @Test
    void secondMessageSkippedOncePaid() throws Exception {
        startHandler(Duration.ofMillis(200)).handle(InboundEvent.of(EventKind.START, "42", "4200"));
        f.subjects.markPaid("42");

        Thread.sleep(400);

        assertEquals(1, f.chat.sent().size());
    }

    @Test
    void blockedWelcomeCancelsFollowup() {
        f.chat.failWith(ErrorKind.FORBIDDEN);

        startHandler(Duration.ofMillis(10)).handle(InboundEvent.of(EventKind.START, "42", "4200"));

        assertTrue(f.subjects.isBlocked("42"));
        assertEquals(SchedulingState.UNSCHEDULED, f.scheduler.state("42"));
        assertEquals(0, delayed.size());
    }

    @Test
    void startClearsBlockedFlag() {
        f.subjects.register("42", "4200");
        f.subjects.markBlocked("42");

        startHandler(Duration.ofSeconds(30)).handle(InboundEvent.of(EventKind.START, "42", "4200"));

        assertFalse(f.subjects.isBlocked("42"));
        assertEquals(1, f.chat.sent().size());
    }

    // ── Checkout ────────────────────────────────────────────────────

    @Test
    void buyCreatesCheckoutLink() {
        CheckoutHandler handler = new CheckoutHandler(f.subjects, f.checkouts, replies, messages, PRICE);

        handler.handle(new InboundEvent("u1", EventKind.BUY, "42", "4200", null,
                Map.of(InboundEvent.ATTR_AMOUNT, "29.90")));

        ChatMessage reply = f.chat.last();
        assertEquals(messages.checkoutReady(), reply.text());
        assertEquals("https://pay.example/tx-1", reply.buttons().get(0).url());
        assertEquals(Offers.VERIFY, reply.buttons().get(1).callbackData());
        assertEquals(0, new BigDecimal("29.90").compareTo(f.gateway.requests().get(0).amount()));
        assertTrue(f.payments.isPending("42"));
    }

    @Test
    void buyWithInvalidAmountUsesDefault() {
        CheckoutHandler handler = new CheckoutHandler(f.subjects, f.checkouts, replies, messages, PRICE);

        handler.handle(new InboundEvent("u1", EventKind.BUY, "42", "4200", null,
                Map.of(InboundEvent.ATTR_AMOUNT, "-5")));

        assertEquals(0, PRICE.compareTo(f.gateway.requests().get(0).amount()));
    }

    @Test
    void buyReportsGatewayFailure() {
        f.gateway.failCreateWith(ErrorKind.TRANSIENT);
        CheckoutHandler handler = new CheckoutHandler(f.subjects, f.checkouts, replies, messages, PRICE);

        handler.handle(InboundEvent.of(EventKind.BUY, "42", "4200"));

        assertEquals(messages.tryAgain(), f.chat.last().text());
    }

    @Test
    void buyAfterPaymentSaysConfirmed() {
        checkout("42");
        f.reconciler.reconcile("42", "OK", ExternalIds.NONE);
        CheckoutHandler handler = new CheckoutHandler(f.subjects, f.checkouts, replies, messages, PRICE);

        handler.handle(InboundEvent.of(EventKind.BUY, "42", "4200"));

        assertEquals(messages.paymentConfirmed(), f.chat.last().text());
        assertEquals(1, f.gateway.requests().size());
    }

    // ── Verify ──────────────────────────────────────────────────────

    private VerifyPaymentHandler verifyHandler() {
        return new VerifyPaymentHandler(f.payments, f.gateway, f.reconciler, replies, messages);
    }

    @Test
    void verifyWithoutPayment() {
        verifyHandler().handle(InboundEvent.of(EventKind.VERIFY_PAYMENT, "42", "4200"));
        assertEquals(messages.noPayment(), f.chat.last().text());
    }

    @Test
    void verifyConfirmsPaidTransaction() {
        String tx = checkout("42");
        f.gateway.status(tx, "PAID");

        verifyHandler().handle(InboundEvent.of(EventKind.VERIFY_PAYMENT, "42", "chat-42"));

        assertTrue(f.subjects.isPaid("42"));
        assertEquals(messages.paymentConfirmed(), f.chat.last().text());
        assertEquals(2, f.chat.sent().size());
    }

    @Test
    void verifyReportsPendingAndFailed() {
        String tx = checkout("42");

        verifyHandler().handle(InboundEvent.of(EventKind.VERIFY_PAYMENT, "42", "chat-42"));
        assertEquals(messages.paymentPending(), f.chat.last().text());

        f.gateway.status(tx, "CANCELED");
        verifyHandler().handle(InboundEvent.of(EventKind.VERIFY_PAYMENT, "42", "chat-42"));
        assertEquals(messages.paymentFailed(), f.chat.last().text());
        assertEquals(PaymentStatus.CANCELED, f.payments.find("42").orElseThrow().status());
    }

    @Test
    void verifyLookupFailureReportsPending() {
        String tx = checkout("42");
        f.gateway.failLookup(tx, ErrorKind.TRANSIENT);

        verifyHandler().handle(InboundEvent.of(EventKind.VERIFY_PAYMENT, "42", "chat-42"));

        assertEquals(messages.paymentPending(), f.chat.last().text());
    }

    @Test
    void verifyOfConfirmedPaymentSkipsLookup() {
        checkout("42");
        f.reconciler.reconcile("42", "OK", ExternalIds.NONE);

        verifyHandler().handle(InboundEvent.of(EventKind.VERIFY_PAYMENT, "42", "chat-42"));

        assertEquals(0, f.gateway.lookups());
        assertEquals(messages.paymentConfirmed(), f.chat.last().text());
    }

    // ── Callback ────────────────────────────────────────────────────

    private CallbackHandler callbackHandler() {
        return new CallbackHandler(new CheckoutHandler(f.subjects, f.checkouts, replies, messages, PRICE),
                verifyHandler(), f.payments, replies, messages, f.funnel);
    }

    private static InboundEvent callback(String data) {
        return new InboundEvent("cb-1", EventKind.CALLBACK, "42", "4200", null, Map.of(InboundEvent.ATTR_DATA, data));
    }

    @Test
    void buyCallbackCreatesCheckoutForAmount() throws Exception {
        callbackHandler().handle(callback("cta:buy:24.90"));

        assertEquals(0, new BigDecimal("24.90").compareTo(f.gateway.requests().get(0).amount()));
        assertEquals(messages.checkoutReady(), f.chat.last().text());
        assertEquals(1L, f.funnel.counters().get("cta_buy_clicked"));
    }

    @Test
    void verifyCallbackChecksPayment() throws Exception {
        String tx = checkout("42");
        f.gateway.status(tx, "OK");

        callbackHandler().handle(callback(Offers.VERIFY));

        assertTrue(f.subjects.isPaid("42"));
        assertEquals(1L, f.funnel.counters().get("verify_clicked"));
    }

    @Test
    void showCallbackResendsOpenCheckout() throws Exception {
        callbackHandler().handle(callback(Offers.SHOW_CHECKOUT));
        assertEquals(messages.noPayment(), f.chat.last().text());

        checkout("42");
        callbackHandler().handle(callback(Offers.SHOW_CHECKOUT));
        assertEquals("https://pay.example/tx-1", f.chat.last().buttons().get(0).url());
    }

    @Test
    void unknownCallbackIsIgnored() throws Exception {
        callbackHandler().handle(callback("preview:more"));
        callbackHandler().handle(InboundEvent.of(EventKind.CALLBACK, "42", "4200"));
        assertTrue(f.chat.sent().isEmpty());
    }

    // ── Message ─────────────────────────────────────────────────────

    @Test
    void pingAnswersPong() {
        MessageHandler handler = new MessageHandler(replies, messages);
        handler.handle(new InboundEvent(null, EventKind.MESSAGE, "42", null, " /ping ", null));
        assertEquals("pong", f.chat.last().text());
        assertEquals("42", f.chat.last().chatId());

        handler.handle(new InboundEvent(null, EventKind.MESSAGE, "42", null, "hello", null));
        assertEquals(messages.acknowledgement(), f.chat.last().text());

        handler.handle(new InboundEvent(null, EventKind.MESSAGE, "42", null, "/debug", null));
        assertEquals(2, f.chat.sent().size());
    }

    // ── Followup ────────────────────────────────────────────────────

    @Test
    void followupOffersPurchase() {
        f.subjects.register("42", "4200");
        FollowupAction action = new FollowupAction(f.subjects, f.payments, replies, messages, PRICE);

        assertTrue(action.fire("42"));

        assertEquals(messages.offer(), f.chat.last().text());
        assertEquals("cta:buy:19.90", f.chat.last().buttons().get(0).callbackData());
        assertNull(f.chat.last().buttons().get(0).url());
    }

    @Test
    void followupRemindsOfOpenCheckout() {
        checkout("42");
        FollowupAction action = new FollowupAction(f.subjects, f.payments, replies, messages, PRICE);

        assertTrue(action.fire("42"));

        assertEquals(messages.reminder(), f.chat.last().text());
        assertEquals("https://pay.example/tx-1", f.chat.last().buttons().get(0).url());
    }

    @Test
    void followupSkipsPaidBlockedForeignAndUnknownSubjects() {
        FollowupAction action = new FollowupAction(f.subjects, f.payments, replies, messages, PRICE);
        f.subjects.register("paid", "1");
        f.subjects.markPaid("paid");
        f.subjects.register("blocked", "2");
        f.subjects.markBlocked("blocked");
        f.store.hashPut(f.keys.subject("foreign"), "owner_tag", "bot-b");

        assertFalse(action.fire("paid"));
        assertFalse(action.fire("blocked"));
        assertFalse(action.fire("foreign"));
        assertFalse(action.fire("unknown"));
        assertTrue(f.chat.sent().isEmpty());
    }

    @Test
    void followupToBlockedChatMarksSubject() {
        f.subjects.register("42", "4200");
        f.chat.failWith(ErrorKind.FORBIDDEN);
        FollowupAction action = new FollowupAction(f.subjects, f.payments, replies, messages, PRICE);

        assertFalse(action.fire("42"));
        assertTrue(f.subjects.isBlocked("42"));
    }

    @Test
    void offerAmountParsing() {
        assertEquals(new BigDecimal("19.90"), Offers.parseAmount(" 19.90 "));
        assertNull(Offers.parseAmount("0"));
        assertNull(Offers.parseAmount("abc"));
        assertNull(Offers.parseAmount(null));
    }
}
