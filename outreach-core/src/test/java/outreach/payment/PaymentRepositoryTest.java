package outreach.payment;

import org.junit.jupiter.api.Test;
import outreach.spi.ErrorKind;
import outreach.spi.PaymentGateway;
import outreach.store.InMemoryKeyValueStore;
import outreach.store.StoreKeys;
import outreach.stub.MutableClock;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PaymentRepositoryTest {

    private final MutableClock clock = MutableClock.atEpochSecond(1_700_000_000L);
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
    private final StoreKeys keys = new StoreKeys();
    private final PaymentRepository payments = new PaymentRepository(store, keys, clock);

    private void saveCheckout() {
        payments.saveCheckout("7", "7-1", new BigDecimal("19.90"),
                new PaymentGateway.Checkout("tx-1", "https://pay.example/tx-1", "WAITING_PAYMENT"));
    }

    @Test
    void missingRecordIsEmpty() {
        assertTrue(payments.find("7").isEmpty());
        assertFalse(payments.isConfirmed("7"));
    }

    @Test
    void checkoutIsStoredAndIndexed() {
        saveCheckout();
        PaymentRecord record = payments.find("7").orElseThrow();
        assertEquals("tx-1", record.transactionId());
        assertEquals("7-1", record.identifier());
        assertEquals(PaymentStatus.PENDING, record.status());
        assertEquals("WAITING_PAYMENT", record.rawStatus());
        assertEquals(new BigDecimal("19.90"), record.amount());
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), record.createdAt());
        assertNull(record.confirmedAt());
        assertTrue(payments.isPending("7"));
        assertEquals(1, payments.pendingCount());
        assertEquals("7", payments.resolve("tx-1"));
        assertEquals("7", payments.resolve("7-1"));
    }

    @Test
    void confirmationIsClaimedOnceAndWinsOverLaterStatus() {
        saveCheckout();
        assertTrue(payments.claimConfirmation("7"));
        assertFalse(payments.claimConfirmation("7"));

        payments.recordStatus("7", PaymentStatus.EXPIRED, "EXPIRED");

        PaymentRecord record = payments.find("7").orElseThrow();
        assertEquals(PaymentStatus.OK, record.status());
        assertTrue(record.isConfirmed());
        assertEquals("EXPIRED", record.rawStatus());
    }

    @Test
    void identifiersDoNotOverwriteTransaction() {
        saveCheckout();
        payments.recordIdentifiers("7", new ExternalIds("tx-other", null, "evt_9"));
        assertEquals("tx-1", payments.find("7").orElseThrow().transactionId());
        assertEquals("7", payments.resolve("evt_9"));
        assertEquals(List.of("tx-other", "evt_9"), new ExternalIds("tx-other", null, "evt_9").all());
    }

    @Test
    void unknownStoredStatusFallsBackToRawStatus() {
        store.hashPut(keys.payment("7"), "status", "LEGACY");
        store.hashPut(keys.payment("7"), "raw_status", "paid");
        assertEquals(PaymentStatus.OK, payments.find("7").orElseThrow().status());
    }

    @Test
    void resolveIgnoresBlankIds() {
        assertNull(payments.resolve(null));
        assertNull(payments.resolve(""));
        payments.mapIdentifier("", "7");
        assertTrue(store.hashGetAll(keys.identifierMap()).isEmpty());
    }

    @Test
    void checkoutErrorExpiresAfterADay() {
        payments.recordError("7", ErrorKind.TRANSIENT, "connect timed out");
        assertEquals("TRANSIENT", payments.lastError("7").get("kind"));
        clock.advance(Duration.ofDays(1).plusSeconds(1));
        assertTrue(payments.lastError("7").isEmpty());
    }
}
