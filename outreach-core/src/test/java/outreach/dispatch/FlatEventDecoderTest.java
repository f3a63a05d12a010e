package outreach.dispatch;

import org.junit.jupiter.api.Test;
import outreach.EventKind;
import outreach.InboundEvent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FlatEventDecoderTest {

    private final FlatEventDecoder decoder = new FlatEventDecoder();

    @Test
    void liftsKnownFieldsAndKeepsTheRestAsAttributes() {
        InboundEvent event = decoder.decode(
                "{\"kind\":\"buy\",\"subject_id\":\"42\",\"chat_id\":\"-100\",\"amount\":\"19.90\",\"event_id\":\"u1\"}");
        assertEquals(EventKind.BUY, event.kind());
        assertEquals("42", event.subjectId());
        assertEquals("-100", event.replyChatId());
        assertEquals("u1", event.eventId());
        assertEquals("19.90", event.attribute(InboundEvent.ATTR_AMOUNT));
        assertNull(event.text());
    }

    @Test
    void replyChatFallsBackToSubject() {
        InboundEvent event = decoder.decode("{\"kind\":\"START\",\"subject_id\":\"42\"}");
        assertEquals("42", event.replyChatId());
    }

    @Test
    void missingKindOrSubjectIsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> decoder.decode("{\"subject_id\":\"42\"}"));
        assertThrows(IllegalArgumentException.class, () -> decoder.decode("{\"kind\":\"START\"}"));
        assertThrows(IllegalArgumentException.class, () -> decoder.decode("{\"kind\":\"x\",\"subject_id\":\"1\"}"));
        assertThrows(IllegalArgumentException.class, () -> decoder.decode("{\"kind\":\"START\",\"subject_id\":\"\"}"));
    }

    @Test
    void encodeIsReadBack() {
        InboundEvent event = new InboundEvent("e", EventKind.MESSAGE, "5", "6", "/ping",
                java.util.Map.of("data", "x"));
        assertEquals(event, decoder.decode(decoder.encode(event)));
    }
}
