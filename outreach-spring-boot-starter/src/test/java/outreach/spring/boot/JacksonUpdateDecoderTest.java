package outreach.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import outreach.EventKind;
import outreach.InboundEvent;

import static org.junit.jupiter.api.Assertions.*;

class JacksonUpdateDecoderTest {

  private final JacksonUpdateDecoder decoder = new JacksonUpdateDecoder(new ObjectMapper());

  @Test
  void startCommandBecomesStart() {
    InboundEvent event = decoder.decode(message("/start"));

    assertEquals(EventKind.START, event.kind());
    assertEquals("100", event.eventId());
    assertEquals("42", event.subjectId());
    assertEquals("-7", event.chatId());
    assertEquals("/start", event.text());
    assertEquals("ana", event.attribute(JacksonUpdateDecoder.ATTR_USERNAME));
  }

  @Test
  void startWithPayloadOrBotNameIsStart() {
    assertEquals(EventKind.START, decoder.decode(message("/start campaign-9")).kind());
    assertEquals(EventKind.START, decoder.decode(message("/START@shop_bot")).kind());
  }

  @Test
  void lookalikeCommandIsMessage() {
    assertEquals(EventKind.MESSAGE, decoder.decode(message("/started")).kind());
    assertEquals(EventKind.MESSAGE, decoder.decode(message("hello")).kind());
  }

  @Test
  void callbackQueryCarriesData() {
    String raw = "{\"update_id\":101,\"callback_query\":{\"id\":\"cb1\","
        + "\"from\":{\"id\":42},\"message\":{\"chat\":{\"id\":42}},\"data\":\"cta:buy:19.90\"}}";

    InboundEvent event = decoder.decode(raw);

    assertEquals(EventKind.CALLBACK, event.kind());
    assertEquals("42", event.subjectId());
    assertEquals("42", event.chatId());
    assertEquals("cta:buy:19.90", event.attribute(InboundEvent.ATTR_DATA));
    assertNull(event.text());
  }

  @Test
  void otherUpdatesAreSkipped() {
    assertNull(decoder.decode("{\"update_id\":1,\"my_chat_member\":{}}"));
    assertNull(decoder.decode("{\"update_id\":1,\"message\":{\"from\":{\"id\":42},"
        + "\"chat\":{\"id\":42},\"sticker\":{}}}"));
  }

  @Test
  void malformedUpdatesThrow() {
    assertThrows(IllegalArgumentException.class, () -> decoder.decode("not json"));
    assertThrows(IllegalArgumentException.class, () -> decoder.decode("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> decoder.decode(""));
    assertThrows(IllegalArgumentException.class,
        () -> decoder.decode("{\"message\":{\"chat\":{\"id\":1},\"text\":\"hi\"}}"));
  }

  private static String message(String text) {
    return "{\"update_id\":100,\"message\":{\"message_id\":1,"
        + "\"from\":{\"id\":42,\"username\":\"ana\"},\"chat\":{\"id\":-7},\"text\":\"" + text + "\"}}";
  }
}
