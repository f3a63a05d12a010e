package outreach.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import outreach.webhook.GatewayNotification;

import static org.junit.jupiter.api.Assertions.*;

class JacksonGatewayEventParserTest {

  private final JacksonGatewayEventParser parser = new JacksonGatewayEventParser(new ObjectMapper());

  @Test
  void readsCheckoutSession() {
    String body = "{\"id\":\"evt_1\",\"type\":\"checkout.session.completed\",\"data\":{\"object\":{"
        + "\"id\":\"cs_1\",\"payment_status\":\"paid\",\"status\":\"complete\","
        + "\"client_reference_id\":\"42\","
        + "\"metadata\":{\"identifier\":\"ref-1\",\"event_id\":\"e-1\"}}}}";

    GatewayNotification n = parser.parse(body);

    assertEquals("checkout.session.completed", n.eventType());
    assertEquals("paid", n.rawStatus());
    assertEquals("42", n.subjectHint());
    assertEquals("cs_1", n.ids().transactionId());
    assertEquals("ref-1", n.ids().identifier());
    assertEquals("e-1", n.ids().eventId());
  }

  @Test
  void fallsBackToStatusAndMetadataSubject() {
    String body = "{\"type\":\"checkout.session.expired\",\"data\":{\"object\":{"
        + "\"id\":\"cs_2\",\"status\":\"expired\",\"client_reference_id\":null,"
        + "\"metadata\":{\"subject_id\":\"7\"}}}}";

    GatewayNotification n = parser.parse(body);

    assertEquals("expired", n.rawStatus());
    assertEquals("7", n.subjectHint());
    assertNull(n.ids().identifier());
  }

  @Test
  void missingObjectYieldsEmptyIds() {
    GatewayNotification n = parser.parse("{\"type\":\"ping\"}");

    assertEquals("ping", n.eventType());
    assertNull(n.rawStatus());
    assertTrue(n.ids().all().isEmpty());
  }

  @Test
  void unreadableBodyThrows() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("{"));
  }
}
