package outreach.spring.boot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import outreach.payment.ExternalIds;
import outreach.webhook.GatewayEventParser;
import outreach.webhook.GatewayNotification;

import java.util.Objects;

/**
 * Reads Stripe-style checkout events.
 *
 * <p>Fields, all under {@code data.object} unless noted: event {@code type} (top level),
 * status from {@code payment_status} falling back to {@code status}, subject hint from
 * {@code client_reference_id} falling back to {@code metadata.subject_id}, transaction id
 * from {@code id}, identifier from {@code metadata.identifier} and event id from
 * {@code metadata.event_id}.
 */
public final class JacksonGatewayEventParser implements GatewayEventParser {

  private final ObjectMapper objectMapper;

  public JacksonGatewayEventParser(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public GatewayNotification parse(String body) {
    JsonNode event = JacksonNodes.readObject(objectMapper, body, "gateway event");
    JsonNode object = event.path("data").path("object");
    JsonNode metadata = object.path("metadata");
    return new GatewayNotification(
        JacksonNodes.text(event, "type"),
        JacksonNodes.firstNonNull(JacksonNodes.text(object, "payment_status"), JacksonNodes.text(object, "status")),
        JacksonNodes.firstNonNull(JacksonNodes.text(object, "client_reference_id"), JacksonNodes.text(metadata, "subject_id")),
        new ExternalIds(
            JacksonNodes.text(object, "id"),
            JacksonNodes.text(metadata, "identifier"),
            JacksonNodes.text(metadata, "event_id")));
  }
}
