package outreach.webhook;

import outreach.payment.ExternalIds;
import outreach.util.JsonCodec;

import java.util.Map;

/**
 * Reads a flat JSON object with the fields {@code type}, {@code status}, {@code subject_id},
 * {@code transaction_id}, {@code identifier} and {@code event_id}.
 */
public final class FlatGatewayEventParser implements GatewayEventParser {

  private final JsonCodec jsonCodec;

  public FlatGatewayEventParser() {
    this.jsonCodec = JsonCodec.getDefault();
  }

  @Override
  public GatewayNotification parse(String body) {
    Map<String, String> f = jsonCodec.parseObject(body);
    return new GatewayNotification(
        f.get("type"),
        f.get("status"),
        f.get("subject_id"),
        new ExternalIds(f.get("transaction_id"), f.get("identifier"), f.get("event_id")));
  }
}
