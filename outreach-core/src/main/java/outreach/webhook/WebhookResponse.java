package outreach.webhook;

/**
 * Body returned to a webhook caller: {@code {"ok": true}} or {@code {"ok": false}}.
 */
public record WebhookResponse(boolean ok) {

  public static final WebhookResponse OK = new WebhookResponse(true);
  public static final WebhookResponse REJECTED = new WebhookResponse(false);

  public String toJson() {
    return ok ? "{\"ok\": true}" : "{\"ok\": false}";
  }
}
