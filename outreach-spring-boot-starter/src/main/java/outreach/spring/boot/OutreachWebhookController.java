package outreach.spring.boot;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import outreach.Outreach;
import outreach.ops.OpsSnapshot;
import outreach.webhook.IngressReceiver;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP surface of the engine.
 *
 * <ul>
 *   <li>{@code POST /telegram/webhook}: chat updates, checked against the secret token header
 *   and appended to the event queue</li>
 *   <li>{@code POST /stripe/webhook}: signed gateway events, reconciled inline</li>
 *   <li>{@code GET /admin/ops}: queue depths and funnel counters, behind the admin token
 *   given as {@code ?token=} or {@code X-Admin-Token}</li>
 * </ul>
 *
 * <p>Both webhooks answer {@code 200} with {@code {"ok": true|false}} so callers do not retry
 * on rejection.
 */
@RestController
public class OutreachWebhookController {

  public static final String SIGNATURE_HEADER = "Stripe-Signature";
  public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

  private final Outreach outreach;
  private final byte[] adminToken;

  public OutreachWebhookController(Outreach outreach, String adminToken) {
    this.outreach = Objects.requireNonNull(outreach, "outreach");
    this.adminToken = adminToken == null ? new byte[0] : adminToken.getBytes(StandardCharsets.UTF_8);
  }

  @PostMapping(path = "/telegram/webhook", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> ingress(
      @RequestHeader(value = IngressReceiver.SECRET_HEADER, required = false) String secret,
      @RequestBody(required = false) String body) {
    return ResponseEntity.ok(outreach.ingress().accept(secret, body).toJson());
  }

  @PostMapping(path = "/stripe/webhook", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> gateway(
      @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
      @RequestBody(required = false) String body) {
    return ResponseEntity.ok(outreach.gatewayWebhook().handle(body == null ? "" : body, signature).toJson());
  }

  @GetMapping(path = "/admin/ops", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> ops(
      @RequestParam(value = "token", required = false) String token,
      @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String headerToken) {
    if (adminToken.length == 0) {
      return error(HttpStatus.FORBIDDEN, "admin token not configured");
    }
    String presented = token != null ? token : headerToken;
    if (presented == null || !MessageDigest.isEqual(adminToken, presented.getBytes(StandardCharsets.UTF_8))) {
      return error(HttpStatus.UNAUTHORIZED, "invalid token");
    }
    OpsSnapshot snapshot = outreach.ops().snapshot();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", true);
    body.put("queue_size", snapshot.queueDepth());
    body.put("processing_size", snapshot.processingDepth());
    body.put("pending_payments", snapshot.pendingPayments());
    body.put("followup_due", snapshot.dueFollowups());
    body.put("retry_size", snapshot.retryDepth());
    body.put("counters", snapshot.counters());
    return ResponseEntity.ok(body);
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ok", false);
    body.put("error", message);
    return ResponseEntity.status(status).body(body);
  }
}
