package outreach.webhook;

import outreach.spi.KeyValueStore;
import outreach.store.StoreKeys;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accepts raw channel updates and appends them to the durable event queue.
 *
 * <p>The shared secret header is compared in constant time; an empty configured secret
 * accepts every request.
 */
public final class IngressReceiver {
  private static final Logger logger = Logger.getLogger(IngressReceiver.class.getName());

  public static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

  private final KeyValueStore store;
  private final String queueKey;
  private final byte[] secret;

  public IngressReceiver(KeyValueStore store, StoreKeys keys, String secret) {
    this.store = Objects.requireNonNull(store, "store");
    this.queueKey = Objects.requireNonNull(keys, "keys").eventQueue();
    this.secret = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
  }

  public WebhookResponse accept(String secretHeader, String rawBody) {
    if (secret.length > 0) {
      byte[] presented = secretHeader == null ? new byte[0] : secretHeader.getBytes(StandardCharsets.UTF_8);
      if (!MessageDigest.isEqual(secret, presented)) {
        logger.log(Level.WARNING, "Rejected ingress request with a wrong secret token");
        return WebhookResponse.REJECTED;
      }
    }
    if (rawBody == null || rawBody.isBlank()) {
      return WebhookResponse.OK;
    }
    store.listPush(queueKey, rawBody);
    return WebhookResponse.OK;
  }
}
