package outreach.webhook;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Verifies gateway webhook signatures of the form {@code t=<timestamp>,v1=<hex>}.
 *
 * <p>The expected signature is the lowercase hex HMAC-SHA256 of {@code "<t>.<body>"} keyed
 * with the shared secret. Any {@code v1} entry may match; comparison is constant-time. An
 * empty secret disables verification.
 */
public final class SignatureVerifier {
  private static final String ALGORITHM = "HmacSHA256";

  private final byte[] secret;

  public SignatureVerifier(String secret) {
    this.secret = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
  }

  public boolean isEnabled() {
    return secret.length > 0;
  }

  public boolean verify(String body, String header) {
    if (!isEnabled()) {
      return true;
    }
    if (body == null || header == null || header.isBlank()) {
      return false;
    }
    String timestamp = null;
    List<String> signatures = new ArrayList<>();
    for (String part : header.split(",")) {
      int eq = part.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      String name = part.substring(0, eq).trim();
      String value = part.substring(eq + 1).trim();
      if ("t".equals(name)) {
        timestamp = value;
      } else if ("v1".equals(name)) {
        signatures.add(value);
      }
    }
    if (timestamp == null || signatures.isEmpty()) {
      return false;
    }
    byte[] expected = sign(timestamp + "." + body).getBytes(StandardCharsets.US_ASCII);
    boolean matched = false;
    for (String candidate : signatures) {
      matched |= MessageDigest.isEqual(expected, candidate.getBytes(StandardCharsets.US_ASCII));
    }
    return matched;
  }

  /**
   * @return lowercase hex HMAC-SHA256 of {@code payload}
   */
  public String sign(String payload) {
    if (!isEnabled()) {
      throw new IllegalStateException("No signing secret configured");
    }
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret, ALGORITHM));
      return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 unavailable", e);
    }
  }

  /**
   * Builds a header value for {@code body} signed at {@code timestamp}.
   */
  public String header(long timestamp, String body) {
    return "t=" + timestamp + ",v1=" + sign(timestamp + "." + body);
  }
}
