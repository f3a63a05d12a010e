package outreach.payment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * External identifiers carried by a payment signal.
 *
 * @param transactionId gateway transaction or checkout session id
 * @param identifier    our own reference echoed back by the gateway
 * @param eventId       id of the webhook event itself
 */
public record ExternalIds(String transactionId, String identifier, String eventId) {

  public static final ExternalIds NONE = new ExternalIds(null, null, null);

  public static ExternalIds ofTransaction(String transactionId) {
    return new ExternalIds(transactionId, null, null);
  }

  /**
   * @return non-empty identifiers in lookup order: transaction, identifier, event
   */
  public List<String> all() {
    List<String> ids = new ArrayList<>(3);
    for (String id : new String[] {transactionId, identifier, eventId}) {
      if (id != null && !id.isEmpty()) {
        ids.add(id);
      }
    }
    return Collections.unmodifiableList(ids);
  }
}
