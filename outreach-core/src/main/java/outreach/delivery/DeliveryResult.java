package outreach.delivery;

import outreach.spi.ErrorKind;

/**
 * Outcome of {@link AccessDelivery#deliverIfNeeded}.
 *
 * @param sentNow   whether a message went out during this call
 * @param accessKey the subject's access key, {@code null} only if it could not be created
 * @param error     why the send failed, or {@code null}
 */
public record DeliveryResult(boolean sentNow, String accessKey, ErrorKind error) {

  public boolean failed() {
    return error != null;
  }
}
