package outreach.webhook;

/**
 * Extracts a {@link GatewayNotification} from a raw webhook body.
 */
@FunctionalInterface
public interface GatewayEventParser {

  /**
   * @throws IllegalArgumentException if the body cannot be read
   */
  GatewayNotification parse(String body);
}
