package outreach.handler;

import outreach.spi.ChatMessage;

import java.math.BigDecimal;
import java.util.List;

/**
 * Callback data carried by the bot's buttons. Buy buttons carry {@code cta:buy:<amount>}.
 */
public final class Offers {
  public static final String BUY_PREFIX = "cta:buy:";
  public static final String VERIFY = "pay:verify";
  public static final String SHOW_CHECKOUT = "pay:show";

  private Offers() {
  }

  public static String buyCallback(BigDecimal amount) {
    return BUY_PREFIX + amount.toPlainString();
  }

  /**
   * @return the amount in {@code value}, or {@code null} if it is absent, not a number or not
   *     positive
   */
  public static BigDecimal parseAmount(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      BigDecimal amount = new BigDecimal(value.trim());
      return amount.signum() > 0 ? amount : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Checkout link plus a button that re-checks the payment.
   */
  static ChatMessage checkoutMessage(String chatId, Messages messages, String checkoutUrl) {
    return new ChatMessage(chatId, messages.checkoutReady(), List.of(
        ChatMessage.Button.link(messages.checkoutButton(), checkoutUrl),
        ChatMessage.Button.callback(messages.verifyButton(), VERIFY)));
  }
}
