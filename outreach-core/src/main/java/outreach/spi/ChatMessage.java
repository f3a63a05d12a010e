package outreach.spi;

import java.util.List;
import java.util.Objects;

/**
 * Outbound chat message with optional inline buttons.
 *
 * @param chatId  destination chat address
 * @param text    message text
 * @param buttons inline buttons in display order (never {@code null})
 */
public record ChatMessage(String chatId, String text, List<Button> buttons) {

  public ChatMessage {
    Objects.requireNonNull(chatId, "chatId");
    Objects.requireNonNull(text, "text");
    buttons = buttons == null ? List.of() : List.copyOf(buttons);
  }

  public static ChatMessage text(String chatId, String text) {
    return new ChatMessage(chatId, text, List.of());
  }

  public static ChatMessage withLink(String chatId, String text, String label, String url) {
    return new ChatMessage(chatId, text, List.of(Button.link(label, url)));
  }

  /**
   * Inline button: either opens {@code url} or posts {@code callbackData} back as an event.
   */
  public record Button(String label, String url, String callbackData) {
    public Button {
      Objects.requireNonNull(label, "label");
      if ((url == null) == (callbackData == null)) {
        throw new IllegalArgumentException("exactly one of url or callbackData must be set");
      }
    }

    public static Button link(String label, String url) {
      return new Button(label, url, null);
    }

    public static Button callback(String label, String callbackData) {
      return new Button(label, null, callbackData);
    }
  }
}
