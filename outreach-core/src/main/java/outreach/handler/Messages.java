package outreach.handler;

import java.util.Objects;

/**
 * Chat copy used by the built-in handlers.
 */
public record Messages(
    String welcome,
    String secondMessage,
    String offer,
    String buyButton,
    String checkoutReady,
    String checkoutButton,
    String verifyButton,
    String reminder,
    String tryAgain,
    String noPayment,
    String paymentPending,
    String paymentConfirmed,
    String paymentFailed,
    String pong,
    String acknowledgement) {

  public Messages {
    Objects.requireNonNull(welcome, "welcome");
    Objects.requireNonNull(secondMessage, "secondMessage");
    Objects.requireNonNull(offer, "offer");
    Objects.requireNonNull(buyButton, "buyButton");
    Objects.requireNonNull(checkoutReady, "checkoutReady");
    Objects.requireNonNull(checkoutButton, "checkoutButton");
    Objects.requireNonNull(verifyButton, "verifyButton");
    Objects.requireNonNull(reminder, "reminder");
    Objects.requireNonNull(tryAgain, "tryAgain");
    Objects.requireNonNull(noPayment, "noPayment");
    Objects.requireNonNull(paymentPending, "paymentPending");
    Objects.requireNonNull(paymentConfirmed, "paymentConfirmed");
    Objects.requireNonNull(paymentFailed, "paymentFailed");
    Objects.requireNonNull(pong, "pong");
    Objects.requireNonNull(acknowledgement, "acknowledgement");
  }

  public static Messages defaults() {
    return new Messages(
        "Welcome! Pick a plan below to get access.",
        "Still deciding? Your access is one tap away.",
        "Get full access now.",
        "Buy access",
        "Your checkout is ready. Tap below to pay.",
        "Pay now",
        "I have paid",
        "Your checkout is still open. Finish your payment to get access.",
        "We could not create your checkout. Please try again in a moment.",
        "No payment found yet. Tap buy to start one.",
        "Your payment is still pending. We will let you know as soon as it is confirmed.",
        "Payment confirmed! Your access link is on its way.",
        "Your payment did not go through. Tap buy to try again.",
        "pong",
        "Got it. Use the buttons above to continue.");
  }
}
