package outreach.spring.boot;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import outreach.spi.CallResult;
import outreach.spi.ChatMessage;
import outreach.spi.ChatSender;
import outreach.spi.KeyValueStore;
import outreach.spi.PaymentGateway;
import outreach.store.InMemoryKeyValueStore;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The three collaborators the engine requires, backed by memory.
 */
@Configuration
class CollaboratorsConfig {

  @Bean
  KeyValueStore keyValueStore() {
    return new InMemoryKeyValueStore();
  }

  @Bean
  RecordingChat chatSender() {
    return new RecordingChat();
  }

  @Bean
  PaymentGateway paymentGateway() {
    AtomicInteger sequence = new AtomicInteger();
    return new PaymentGateway() {
      @Override
      public CallResult<Checkout> createCheckout(CheckoutRequest request) {
        String tx = "cs_" + sequence.incrementAndGet();
        return CallResult.success(new Checkout(tx, "https://pay.example/" + tx, "open"));
      }

      @Override
      public CallResult<String> fetchStatus(String transactionId) {
        return CallResult.success("open");
      }
    };
  }

  static final class RecordingChat implements ChatSender {
    final List<ChatMessage> sent = new CopyOnWriteArrayList<>();

    @Override
    public CallResult<Void> send(ChatMessage message) {
      sent.add(message);
      return CallResult.ok();
    }
  }
}
