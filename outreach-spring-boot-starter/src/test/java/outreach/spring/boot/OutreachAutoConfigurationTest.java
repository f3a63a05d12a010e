package outreach.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import outreach.EventHandler;
import outreach.EventKind;
import outreach.InboundEvent;
import outreach.Outreach;
import outreach.dispatch.EventDecoder;
import outreach.dispatch.FlatEventDecoder;
import outreach.handler.Messages;
import outreach.retry.SinkNames;
import outreach.spi.CallResult;
import outreach.spi.NotificationSink;
import outreach.webhook.GatewayEventParser;


import static org.junit.jupiter.api.Assertions.*;

class OutreachAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(OutreachAutoConfiguration.class))
      .withUserConfiguration(CollaboratorsConfig.class)
      .withPropertyValues(
          "outreach.portal-url=https://portal.example/access",
          "outreach.auto-start=false");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("outreach"));
      assertTrue(ctx.containsBean("outreachEventDecoder"));
      assertTrue(ctx.containsBean("outreachGatewayEventParser"));
      assertTrue(ctx.containsBean("outreachHandlerRegistrar"));
      assertTrue(ctx.containsBean("outreachWebhookController"));

      assertInstanceOf(JacksonUpdateDecoder.class, ctx.getBean(EventDecoder.class));
      assertInstanceOf(JacksonGatewayEventParser.class, ctx.getBean(GatewayEventParser.class));
      assertFalse(ctx.containsBean("outreachLifecycle"));
    });
  }

  @Test
  void appliesKeyPrefixOwnerTagAndConsumerId() {
    runner
        .withPropertyValues("outreach.key-prefix=shop:", "outreach.owner-tag=bot-a",
            "outreach.dispatch.consumer-id=worker-7")
        .run(ctx -> {
          Outreach outreach = ctx.getBean(Outreach.class);
          assertEquals("shop:", outreach.keys().prefix());
          assertEquals("bot-a", outreach.subjects().ownerTag());
          assertEquals("worker-7", outreach.consumerId());
        });
  }

  @Test
  void registersSinkBeansByName() {
    runner.withUserConfiguration(SinkConfig.class).run(ctx -> {
      Outreach outreach = ctx.getBean(Outreach.class);
      assertTrue(outreach.retryQueue().hasSink(SinkNames.ANALYTICS_ORDER));
      assertTrue(outreach.retryQueue().hasSink(SinkNames.ACCESS_DELIVERY));
    });
  }

  @Test
  void failsWithoutPortalUrl() {
    runner.withPropertyValues("outreach.portal-url=").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void notLoadedWithoutCollaborators() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(OutreachAutoConfiguration.class))
        .withPropertyValues("outreach.portal-url=https://portal.example/access")
        .run(ctx -> {
          assertFalse(ctx.containsBean("outreach"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomDecoderConfig.class).run(ctx -> {
      assertInstanceOf(FlatEventDecoder.class, ctx.getBean(EventDecoder.class));
      assertFalse(ctx.containsBean("outreachEventDecoder"));
    });
  }

  @Test
  void webhookControllerCanBeDisabled() {
    runner.withPropertyValues("outreach.webhook.enabled=false").run(ctx -> {
      assertTrue(ctx.containsBean("outreach"));
      assertFalse(ctx.containsBean("outreachWebhookController"));
    });
  }

  @Test
  void annotatedHandlerReplacesBuiltIn() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      Outreach outreach = ctx.getBean(Outreach.class);
      assertSame(ctx.getBean("customMessageHandler"),
          outreach.handlers().handlerFor(EventKind.MESSAGE));
      assertNotNull(outreach.handlers().handlerFor(EventKind.START));
    });
  }

  @Test
  void startsWithContextAndAnswersStart() {
    runner.withPropertyValues("outreach.auto-start=true").run(ctx -> {
      OutreachLifecycle lifecycle = ctx.getBean(OutreachLifecycle.class);
      assertTrue(lifecycle.isRunning());

      var controller = ctx.getBean(OutreachWebhookController.class);
      String update = "{\"update_id\":1,\"message\":{\"message_id\":5,"
          + "\"from\":{\"id\":42,\"username\":\"ana\"},\"chat\":{\"id\":42},\"text\":\"/start\"}}";
      assertEquals("{\"ok\": true}", controller.ingress(null, update).getBody());

      var chat = ctx.getBean(CollaboratorsConfig.RecordingChat.class);
      long deadline = System.currentTimeMillis() + 5000;
      while (chat.sent.isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
      assertFalse(chat.sent.isEmpty(), "welcome message should be sent");
      assertEquals("42", chat.sent.get(0).chatId());
      assertEquals(Messages.defaults().welcome(), chat.sent.get(0).text());
    });
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  // ── Test support ─────────────────────────────────────────────

  @Configuration
  static class SinkConfig {
    @Bean(SinkNames.ANALYTICS_ORDER)
    NotificationSink analyticsOrderSink() {
      return payload -> CallResult.ok();
    }
  }

  @Configuration
  static class CustomDecoderConfig {
    @Bean
    EventDecoder customDecoder() {
      return new FlatEventDecoder();
    }
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    CustomMessageHandler customMessageHandler() {
      return new CustomMessageHandler();
    }
  }

  @OutreachHandler(EventKind.MESSAGE)
  static class CustomMessageHandler implements EventHandler {
    @Override
    public void handle(InboundEvent event) {
    }
  }
}
