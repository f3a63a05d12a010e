package outreach.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import outreach.Outreach;
import outreach.dispatch.EventDecoder;
import outreach.retry.ExponentialBackoffRetryPolicy;
import outreach.retry.RetryPolicy;
import outreach.spi.ChatSender;
import outreach.spi.KeyValueStore;
import outreach.spi.MetricsExporter;
import outreach.spi.NotificationSink;
import outreach.spi.PaymentGateway;
import outreach.store.StoreKeys;
import outreach.webhook.GatewayEventParser;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Auto-configuration for the outreach engine.
 *
 * <p>Wires an {@link Outreach} composite once a {@link KeyValueStore}, a {@link ChatSender}
 * and a {@link PaymentGateway} bean exist. {@link NotificationSink} beans are registered under
 * their bean names, so name them after {@link outreach.retry.SinkNames}.
 *
 * @see OutreachProperties
 * @see OutreachRedisAutoConfiguration
 * @see OutreachMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {OutreachRedisAutoConfiguration.class, OutreachMicrometerAutoConfiguration.class})
@ConditionalOnClass(Outreach.class)
@ConditionalOnBean({KeyValueStore.class, ChatSender.class, PaymentGateway.class})
@EnableConfigurationProperties(OutreachProperties.class)
public class OutreachAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(EventDecoder.class)
  public JacksonUpdateDecoder outreachEventDecoder(ObjectProvider<ObjectMapper> objectMapper) {
    return new JacksonUpdateDecoder(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  @ConditionalOnMissingBean(GatewayEventParser.class)
  public JacksonGatewayEventParser outreachGatewayEventParser(ObjectProvider<ObjectMapper> objectMapper) {
    return new JacksonGatewayEventParser(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Outreach outreach(OutreachProperties props,
      KeyValueStore store,
      ChatSender chatSender,
      PaymentGateway paymentGateway,
      EventDecoder decoder,
      GatewayEventParser gatewayEventParser,
      ObjectProvider<MetricsExporter> metricsProvider,
      ListableBeanFactory beanFactory) {

    if (props.getPortalUrl() == null || props.getPortalUrl().isBlank()) {
      throw new IllegalStateException("outreach.portal-url must be set");
    }
    var dispatch = props.getDispatch();
    var scheduler = props.getScheduler();
    var reconciler = props.getReconciler();
    var retry = props.getRetry();

    var builder = Outreach.builder()
        .store(store)
        .chatSender(chatSender)
        .paymentGateway(paymentGateway)
        .portalUrl(props.getPortalUrl())
        .keys(new StoreKeys(props.getKeyPrefix()))
        .ownerTag(props.getOwnerTag())
        .decoder(decoder)
        .gatewayEventParser(gatewayEventParser)
        .messages(props.getMessages().toMessages())
        .offerAmount(props.getOfferAmount())
        .deliveryText(props.getDelivery().getText())
        .deliveryButton(props.getDelivery().getButton())
        .ingressSecret(props.getWebhook().getIngressSecret())
        .webhookSecret(props.getWebhook().getGatewaySecret())
        .subjectTtl(props.getSubject().getTtl())
        .maxConcurrency(dispatch.getMaxConcurrency())
        .popTimeout(dispatch.getPopTimeout())
        .drainTimeoutMs(dispatch.getDrainTimeoutMs())
        .schedulerBatchSize(scheduler.getBatchSize())
        .maxFirings(scheduler.getMaxFirings())
        .schedulerIdleIntervalMs(scheduler.getIdleIntervalMs())
        .schedulerErrorBackoffMs(scheduler.getErrorBackoffMs())
        .followupDelay(scheduler.getFollowupDelay())
        .secondMessageDelay(scheduler.getSecondMessageDelay())
        .pollSampleSize(reconciler.getPollSampleSize())
        .maxConcurrentLookups(reconciler.getMaxConcurrentLookups())
        .pollIntervalMs(reconciler.getPollIntervalMs())
        .checkoutReuseWindow(reconciler.getCheckoutReuseWindow())
        .retryMaxAttempts(retry.getMaxAttempts())
        .retryBatchSize(retry.getBatchSize())
        .retryIntervalMs(retry.getIntervalMs())
        .retryPolicy(retryPolicy(retry));

    if (dispatch.getConsumerId() != null && !dispatch.getConsumerId().isBlank()) {
      builder.consumerId(dispatch.getConsumerId());
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    beanFactory.getBeansOfType(NotificationSink.class).forEach(builder::sink);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public OutreachHandlerRegistrar outreachHandlerRegistrar(ListableBeanFactory beanFactory, Outreach outreach) {
    return new OutreachHandlerRegistrar(beanFactory, outreach.handlers());
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "outreach", name = "auto-start", matchIfMissing = true)
  public OutreachLifecycle outreachLifecycle(Outreach outreach) {
    return new OutreachLifecycle(outreach);
  }

  private static RetryPolicy retryPolicy(OutreachProperties.Retry retry) {
    if (retry.getBaseDelayMs() <= 0) {
      return RetryPolicy.NEXT_CYCLE;
    }
    return new ExponentialBackoffRetryPolicy(
        Duration.ofMillis(retry.getBaseDelayMs()), Duration.ofMillis(retry.getMaxDelayMs()));
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(RestController.class)
  @ConditionalOnProperty(prefix = "outreach.webhook", name = "enabled", matchIfMissing = true)
  static class WebhookConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public OutreachWebhookController outreachWebhookController(Outreach outreach, OutreachProperties props) {
      return new OutreachWebhookController(outreach, props.getWebhook().getAdminToken());
    }
  }
}
