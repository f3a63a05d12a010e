package outreach.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import outreach.handler.Messages;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration properties for the outreach engine.
 *
 * @see OutreachAutoConfiguration
 */
@ConfigurationProperties(prefix = "outreach")
public class OutreachProperties {

    /**
     * Tag written into subject records; also names this instance's processing list.
     */
    private String ownerTag = "default";

    /**
     * Prefix of every key the engine writes.
     */
    private String keyPrefix = "outreach:";

    /**
     * Base URL of the access portal. Required.
     */
    private String portalUrl;

    /**
     * Amount offered by the start message and the followup.
     */
    private BigDecimal offerAmount = new BigDecimal("19.90");

    /**
     * Start the background loops with the application context.
     */
    private boolean autoStart = true;

    private final Dispatch dispatch = new Dispatch();
    private final Scheduler scheduler = new Scheduler();
    private final Reconciler reconciler = new Reconciler();
    private final Retry retry = new Retry();
    private final Webhook webhook = new Webhook();
    private final Delivery delivery = new Delivery();
    private final Subject subject = new Subject();
    private final Copy messages = new Copy();
    private final Metrics metrics = new Metrics();

    public String getOwnerTag() {
        return ownerTag;
    }

    public void setOwnerTag(String ownerTag) {
        this.ownerTag = ownerTag;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getPortalUrl() {
        return portalUrl;
    }

    public void setPortalUrl(String portalUrl) {
        this.portalUrl = portalUrl;
    }

    public BigDecimal getOfferAmount() {
        return offerAmount;
    }

    public void setOfferAmount(BigDecimal offerAmount) {
        this.offerAmount = offerAmount;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Reconciler getReconciler() {
        return reconciler;
    }

    public Retry getRetry() {
        return retry;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Subject getSubject() {
        return subject;
    }

    public Copy getMessages() {
        return messages;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatch {
        /**
         * Per-process id naming the processing list. Blank uses the host name.
         */
        private String consumerId;
        private int maxConcurrency = 100;
        private Duration popTimeout = Duration.ofSeconds(1);
        private long drainTimeoutMs = 5000;

        public String getConsumerId() {
            return consumerId;
        }

        public void setConsumerId(String consumerId) {
            this.consumerId = consumerId;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public Duration getPopTimeout() {
            return popTimeout;
        }

        public void setPopTimeout(Duration popTimeout) {
            this.popTimeout = popTimeout;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Scheduler {
        private int batchSize = 50;
        private int maxFirings = 1;
        private long idleIntervalMs = 1000;
        private long errorBackoffMs = 2000;
        private Duration followupDelay = Duration.ofSeconds(360);
        private Duration secondMessageDelay = Duration.ofSeconds(5);

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxFirings() {
            return maxFirings;
        }

        public void setMaxFirings(int maxFirings) {
            this.maxFirings = maxFirings;
        }

        public long getIdleIntervalMs() {
            return idleIntervalMs;
        }

        public void setIdleIntervalMs(long idleIntervalMs) {
            this.idleIntervalMs = idleIntervalMs;
        }

        public long getErrorBackoffMs() {
            return errorBackoffMs;
        }

        public void setErrorBackoffMs(long errorBackoffMs) {
            this.errorBackoffMs = errorBackoffMs;
        }

        public Duration getFollowupDelay() {
            return followupDelay;
        }

        public void setFollowupDelay(Duration followupDelay) {
            this.followupDelay = followupDelay;
        }

        public Duration getSecondMessageDelay() {
            return secondMessageDelay;
        }

        public void setSecondMessageDelay(Duration secondMessageDelay) {
            this.secondMessageDelay = secondMessageDelay;
        }
    }

    public static class Reconciler {
        private int pollSampleSize = 50;
        private int maxConcurrentLookups = 10;
        private long pollIntervalMs = 20000;
        private Duration checkoutReuseWindow = Duration.ofMinutes(30);

        public int getPollSampleSize() {
            return pollSampleSize;
        }

        public void setPollSampleSize(int pollSampleSize) {
            this.pollSampleSize = pollSampleSize;
        }

        public int getMaxConcurrentLookups() {
            return maxConcurrentLookups;
        }

        public void setMaxConcurrentLookups(int maxConcurrentLookups) {
            this.maxConcurrentLookups = maxConcurrentLookups;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Duration getCheckoutReuseWindow() {
            return checkoutReuseWindow;
        }

        public void setCheckoutReuseWindow(Duration checkoutReuseWindow) {
            this.checkoutReuseWindow = checkoutReuseWindow;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int batchSize = 10;
        private long intervalMs = 30000;
        /**
         * Zero retries on the next drain; positive values back off exponentially.
         */
        private long baseDelayMs = 0;
        private long maxDelayMs = 600000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Webhook {
        /**
         * Expose the ingress, gateway and ops endpoints.
         */
        private boolean enabled = true;
        /**
         * Value expected in the chat platform's secret token header. Empty accepts all.
         */
        private String ingressSecret = "";
        /**
         * Gateway signing secret. Empty disables signature checks.
         */
        private String gatewaySecret = "";
        /**
         * Token required by the ops endpoint. Empty disables the endpoint.
         */
        private String adminToken = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getIngressSecret() {
            return ingressSecret;
        }

        public void setIngressSecret(String ingressSecret) {
            this.ingressSecret = ingressSecret;
        }

        public String getGatewaySecret() {
            return gatewaySecret;
        }

        public void setGatewaySecret(String gatewaySecret) {
            this.gatewaySecret = gatewaySecret;
        }

        public String getAdminToken() {
            return adminToken;
        }

        public void setAdminToken(String adminToken) {
            this.adminToken = adminToken;
        }
    }

    public static class Delivery {
        private String text = "Payment confirmed. Here is your access:";
        private String button = "Open portal";

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getButton() {
            return button;
        }

        public void setButton(String button) {
            this.button = button;
        }
    }

    public static class Subject {
        private Duration ttl = Duration.ofDays(60);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    /**
     * Chat copy. Unset entries keep the built-in text.
     */
    public static class Copy {
        private String welcome;
        private String secondMessage;
        private String offer;
        private String buyButton;
        private String checkoutReady;
        private String checkoutButton;
        private String verifyButton;
        private String reminder;
        private String tryAgain;
        private String noPayment;
        private String paymentPending;
        private String paymentConfirmed;
        private String paymentFailed;
        private String pong;
        private String acknowledgement;

        public Messages toMessages() {
            Messages d = Messages.defaults();
            return new Messages(
                    or(welcome, d.welcome()),
                    or(secondMessage, d.secondMessage()),
                    or(offer, d.offer()),
                    or(buyButton, d.buyButton()),
                    or(checkoutReady, d.checkoutReady()),
                    or(checkoutButton, d.checkoutButton()),
                    or(verifyButton, d.verifyButton()),
                    or(reminder, d.reminder()),
                    or(tryAgain, d.tryAgain()),
                    or(noPayment, d.noPayment()),
                    or(paymentPending, d.paymentPending()),
                    or(paymentConfirmed, d.paymentConfirmed()),
                    or(paymentFailed, d.paymentFailed()),
                    or(pong, d.pong()),
                    or(acknowledgement, d.acknowledgement()));
        }

        private static String or(String value, String fallback) {
            return value == null || value.isEmpty() ? fallback : value;
        }

        public String getWelcome() {
            return welcome;
        }

        public void setWelcome(String welcome) {
            this.welcome = welcome;
        }

        public String getSecondMessage() {
            return secondMessage;
        }

        public void setSecondMessage(String secondMessage) {
            this.secondMessage = secondMessage;
        }

        public String getOffer() {
            return offer;
        }

        public void setOffer(String offer) {
            this.offer = offer;
        }

        public String getBuyButton() {
            return buyButton;
        }

        public void setBuyButton(String buyButton) {
            this.buyButton = buyButton;
        }

        public String getCheckoutReady() {
            return checkoutReady;
        }

        public void setCheckoutReady(String checkoutReady) {
            this.checkoutReady = checkoutReady;
        }

        public String getCheckoutButton() {
            return checkoutButton;
        }

        public void setCheckoutButton(String checkoutButton) {
            this.checkoutButton = checkoutButton;
        }

        public String getVerifyButton() {
            return verifyButton;
        }

        public void setVerifyButton(String verifyButton) {
            this.verifyButton = verifyButton;
        }

        public String getReminder() {
            return reminder;
        }

        public void setReminder(String reminder) {
            this.reminder = reminder;
        }

        public String getTryAgain() {
            return tryAgain;
        }

        public void setTryAgain(String tryAgain) {
            this.tryAgain = tryAgain;
        }

        public String getNoPayment() {
            return noPayment;
        }

        public void setNoPayment(String noPayment) {
            this.noPayment = noPayment;
        }

        public String getPaymentPending() {
            return paymentPending;
        }

        public void setPaymentPending(String paymentPending) {
            this.paymentPending = paymentPending;
        }

        public String getPaymentConfirmed() {
            return paymentConfirmed;
        }

        public void setPaymentConfirmed(String paymentConfirmed) {
            this.paymentConfirmed = paymentConfirmed;
        }

        public String getPaymentFailed() {
            return paymentFailed;
        }

        public void setPaymentFailed(String paymentFailed) {
            this.paymentFailed = paymentFailed;
        }

        public String getPong() {
            return pong;
        }

        public void setPong(String pong) {
            this.pong = pong;
        }

        public String getAcknowledgement() {
            return acknowledgement;
        }

        public void setAcknowledgement(String acknowledgement) {
            this.acknowledgement = acknowledgement;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "outreach";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
