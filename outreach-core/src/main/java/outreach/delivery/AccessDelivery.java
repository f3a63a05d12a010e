package outreach.delivery;

import outreach.spi.CallResult;
import outreach.spi.ChatMessage;
import outreach.spi.ChatSender;
import outreach.spi.ErrorKind;
import outreach.spi.KeyValueStore;
import outreach.spi.NotificationSink;
import outreach.store.StoreKeys;
import outreach.subject.SubjectRepository;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends each subject its portal link once.
 *
 * <p>The access key is created lazily with a put-if-absent, so concurrent callers agree on one
 * key. The {@code sent} flag is written only after the chat send succeeded; a failed send
 * leaves the record unsent and a later call tries again.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class AccessDelivery {
  private static final Logger logger = Logger.getLogger(AccessDelivery.class.getName());

  static final String ACCESS_KEY = "access_key";
  static final String SENT = "sent";
  static final String UPDATED_AT = "updated_at";
  static final String SUBJECT_ID = "subject_id";
  static final String CREATED_AT = "created_at";

  private static final int KEY_BYTES = 10;

  private final KeyValueStore store;
  private final StoreKeys keys;
  private final SubjectRepository subjects;
  private final ChatSender chatSender;
  private final String portalUrl;
  private final String messageText;
  private final String buttonLabel;
  private final Duration recordTtl;
  private final Duration keyTtl;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  private AccessDelivery(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.subjects = Objects.requireNonNull(builder.subjects, "subjects");
    this.chatSender = Objects.requireNonNull(builder.chatSender, "chatSender");
    this.portalUrl = Objects.requireNonNull(builder.portalUrl, "portalUrl");
    if (portalUrl.isEmpty()) {
      throw new IllegalArgumentException("portalUrl must not be empty");
    }
    if (builder.recordTtl.isNegative() || builder.recordTtl.isZero()) {
      throw new IllegalArgumentException("recordTtl must be > 0");
    }
    if (builder.keyTtl.isNegative() || builder.keyTtl.isZero()) {
      throw new IllegalArgumentException("keyTtl must be > 0");
    }
    this.keys = builder.keys != null ? builder.keys : new StoreKeys();
    this.messageText = builder.messageText;
    this.buttonLabel = builder.buttonLabel;
    this.recordTtl = builder.recordTtl;
    this.keyTtl = builder.keyTtl;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Sends the portal link unless it was already sent.
   *
   * @param subjectId   the subject to deliver to
   * @param forceResend send even if an earlier send succeeded
   */
  public DeliveryResult deliverIfNeeded(String subjectId, boolean forceResend) {
    Objects.requireNonNull(subjectId, "subjectId");
    String recordKey = keys.delivery(subjectId);
    Map<String, String> record = store.hashGetAll(recordKey);
    String accessKey = record.get(ACCESS_KEY);
    if (accessKey != null && "1".equals(record.get(SENT)) && !forceResend) {
      return new DeliveryResult(false, accessKey, null);
    }
    if (accessKey == null) {
      accessKey = createKey(subjectId, recordKey);
    }

    String chatId = subjects.chatId(subjectId);
    ChatMessage message = ChatMessage.withLink(chatId != null ? chatId : subjectId,
        messageText, buttonLabel, portalLink(accessKey));
    CallResult<Void> result = chatSender.send(message);
    if (result instanceof CallResult.Failure<Void> failure) {
      if (failure.kind() == ErrorKind.FORBIDDEN) {
        subjects.markBlocked(subjectId);
      }
      logger.log(Level.WARNING, "Access delivery to subject {0} failed: {1} {2}",
          new Object[] {subjectId, failure.kind(), failure.message()});
      return new DeliveryResult(false, accessKey, failure.kind());
    }

    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(SENT, "1");
    fields.put(UPDATED_AT, now());
    store.hashPutAll(recordKey, fields);
    store.expire(recordKey, recordTtl);
    logger.log(Level.INFO, "Access delivered to subject {0}", subjectId);
    return new DeliveryResult(true, accessKey, null);
  }

  /**
   * @return whether the link was already sent successfully
   */
  public boolean isDelivered(String subjectId) {
    return "1".equals(store.hashGet(keys.delivery(subjectId), SENT));
  }

  /**
   * @return the subject owning {@code accessKey}, or {@code null} if unknown or expired
   */
  public String subjectForKey(String accessKey) {
    return store.hashGet(keys.accessKey(accessKey), SUBJECT_ID);
  }

  /**
   * Adapts delivery to the retry queue: the payload is the subject id.
   */
  public NotificationSink asRetrySink() {
    return subjectId -> {
      DeliveryResult result = deliverIfNeeded(subjectId, false);
      return result.failed()
          ? CallResult.failure(result.error(), "access delivery failed for " + subjectId)
          : CallResult.ok();
    };
  }

  String portalLink(String accessKey) {
    return portalUrl + (portalUrl.indexOf('?') >= 0 ? "&key=" : "?key=") + accessKey;
  }

  private String createKey(String subjectId, String recordKey) {
    byte[] bytes = new byte[KEY_BYTES];
    random.nextBytes(bytes);
    String candidate = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    if (!store.hashPutIfAbsent(recordKey, ACCESS_KEY, candidate)) {
      String winner = store.hashGet(recordKey, ACCESS_KEY);
      if (winner != null) {
        return winner;
      }
      store.hashPut(recordKey, ACCESS_KEY, candidate);
    }
    store.hashPut(recordKey, UPDATED_AT, now());
    store.expire(recordKey, recordTtl);

    String indexKey = keys.accessKey(candidate);
    Map<String, String> index = new LinkedHashMap<>();
    index.put(SUBJECT_ID, subjectId);
    index.put(CREATED_AT, now());
    store.hashPutAll(indexKey, index);
    store.expire(indexKey, keyTtl);
    return candidate;
  }

  private String now() {
    return Long.toString(clock.instant().getEpochSecond());
  }

  /** Builder for {@link AccessDelivery}. */
  public static final class Builder {
    private KeyValueStore store;
    private StoreKeys keys;
    private SubjectRepository subjects;
    private ChatSender chatSender;
    private String portalUrl;
    private String messageText = "Your access is ready.";
    private String buttonLabel = "Open";
    private Duration recordTtl = Duration.ofDays(30);
    private Duration keyTtl = Duration.ofDays(7);
    private Clock clock;

    private Builder() {}

    /** Required. */
    public Builder store(KeyValueStore store) {
      this.store = store;
      return this;
    }

    /** Optional. Defaults to {@link StoreKeys#DEFAULT_PREFIX}. */
    public Builder keys(StoreKeys keys) {
      this.keys = keys;
      return this;
    }

    /** Required. Supplies chat addresses and the blocked flag. */
    public Builder subjects(SubjectRepository subjects) {
      this.subjects = subjects;
      return this;
    }

    /** Required. */
    public Builder chatSender(ChatSender chatSender) {
      this.chatSender = chatSender;
      return this;
    }

    /**
     * Sets the portal base URL; the access key is appended as the {@code key} query parameter.
     *
     * <p><b>Required.</b>
     */
    public Builder portalUrl(String portalUrl) {
      this.portalUrl = portalUrl;
      return this;
    }

    public Builder messageText(String messageText) {
      this.messageText = Objects.requireNonNull(messageText, "messageText");
      return this;
    }

    public Builder buttonLabel(String buttonLabel) {
      this.buttonLabel = Objects.requireNonNull(buttonLabel, "buttonLabel");
      return this;
    }

    /**
     * Sets how long the delivery record lives.
     *
     * <p>Optional. Defaults to 30 days.
     */
    public Builder recordTtl(Duration recordTtl) {
      this.recordTtl = Objects.requireNonNull(recordTtl, "recordTtl");
      return this;
    }

    /**
     * Sets how long an access key resolves to its subject.
     *
     * <p>Optional. Defaults to 7 days.
     */
    public Builder keyTtl(Duration keyTtl) {
      this.keyTtl = Objects.requireNonNull(keyTtl, "keyTtl");
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public AccessDelivery build() {
      return new AccessDelivery(this);
    }
  }
}
