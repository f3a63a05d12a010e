package outreach.subject;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a subject's record.
 *
 * @param id            subject identifier
 * @param chatId        chat address for outbound messages, {@code null} if never seen
 * @param paid          whether a payment was confirmed
 * @param followupFired how many times the one-shot followup ran in the current cycle
 * @param blocked       whether the subject refused messages
 * @param ownerTag      deployment that owns this record, {@code null} for legacy records
 * @param createdAt     first registration, {@code null} if unknown
 */
public record Subject(
    String id,
    String chatId,
    boolean paid,
    long followupFired,
    boolean blocked,
    String ownerTag,
    Instant createdAt) {

  public Subject {
    Objects.requireNonNull(id, "id");
  }

  /**
   * @return {@code true} when the record carries the given owner tag
   */
  public boolean ownedBy(String tag) {
    return ownerTag != null && ownerTag.equals(tag);
  }
}
