package outreach.schedule;

/**
 * One-shot action run by the {@link DueTimeScheduler} when a subject's due entry comes up.
 *
 * <p>The scheduler has already consumed the entry and claimed the firing before calling the
 * action; a failure or a declined run is never rescheduled.
 */
@FunctionalInterface
public interface DueAction {

  /**
   * @param subjectId the subject whose entry is due
   * @return {@code true} if the action ran, {@code false} if it declined (for example because
   *     the subject already paid)
   * @throws Exception on failure; logged by the scheduler
   */
  boolean fire(String subjectId) throws Exception;
}
