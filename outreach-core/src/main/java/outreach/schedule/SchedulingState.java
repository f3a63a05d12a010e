package outreach.schedule;

/**
 * Per-subject state of the one-shot followup.
 */
public enum SchedulingState {
  /** No due entry and the action has not fired in this cycle. */
  UNSCHEDULED,
  /** A due entry exists. */
  SCHEDULED,
  /** The action fired; only {@link DueTimeScheduler#reset} allows another firing. */
  FIRED
}
