package ca.gc.cra.flapline.infrastructure.exec;

/**
 * How a {@link WorkerPool} ended up releasing its threads.
 *
 * @since FLAPLINE 0.1
 */
public enum TeardownOutcome {
  /** Every worker returned from its handler before {@code join()} returned. */
  JOINED_CLEANLY,
  /** The joining thread was interrupted; workers still running were detached. */
  DETACHED_AFTER_JOIN_FAILURE,
  /** The pool was torn down without a prior join; live workers were detached. */
  DETACHED_ON_MISUSE,
  /** The pool was joined or torn down before it was ever started. */
  NOT_STARTED,
  /** Another thread is still inside {@code join()}; no outcome has been recorded yet. */
  JOIN_IN_PROGRESS;

  /**
   * Indicates whether the caller may release state the handlers touch.
   *
   * @return {@code true} only for {@link #JOINED_CLEANLY} and {@link #NOT_STARTED}
   */
  public boolean workersQuiesced() {
    return this == JOINED_CLEANLY || this == NOT_STARTED;
  }
}
