package com.scylladb.admin;

/**
 * Decides what happens to the remaining branches of a fan-out once one branch fails.
 *
 * <p>Under either policy the fan-out as a whole fails if any branch fails, and no partial results
 * are returned. The policies only differ in how much remote work is left running after the first
 * failure.
 *
 * @since 1.0.0
 */
public enum FanOutPolicy {
  /**
   * Every branch runs to completion regardless of failures in its siblings. All failures are
   * reported.
   */
  RUN_TO_COMPLETION,

  /**
   * The first failure cancels the fan-out's request scope, which interrupts sibling branches and
   * aborts their in-flight remote calls. Only the first failure is reported; whatever the
   * siblings fail with afterwards is attributed to the cancellation and dropped.
   */
  FAIL_FAST
}
