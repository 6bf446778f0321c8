package com.acme.delivery.replication.core;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a message-level failure ends the session.
 *
 * <p>The budget is the policy's {@code maxAttempts} and is shared by every message of a
 * session cycle: one pathological record and later unrelated failures draw from the same
 * count. A "retry" verdict means the failure was absorbed and the consume loop moves on to
 * the next record; the failed record itself is not re-delivered.
 */
public final class FailureGovernor {

  private static final Logger LOG = LoggerFactory.getLogger(FailureGovernor.class);

  private final RetryPolicy policy;
  private long failures;

  public FailureGovernor(RetryPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
    policy.validate();
  }

  /**
   * Returns true when the failure was absorbed (after the configured delay), false when
   * the budget is spent and the caller must propagate {@code error}.
   */
  public boolean shouldContinue(Throwable error, String context) {
    Objects.requireNonNull(error, "error");
    long budget = policy.getMaxAttempts();
    if (!policy.isEnabled() || (budget != 0 && failures >= budget)) {
      LOG.error("Failure budget of {} exhausted, giving up on {}", budget, context);
      return false;
    }
    LOG.warn("Skipping failed message {} ({} of {} tolerated failures): {}",
      context, failures + 1, budget == 0 ? "unlimited" : budget, error.toString());
    LOG.debug("Failure details", error);
    policy.pause();
    failures++;
    return true;
  }

  public long failures() {
    return failures;
  }

  public void reset() {
    failures = 0;
  }
}
