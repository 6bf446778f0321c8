package com.acme.delivery.replication.core;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded, fixed-delay retry schedule used for connection setup, session restarts, slot
 * reclamation and message failures.
 *
 * <p>{@code maxAttempts} counts every attempt, the first one included: a policy with
 * {@code maxAttempts = 5} allows four retries. Zero means unbounded.
 */
public final class RetryPolicy {
  private final boolean enabled;
  private Duration delay = Duration.ofSeconds(1);
  private long maxAttempts;
  private Predicate<Throwable> retryOn = err -> true;

  private RetryPolicy(boolean enabled) {
    this.enabled = enabled;
  }

  public static RetryPolicy disabled() {
    return new RetryPolicy(false);
  }

  public static RetryPolicy fixedDelay(Duration delay, long maxAttempts) {
    return new RetryPolicy(true)
      .setDelay(delay)
      .setMaxAttempts(maxAttempts);
  }

  public RetryPolicy copy() {
    RetryPolicy copy = new RetryPolicy(enabled);
    copy.delay = delay;
    copy.maxAttempts = maxAttempts;
    copy.retryOn = retryOn;
    return copy;
  }

  public RetryPolicy setDelay(Duration delay) {
    this.delay = Objects.requireNonNull(delay, "delay");
    return this;
  }

  public RetryPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  /**
   * Restricts retries to failures matching {@code retryOn}; anything else fails at once.
   */
  public RetryPolicy setRetryOn(Predicate<Throwable> retryOn) {
    this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
    return this;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getDelay() {
    return delay;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * Whether another attempt may follow the failed {@code attempt} (1-based).
   */
  public boolean shouldRetry(Throwable error, long attempt) {
    if (!enabled || !retryOn.test(error)) {
      return false;
    }
    return maxAttempts == 0 || attempt < maxAttempts;
  }

  /**
   * Sleeps for one delay. An interrupt ends the pause early and leaves the flag set for the
   * caller's loop to observe.
   */
  public void pause() {
    if (delay.isZero()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public void validate() {
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must be >= 0");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0");
    }
  }

  @Override
  public String toString() {
    if (!enabled) {
      return "RetryPolicy{disabled}";
    }
    return "RetryPolicy{delay=" + delay + ", maxAttempts=" + maxAttempts + "}";
  }
}
