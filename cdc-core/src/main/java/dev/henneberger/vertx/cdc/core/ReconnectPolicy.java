package dev.henneberger.vertx.cdc.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Exponential backoff used between reconnect attempts of a replication session.
 * <p>
 * The attempt counter passed in is 1-based and restarts from 1 after every session that
 * reached the connected state. {@code maxAttempts == 0} means retry forever.
 */
public final class ReconnectPolicy {

  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

  private Duration initialDelay = DEFAULT_INITIAL_DELAY;
  private Duration maxDelay = DEFAULT_MAX_DELAY;
  private double multiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxAttempts = 0;
  private Predicate<Throwable> retryOn = err -> true;
  private boolean enabled;

  private ReconnectPolicy(boolean enabled) {
    this.enabled = enabled;
  }

  public static ReconnectPolicy never() {
    return new ReconnectPolicy(false);
  }

  public static ReconnectPolicy exponentialBackoff() {
    return new ReconnectPolicy(true);
  }

  public ReconnectPolicy copy() {
    ReconnectPolicy copy = new ReconnectPolicy(enabled);
    copy.initialDelay = initialDelay;
    copy.maxDelay = maxDelay;
    copy.multiplier = multiplier;
    copy.jitter = jitter;
    copy.maxAttempts = maxAttempts;
    copy.retryOn = retryOn;
    return copy;
  }

  public ReconnectPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public ReconnectPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public ReconnectPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  public ReconnectPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  public ReconnectPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public ReconnectPolicy setRetryOn(Predicate<Throwable> retryOn) {
    this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
    return this;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public double getJitter() {
    return jitter;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  public boolean isUnbounded() {
    return maxAttempts == 0;
  }

  public boolean shouldRetry(Throwable error, long attempt) {
    if (!enabled || !retryOn.test(error)) {
      return false;
    }
    return maxAttempts == 0 || attempt <= maxAttempts;
  }

  /**
   * Delay before reconnect attempt {@code attempt}, capped at {@link #getMaxDelay()} and spread
   * by +/- {@code jitter} of the capped value.
   */
  public long computeDelayMillis(long attempt) {
    double base = initialDelay.toMillis() * Math.pow(Math.max(1.0d, multiplier), Math.max(0, attempt - 1));
    long capped = (long) Math.min(base, (double) maxDelay.toMillis());
    if (jitter == 0.0d || capped == 0L) {
      return capped;
    }
    long delta = (long) (capped * jitter);
    long min = Math.max(0L, capped - delta);
    long max = Math.min(maxDelay.toMillis(), capped + delta);
    return ThreadLocalRandom.current().nextLong(min, max + 1);
  }

  public void validate() {
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (maxDelay.isNegative()) {
      throw new IllegalArgumentException("maxDelay must be >= 0");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0");
    }
  }
}
