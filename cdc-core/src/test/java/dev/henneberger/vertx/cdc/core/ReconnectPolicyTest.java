package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ReconnectPolicyTest {

  @Test
  void defaultsRetryForever() {
    ReconnectPolicy policy = ReconnectPolicy.exponentialBackoff();
    assertTrue(policy.isUnbounded());
    assertTrue(policy.shouldRetry(new RuntimeException("io"), 1_000_000L));
    assertEquals(Duration.ofMillis(100), policy.getInitialDelay());
    assertEquals(Duration.ofSeconds(30), policy.getMaxDelay());
  }

  @Test
  void neverDoesNotRetry() {
    assertFalse(ReconnectPolicy.never().shouldRetry(new RuntimeException(), 1));
  }

  @Test
  void boundedAttempts() {
    ReconnectPolicy policy = ReconnectPolicy.exponentialBackoff().setMaxAttempts(2);
    assertTrue(policy.shouldRetry(new RuntimeException(), 1));
    assertTrue(policy.shouldRetry(new RuntimeException(), 2));
    assertFalse(policy.shouldRetry(new RuntimeException(), 3));
  }

  @Test
  void retryPredicateExcludesErrors() {
    ReconnectPolicy policy = ReconnectPolicy.exponentialBackoff()
      .setRetryOn(err -> !(err instanceof IllegalArgumentException));
    assertFalse(policy.shouldRetry(new IllegalArgumentException(), 1));
    assertTrue(policy.shouldRetry(new IllegalStateException(), 1));
  }

  @Test
  void delaysGrowExponentiallyAndAreCapped() {
    ReconnectPolicy policy = ReconnectPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(100))
      .setMaxDelay(Duration.ofMillis(1000))
      .setJitter(0.0d);

    assertEquals(100L, policy.computeDelayMillis(1));
    assertEquals(200L, policy.computeDelayMillis(2));
    assertEquals(400L, policy.computeDelayMillis(3));
    assertEquals(800L, policy.computeDelayMillis(4));
    assertEquals(1000L, policy.computeDelayMillis(5));
    assertEquals(1000L, policy.computeDelayMillis(60));
  }

  @Test
  void jitterStaysWithinBoundsAndCap() {
    ReconnectPolicy policy = ReconnectPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(1000))
      .setMaxDelay(Duration.ofMillis(1500))
      .setJitter(0.5d);
    for (int i = 0; i < 200; i++) {
      long first = policy.computeDelayMillis(1);
      assertTrue(first >= 500L && first <= 1500L, "delay " + first);
      long capped = policy.computeDelayMillis(10);
      assertTrue(capped >= 750L && capped <= 1500L, "delay " + capped);
    }
  }

  @Test
  void validateRejectsInconsistentSettings() {
    assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofSeconds(5))
      .setMaxDelay(Duration.ofSeconds(1))
      .validate());
    assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.exponentialBackoff()
      .setMultiplier(0.5d)
      .validate());
    assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.exponentialBackoff().setJitter(2.0d));
  }

  @Test
  void copyIsIndependent() {
    ReconnectPolicy original = ReconnectPolicy.exponentialBackoff().setMaxAttempts(3);
    ReconnectPolicy copy = original.copy().setMaxAttempts(7);
    assertEquals(3L, original.getMaxAttempts());
    assertEquals(7L, copy.getMaxAttempts());
    assertTrue(copy.isEnabled());
  }
}
