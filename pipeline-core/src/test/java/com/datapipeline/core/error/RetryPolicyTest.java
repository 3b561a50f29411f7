package com.datapipeline.core.error;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class RetryPolicyTest {

  @Test
  void firstAttemptIsImmediate() {
    assertEquals(Duration.ZERO, RetryPolicy.DEFAULT.delayBefore(1, () -> 0.5));
  }

  @Test
  void delayGrowsExponentiallyUpToTheCap() {
    RetryPolicy p = new RetryPolicy(6, Duration.ofMillis(1000), Duration.ofMillis(5000), 2.0, false);

    assertEquals(2000, p.delayBefore(2, () -> 0.0).toMillis());
    assertEquals(4000, p.delayBefore(3, () -> 0.0).toMillis());
    assertEquals(5000, p.delayBefore(4, () -> 0.0).toMillis());
  }

  @Test
  void jitterStaysWithinTenPercent() {
    RetryPolicy p = new RetryPolicy(3, Duration.ofMillis(1000), Duration.ofMillis(30000), 2.0, true);

    long low = p.delayBefore(2, () -> 0.0).toMillis();
    long high = p.delayBefore(2, () -> 0.999999).toMillis();

    assertEquals(1800, low);
    assertTrue(high <= 2200 && high > 2100, "high=" + high);
  }

  @Test
  void defaultsCoverRetryableTypes() {
    assertEquals(5, RetryPolicy.defaults().get(ErrorType.SERVICE_UNAVAILABLE).maxAttempts());
    assertEquals(2, RetryPolicy.defaults().get(ErrorType.TIMEOUT).maxAttempts());
  }

  @Test
  void rejectsNonsense() {
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0, false));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.5, false));
  }
}
