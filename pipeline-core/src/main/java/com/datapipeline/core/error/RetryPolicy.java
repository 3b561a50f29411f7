package com.datapipeline.core.error;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/** Exponential backoff for the RETRY strategy. Attempt 1 runs immediately. */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier, boolean jitter) {
  public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(2000), Duration.ofMillis(15000), 1.5, true);

  private static final double JITTER_FRACTION = 0.1;

  public RetryPolicy {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
    maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || maxDelay.isNegative()) throw new IllegalArgumentException("delays must be >= 0");
    if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
  }

  public static Map<ErrorType, RetryPolicy> defaults() {
    Map<ErrorType, RetryPolicy> m = new EnumMap<>(ErrorType.class);
    m.put(ErrorType.SERVICE_UNAVAILABLE, new RetryPolicy(5, Duration.ofMillis(1000), Duration.ofMillis(30000), 2.0, true));
    m.put(ErrorType.TIMEOUT, new RetryPolicy(2, Duration.ofMillis(5000), Duration.ofMillis(20000), 2.0, false));
    m.put(ErrorType.VALIDATION, new RetryPolicy(1, Duration.ofMillis(1000), Duration.ofMillis(1000), 1.0, false));
    return m;
  }

  /** Delay to wait before {@code attempt} (1-based); {@code random} yields values in [0, 1). */
  public Duration delayBefore(int attempt, DoubleSupplier random) {
    if (attempt <= 1) return Duration.ZERO;
    double delay = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
    delay = Math.min(delay, maxDelay.toMillis());
    if (jitter) {
      double amount = delay * JITTER_FRACTION;
      delay += (random.getAsDouble() - 0.5) * 2 * amount;
    }
    return Duration.ofMillis(Math.max(0L, Math.round(delay)));
  }
}
