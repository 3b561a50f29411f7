package com.datapipeline.core.error;

import com.datapipeline.core.ThrowingFn;
import com.datapipeline.metrics.MetricsRecorder;
import com.datapipeline.metrics.SimpleMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Classifies errors, keeps an audit log with statistics and runs recovery operations.
 *
 * <p>Every handled error is logged, including those a recovery operation later resolves. When
 * recovery does not succeed the original exception is rethrown; failed recovery attempts are attached
 * to it as suppressed exceptions.
 */
public final class ErrorHandler {
  private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

  public static final int DEFAULT_LOG_LIMIT = 50;

  private final ErrorClassifier classifier;
  private final Map<ErrorType, RetryPolicy> retryPolicies;
  private final RetryPolicy defaultRetryPolicy;
  private final Sleeper sleeper;
  private final DoubleSupplier jitterSource;
  private final MetricsRecorder metrics;
  private final Clock clock;

  // guarded by this
  private final List<ErrorLogEntry> errorLog = new ArrayList<>();
  private final Map<ErrorType, Long> errorsByType = new EnumMap<>(ErrorType.class);
  private final Map<ErrorSeverity, Long> errorsBySeverity = new EnumMap<>(ErrorSeverity.class);
  private long totalErrors;
  private long recoveryAttempts;
  private long successfulRecoveries;
  private long failedRecoveries;

  private ErrorHandler(Builder b) {
    this.classifier = b.classifier;
    this.retryPolicies = new EnumMap<>(b.retryPolicies);
    this.defaultRetryPolicy = b.defaultRetryPolicy;
    this.sleeper = b.sleeper;
    this.jitterSource = b.jitterSource;
    this.metrics = b.metrics;
    this.clock = b.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ErrorHandler defaults() {
    return builder().build();
  }

  public ErrorClassification classifyError(Throwable error) {
    return classifier.classify(error);
  }

  /** Same as {@link #classifyError(Throwable)}; the rules look at the error alone, the context is only logged. */
  public ErrorClassification classifyError(Throwable error, ErrorContext<?> context) {
    Objects.requireNonNull(context, "context");
    ErrorClassification classification = classifier.classify(error);
    log.debug("Classified {} in {} as {}/{}", error.getClass().getSimpleName(), context.describe(),
        classification.type(), classification.strategy());
    return classification;
  }

  public RetryPolicy retryPolicyFor(ErrorType type) {
    return retryPolicies.getOrDefault(type, defaultRetryPolicy);
  }

  public InterventionGuide interventionGuide(Throwable error) {
    return InterventionGuide.forClassification(classifier.classify(error));
  }

  /** Classifies and logs {@code error} and updates the statistics, without attempting recovery. */
  public ErrorLogEntry record(Throwable error, ErrorContext<?> context) {
    Objects.requireNonNull(error, "error");
    Objects.requireNonNull(context, "context");
    ErrorClassification classification = classifier.classify(error);
    ErrorLogEntry entry = new ErrorLogEntry(ErrorIds.next(clock), clock.instant(), error, context.describe(),
        classification, 0, false);
    synchronized (this) {
      errorLog.add(entry);
      totalErrors++;
      errorsByType.merge(classification.type(), 1L, Long::sum);
      errorsBySeverity.merge(classification.severity(), 1L, Long::sum);
    }
    metrics.onErrorClassified(classification.type().name());
    log.error("Error {} [{}/{}] in {}: {}", entry.id(), classification.type(), classification.severity(),
        context.stage() == null ? "-" : context.stage(), error.getMessage());
    if (classification.strategy() == RecoveryStrategy.MANUAL_INTERVENTION) {
      logInterventionGuide(entry);
    }
    return entry;
  }

  /**
   * Logs {@code error} and, when the context carries an operation, tries to recover by invoking it:
   * with backoff up to the type's {@link RetryPolicy} for {@link RecoveryStrategy#RETRY}, once otherwise.
   *
   * @throws Exception the original {@code error} when there is no operation or it never succeeds
   */
  public <T> RecoveryResult<T> handleError(Exception error, ErrorContext<T> context) throws Exception {
    ErrorLogEntry entry = record(error, context);
    if (!context.hasOperation()) {
      throw error;
    }

    ErrorClassification classification = entry.classification();
    boolean retrying = classification.strategy() == RecoveryStrategy.RETRY;
    RetryPolicy policy = retryPolicyFor(classification.type());
    int maxAttempts = retrying ? policy.maxAttempts() : 1;

    int attempts = 0;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (attempt > 1 && !pause(policy.delayBefore(attempt, jitterSource), entry.id())) break;
      attempts = attempt;
      try {
        T result = context.operation().call();
        onRecovered(entry, attempts);
        log.info("Error {} recovered on attempt {}/{}", entry.id(), attempt, maxAttempts);
        return RecoveryResult.recovered(result, attempts);
      } catch (Exception attemptError) {
        if (attemptError != error) error.addSuppressed(attemptError);
        log.warn("Recovery attempt {}/{} for error {} failed: {}", attempt, maxAttempts, entry.id(),
            attemptError.getMessage());
        if (retrying && classifier.classify(attemptError).strategy() != RecoveryStrategy.RETRY) {
          log.info("Stopping retries for error {}: attempt failed with a non-retryable error", entry.id());
          break;
        }
      }
    }
    onRecoveryFailed(entry, attempts);
    throw error;
  }

  /**
   * Wraps {@code fn} so that a failure goes through {@link #handleError} with {@code fn} itself as the
   * recovery operation; the context's fallback data is returned when that does not succeed.
   */
  public <T> Callable<T> wrapWithErrorHandling(Callable<T> fn, ErrorContext<T> context) {
    Objects.requireNonNull(fn, "fn");
    Objects.requireNonNull(context, "context");
    return () -> {
      try {
        return fn.call();
      } catch (Exception e) {
        return recoverOrFallback(e, context.withOperation(fn));
      }
    };
  }

  public <I, O> ThrowingFn<I, O> wrapWithErrorHandling(ThrowingFn<I, O> fn, ErrorContext<O> context) {
    Objects.requireNonNull(fn, "fn");
    Objects.requireNonNull(context, "context");
    return in -> {
      try {
        return fn.apply(in);
      } catch (Exception e) {
        return recoverOrFallback(e, context.withOperation(() -> fn.apply(in)));
      }
    };
  }

  public List<ErrorLogEntry> getErrorLog() {
    return getErrorLog(DEFAULT_LOG_LIMIT);
  }

  /** The {@code limit} most recent entries, oldest first. */
  public synchronized List<ErrorLogEntry> getErrorLog(int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    int from = Math.max(0, errorLog.size() - limit);
    return List.copyOf(errorLog.subList(from, errorLog.size()));
  }

  public synchronized List<ErrorLogEntry> getUnresolvedErrors() {
    List<ErrorLogEntry> out = new ArrayList<>();
    for (ErrorLogEntry e : errorLog) {
      if (!e.resolved()) out.add(e);
    }
    return out;
  }

  /** Drops the log and resets every statistic. */
  public synchronized void clearErrorLog() {
    errorLog.clear();
    errorsByType.clear();
    errorsBySeverity.clear();
    totalErrors = 0;
    recoveryAttempts = 0;
    successfulRecoveries = 0;
    failedRecoveries = 0;
  }

  public synchronized ErrorStats getStats() {
    return new ErrorStats(totalErrors, errorsByType, errorsBySeverity, recoveryAttempts, successfulRecoveries,
        failedRecoveries);
  }

  private <T> T recoverOrFallback(Exception error, ErrorContext<T> context) throws Exception {
    try {
      return handleError(error, context).result();
    } catch (Exception unrecovered) {
      if (!context.hasFallback()) throw unrecovered;
      log.warn("Using fallback data after unrecovered error: {}", unrecovered.getMessage());
      return context.fallbackData();
    }
  }

  private boolean pause(Duration delay, String errorId) {
    if (delay.isZero()) return true;
    log.debug("Waiting {} ms before retrying error {}", delay.toMillis(), errorId);
    try {
      sleeper.sleep(delay);
      return true;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while backing off for error {}; giving up", errorId);
      return false;
    }
  }

  private synchronized void onRecovered(ErrorLogEntry entry, int attempts) {
    recoveryAttempts += attempts;
    successfulRecoveries++;
    replace(entry.withRecovery(attempts, true));
  }

  private synchronized void onRecoveryFailed(ErrorLogEntry entry, int attempts) {
    recoveryAttempts += attempts;
    failedRecoveries++;
    replace(entry.withRecovery(attempts, false));
  }

  // the entry may be gone if the log was cleared meanwhile
  private void replace(ErrorLogEntry updated) {
    for (int i = errorLog.size() - 1; i >= 0; i--) {
      if (errorLog.get(i).id().equals(updated.id())) {
        errorLog.set(i, updated);
        return;
      }
    }
  }

  private static void logInterventionGuide(ErrorLogEntry entry) {
    InterventionGuide guide = InterventionGuide.forClassification(entry.classification());
    log.warn("Manual intervention required for error {} ({})", entry.id(), guide.type());
    for (int i = 0; i < guide.steps().size(); i++) {
      log.warn("  {}. {}", i + 1, guide.steps().get(i));
    }
  }

  public static final class Builder {
    private ErrorClassifier classifier = ErrorClassifier.defaults();
    private final Map<ErrorType, RetryPolicy> retryPolicies = new EnumMap<>(RetryPolicy.defaults());
    private RetryPolicy defaultRetryPolicy = RetryPolicy.DEFAULT;
    private Sleeper sleeper = Sleeper.SYSTEM;
    private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();
    private MetricsRecorder metrics = new SimpleMetricsRecorder();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder classifier(ErrorClassifier c) { this.classifier = Objects.requireNonNull(c, "classifier"); return this; }

    public Builder retryPolicy(ErrorType type, RetryPolicy policy) {
      retryPolicies.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(policy, "policy"));
      return this;
    }

    public Builder retryPolicies(Map<ErrorType, RetryPolicy> policies) {
      policies.forEach(this::retryPolicy);
      return this;
    }

    public Builder defaultRetryPolicy(RetryPolicy p) { this.defaultRetryPolicy = Objects.requireNonNull(p, "policy"); return this; }
    public Builder sleeper(Sleeper s) { this.sleeper = Objects.requireNonNull(s, "sleeper"); return this; }
    public Builder jitterSource(DoubleSupplier s) { this.jitterSource = Objects.requireNonNull(s, "jitterSource"); return this; }
    public Builder metrics(MetricsRecorder m) { this.metrics = Objects.requireNonNull(m, "metrics"); return this; }
    public Builder clock(Clock c) { this.clock = Objects.requireNonNull(c, "clock"); return this; }

    public ErrorHandler build() {
      return new ErrorHandler(this);
    }
  }
}
