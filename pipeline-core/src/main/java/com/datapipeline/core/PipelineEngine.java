package com.datapipeline.core;

import com.datapipeline.core.error.ErrorContext;
import com.datapipeline.core.error.ErrorHandler;
import com.datapipeline.core.error.ErrorLogEntry;
import com.datapipeline.core.error.RecoveryStrategy;
import com.datapipeline.core.event.PipelineEvent;
import com.datapipeline.core.event.PipelineEventBus;
import com.datapipeline.metrics.MetricsRecorder;
import com.datapipeline.metrics.SimpleMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds execution plans for registered operations and runs them group by group.
 *
 * <p>Only one execution may be in flight per engine. Stages of a group are submitted together to the
 * engine's executor and joined before the next group starts. A failing critical stage aborts the
 * execution once its group has settled; a failing non-critical stage is recorded and skipped.
 */
public final class PipelineEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

  public static final int DEFAULT_MAX_PARALLEL_STAGES = 4;
  public static final long DEFAULT_STAGE_TIMEOUT_MS = 30_000L;

  private final StageRegistry registry;
  private final OperationCatalog catalog;
  private final ErrorHandler errorHandler;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final PipelineEventBus events;
  private final MetricsRecorder metrics;
  private final long defaultStageTimeoutMs;
  private final ExecutionHistory history;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicLong executionSeq = new AtomicLong();
  private volatile ExecutionRecord current;
  private volatile ExecutionState state = ExecutionState.EMPTY;

  private PipelineEngine(Builder b) {
    this.registry = Objects.requireNonNull(b.registry, "registry");
    this.catalog = Objects.requireNonNull(b.catalog, "catalog");
    this.metrics = b.metrics;
    this.errorHandler = b.errorHandler != null ? b.errorHandler : ErrorHandler.builder().metrics(b.metrics).build();
    this.ownsExecutor = b.executor == null;
    this.executor = ownsExecutor ? newStageExecutor(b.maxParallelStages) : b.executor;
    this.events = b.events;
    this.defaultStageTimeoutMs = b.defaultStageTimeoutMs;
    this.history = b.history;
    this.clock = b.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Plans {@code operationType}: its selected stages plus everything they transitively depend on,
   * grouped for execution.
   *
   * @throws UnknownOperationTypeException if the catalog does not know the operation
   * @throws UnknownStageException if a selected stage or a dependency is not registered
   * @throws CircularDependencyException if the selected stages cannot be ordered
   */
  public PipelineDefinition buildPipeline(String operationType, Map<String, Object> options) {
    Map<String, Object> opts = options == null ? Map.of() : options;
    List<String> selected = catalog.stagesFor(operationType, opts);

    Set<String> names = new LinkedHashSet<>();
    Deque<String> pending = new ArrayDeque<>(selected);
    while (!pending.isEmpty()) {
      String name = pending.pop();
      if (!names.add(name)) continue;
      for (String dep : registry.definition(name).dependencies()) {
        if (!registry.has(dep)) throw new UnknownStageException(dep, name);
        pending.push(dep);
      }
    }

    List<StageDefinition> stages = new ArrayList<>(names.size());
    for (String name : names) stages.add(registry.definition(name));
    stages.sort(Comparator.comparingInt(s -> registry.order(s.name())));

    List<List<StageDefinition>> plan = DependencyResolver.resolve(stages);
    PipelineDefinition pipeline = new PipelineDefinition(operationType, stages, plan, opts,
        estimateDuration(stages, defaultStageTimeoutMs));
    log.debug("Built '{}' with {} stages in {} groups", operationType, stages.size(), plan.size());
    return pipeline;
  }

  public Map<String, Object> executePipeline(PipelineDefinition pipeline) {
    return executePipeline(pipeline, PipelineProgressListener.NONE);
  }

  /**
   * Runs {@code pipeline} to completion and returns the results of every stage that succeeded, keyed
   * by stage name.
   *
   * @throws AlreadyRunningException if another execution is in flight on this engine
   * @throws StageFailedException if a critical stage failed; its cause is the stage's own exception
   */
  public Map<String, Object> executePipeline(PipelineDefinition pipeline, PipelineProgressListener listener) {
    Objects.requireNonNull(pipeline, "pipeline");
    PipelineProgressListener progress = listener == null ? PipelineProgressListener.NONE : listener;
    if (!running.compareAndSet(false, true)) {
      ExecutionRecord inFlight = current;
      throw new AlreadyRunningException(inFlight == null ? "starting" : inFlight.id());
    }

    ExecutionRecord record = new ExecutionRecord(nextExecutionId(), pipeline, clock.instant());
    try {
      current = record;
      state = new ExecutionState(pipeline.stages());
      log.info("Execution {} started: '{}' ({} stages, ~{} ms)", record.id(), pipeline.operationType(),
          pipeline.stages().size(), pipeline.estimatedDurationMs());
      events.publish(new PipelineEvent.PipelineStarted(record.snapshot()));

      long t0 = System.nanoTime();
      for (List<StageDefinition> group : pipeline.executionPlan()) {
        StageOutcome criticalFailure = runGroup(record, pipeline, group, progress);
        if (criticalFailure != null) {
          throw abort(record, pipeline, criticalFailure);
        }
      }

      record.complete(clock.instant());
      ExecutionSnapshot done = record.snapshot();
      metrics.onPipelineCompleted(pipeline.operationType(), System.nanoTime() - t0);
      events.publish(new PipelineEvent.PipelineCompleted(done));
      history.append(done);
      log.info("Execution {} completed: {} results, {} non-critical failures", done.id(), done.results().size(),
          done.failures().size());
      return done.results();
    } finally {
      current = null;
      running.set(false);
    }
  }

  public StatusSnapshot getStatus() {
    ExecutionRecord rec = current;
    ExecutionState st = state;
    List<String> runningStages = st.runningStages();
    String currentStage = runningStages.isEmpty() ? null : String.join(", ", runningStages);
    return new StatusSnapshot(running.get(), rec == null ? null : rec.snapshot(), currentStage, runningStages,
        st.progress(), st.stageProgress());
  }

  public boolean isRunning() {
    return running.get();
  }

  public List<ExecutionSnapshot> getExecutionHistory() {
    return history.entries();
  }

  public PipelineEventBus events() {
    return events;
  }

  public ErrorHandler errorHandler() {
    return errorHandler;
  }

  public MetricsRecorder metrics() {
    return metrics;
  }

  public List<StageDefinition> availableStages() {
    return registry.definitions();
  }

  public List<String> operationTypes() {
    return catalog.operationTypes();
  }

  /** Shuts down the stage executor if this engine created it. */
  @Override
  public void close() {
    if (!ownsExecutor) return;
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  /** Sum of stage timeouts, with unset timeouts counted as {@code defaultTimeoutMs}. */
  static long estimateDuration(List<StageDefinition> stages, long defaultTimeoutMs) {
    long total = 0L;
    for (StageDefinition s : stages) total += s.timeoutOr(defaultTimeoutMs);
    return total;
  }

  // returns the first critical failure of the group in plan order, or null
  private StageOutcome runGroup(ExecutionRecord record, PipelineDefinition pipeline, List<StageDefinition> group,
                                PipelineProgressListener progress) {
    List<String> names = new ArrayList<>(group.size());
    for (StageDefinition s : group) names.add(s.name());
    boolean parallel = group.size() > 1;
    if (parallel) {
      log.debug("Running stages in parallel: {}", names);
      events.publish(new PipelineEvent.ParallelGroupStarted(names));
    }

    // started on this thread so stage:start follows registration order
    ExecutionState st = state;
    List<CompletableFuture<StageOutcome>> futures = new ArrayList<>(group.size());
    for (StageDefinition stage : group) {
      st.markRunning(stage.name());
      events.publish(new PipelineEvent.StageStarted(stage.name(), stage.description()));
      log.debug("Stage {} started", stage.name());
      futures.add(CompletableFuture.supplyAsync(() -> runStage(record, pipeline, stage, st, progress), executor));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    if (parallel) events.publish(new PipelineEvent.ParallelGroupCompleted(names));

    for (CompletableFuture<StageOutcome> f : futures) {
      StageOutcome outcome = f.join();
      if (outcome.failed() && outcome.stage().critical()) return outcome;
    }
    return null;
  }

  private StageOutcome runStage(ExecutionRecord record, PipelineDefinition pipeline, StageDefinition stage,
                                ExecutionState st, PipelineProgressListener progress) {
    String name = stage.name();
    String op = pipeline.operationType();
    StageContext ctx = new StageContext(name, op, pipeline.options(), record.results(),
        (percentage, message) -> st.advance(name, percentage, message));
    long t0 = System.nanoTime();
    StageOutcome outcome;
    try {
      Object result = registry.body(name).run(ctx);
      if (result == null) throw new IllegalStateException("Stage '" + name + "' returned no result");
      long nanos = System.nanoTime() - t0;
      long ms = TimeUnit.NANOSECONDS.toMillis(nanos);
      record.putResult(name, result);
      st.markCompleted(name, ms);
      metrics.onStageSuccess(op, name, nanos);
      events.publish(new PipelineEvent.StageCompleted(name, result, ms));
      log.info("Stage {} completed in {} ms", name, ms);
      outcome = new StageOutcome(stage, null);
    } catch (Throwable t) {
      // Errors too: every stage must settle with an outcome
      if (t instanceof InterruptedException) Thread.currentThread().interrupt();
      long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
      st.markFailed(name, String.valueOf(t.getMessage()), ms);
      record.addFailure(new StageFailure(name, stage.critical(), t, clock.instant()));
      metrics.onStageError(op, name, t);
      events.publish(new PipelineEvent.StageFailed(name, t, stage.critical(), ms));
      if (stage.critical()) {
        log.error("Critical stage {} failed after {} ms", name, ms, t);
      } else {
        log.warn("Non-critical stage {} failed after {} ms, continuing: {}", name, ms, t.getMessage());
      }
      outcome = new StageOutcome(stage, t);
    }
    notifyProgress(progress, st.progress(), name);
    return outcome;
  }

  private static void notifyProgress(PipelineProgressListener listener, PipelineProgress progress, String stage) {
    try {
      listener.onProgress(progress);
    } catch (RuntimeException e) {
      log.error("Progress listener failed after stage {}", stage, e);
    }
  }

  private StageFailedException abort(ExecutionRecord record, PipelineDefinition pipeline, StageOutcome failure) {
    String stage = failure.stage().name();
    record.fail(failure.error(), clock.instant());
    ExecutionSnapshot failed = record.snapshot();
    metrics.onPipelineFailed(pipeline.operationType(), stage);
    events.publish(new PipelineEvent.PipelineFailed(failed, failure.error()));

    ErrorLogEntry entry = errorHandler.record(failure.error(), ErrorContext.builder()
        .stage(stage)
        .attribute("executionId", record.id())
        .attribute("operationType", pipeline.operationType())
        .build());
    if (entry.classification().strategy() == RecoveryStrategy.RETRY) {
      log.info("Error {} is retryable; operation '{}' can be run again", entry.id(), pipeline.operationType());
    }
    history.append(failed);
    log.error("Execution {} failed at stage {}", record.id(), stage);
    return new StageFailedException(stage, record.id(), failure.error());
  }

  private String nextExecutionId() {
    return "exec_" + clock.millis() + "_" + executionSeq.incrementAndGet();
  }

  private static ExecutorService newStageExecutor(int threads) {
    AtomicInteger n = new AtomicInteger();
    return Executors.newFixedThreadPool(threads, r -> {
      Thread t = new Thread(r, "pipeline-stage-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  private record StageOutcome(StageDefinition stage, Throwable error) {
    boolean failed() {
      return error != null;
    }
  }

  public static final class Builder {
    private StageRegistry registry;
    private OperationCatalog catalog;
    private ErrorHandler errorHandler;
    private ExecutorService executor;
    private int maxParallelStages = DEFAULT_MAX_PARALLEL_STAGES;
    private PipelineEventBus events = new PipelineEventBus();
    private MetricsRecorder metrics = new SimpleMetricsRecorder();
    private long defaultStageTimeoutMs = DEFAULT_STAGE_TIMEOUT_MS;
    private ExecutionHistory history = new ExecutionHistory();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder registry(StageRegistry r) { this.registry = r; return this; }
    public Builder catalog(OperationCatalog c) { this.catalog = c; return this; }
    public Builder errorHandler(ErrorHandler h) { this.errorHandler = h; return this; }

    /** Caller-owned executor; {@link #close()} leaves it running. */
    public Builder executor(ExecutorService e) { this.executor = e; return this; }

    public Builder maxParallelStages(int n) {
      if (n < 1) throw new IllegalArgumentException("maxParallelStages must be >= 1");
      this.maxParallelStages = n;
      return this;
    }

    public Builder events(PipelineEventBus bus) { this.events = Objects.requireNonNull(bus, "events"); return this; }
    public Builder metrics(MetricsRecorder m) { this.metrics = Objects.requireNonNull(m, "metrics"); return this; }

    public Builder defaultStageTimeoutMs(long ms) {
      if (ms < 0) throw new IllegalArgumentException("defaultStageTimeoutMs must be >= 0");
      this.defaultStageTimeoutMs = ms;
      return this;
    }

    public Builder history(ExecutionHistory h) { this.history = Objects.requireNonNull(h, "history"); return this; }
    public Builder clock(Clock c) { this.clock = Objects.requireNonNull(c, "clock"); return this; }

    public PipelineEngine build() {
      return new PipelineEngine(this);
    }
  }
}
