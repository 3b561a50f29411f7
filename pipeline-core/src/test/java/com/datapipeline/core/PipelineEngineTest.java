package com.datapipeline.core;

import com.datapipeline.core.error.ErrorType;
import com.datapipeline.core.event.PipelineEvent;
import com.datapipeline.core.event.PipelineEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class PipelineEngineTest {

  private final List<PipelineEngine> engines = new ArrayList<>();

  @AfterEach
  void closeEngines() {
    engines.forEach(PipelineEngine::close);
  }

  @Test
  void buildAddsTransitiveDependenciesAndKeepsRegistrationOrder() {
    PipelineEngine engine = engine(registry(Map.of()));

    PipelineDefinition p = engine.buildPipeline("images", Map.of("force", true));

    assertEquals(List.of("vp", "dc", "process-images", "validate-data", "update-state"), p.stageNames());
    assertFalse(p.stageNames().contains("seed-database"));
    assertEquals(true, p.options().get("force"));
    assertEquals("images", p.operationType());
  }

  @Test
  void fullPlanHasOneParallelGroupOfThree() {
    PipelineDefinition p = engine(registry(Map.of())).buildPipeline("full", null);

    assertEquals(5, p.executionPlan().size());
    assertEquals(1, p.parallelGroups().size());
    assertEquals(3, p.parallelGroups().get(0).size());
  }

  @Test
  void unknownOperationNamesTheOffendingValue() {
    PipelineEngine engine = engine(registry(Map.of()));

    UnknownOperationTypeException e = assertThrows(UnknownOperationTypeException.class,
        () -> engine.buildPipeline("unknown-op", Map.of()));
    assertTrue(e.getMessage().contains("unknown-op"));
  }

  @Test
  void unregisteredDependencyFailsTheBuild() {
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("a").dependsOn("ghost").build(), ctx -> "a");
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "a").build());

    UnknownStageException e = assertThrows(UnknownStageException.class, () -> engine.buildPipeline("op", Map.of()));
    assertEquals("ghost", e.stageName());
  }

  @Test
  void estimateCountsUnsetTimeoutsAsTheDefault() {
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("a").build(), ctx -> "a")
        .register(StageDefinition.builder("b").dependsOn("a").build(), ctx -> "b");
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "a", "b").build());

    assertEquals(60_000L, engine.buildPipeline("op", Map.of()).estimatedDurationMs());
    assertEquals(30_010L, PipelineEngine.estimateDuration(List.of(
        StageDefinition.builder("x").timeoutMs(10).build(),
        StageDefinition.builder("y").build()), 30_000L));
  }

  @Test
  void successfulRunReturnsAllResultsAndRecordsHistory() {
    PipelineEngine engine = engine(registry(Map.of()));
    List<PipelineProgress> progress = Collections.synchronizedList(new ArrayList<>());

    Map<String, Object> results = engine.executePipeline(engine.buildPipeline("full", Map.of()), progress::add);

    assertEquals(7, results.size());
    assertEquals("vp-done", results.get("vp"));
    assertEquals(7, progress.size());
    assertEquals(new PipelineProgress(7, 7), progress.get(6));

    StatusSnapshot status = engine.getStatus();
    assertFalse(status.running());
    assertNull(status.currentExecution());
    assertEquals(100, status.progress().percentage());
    assertEquals(StageStatus.COMPLETED, status.stageProgress().get("update-state").status());

    List<ExecutionSnapshot> history = engine.getExecutionHistory();
    assertEquals(1, history.size());
    assertEquals(ExecutionStatus.COMPLETED, history.get(0).status());
    assertTrue(history.get(0).duration().isPresent());
  }

  @Test
  void downstreamStagesSeeUpstreamResults() {
    AtomicReference<String> seen = new AtomicReference<>();
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("a").build(), ctx -> "from-a")
        .register(StageDefinition.builder("b").dependsOn("a").build(), ctx -> {
          seen.set(ctx.upstreamResult("a", String.class).orElse("missing"));
          return "b";
        });
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "b").build());

    engine.executePipeline(engine.buildPipeline("op", Map.of()));

    assertEquals("from-a", seen.get());
  }

  @Test
  void nonCriticalFailureIsExcludedAndThePipelineContinues() {
    PipelineEngine engine = engine(registry(Map.of("process-images", ctx -> {
      throw new IllegalStateException("bucket missing");
    })));

    Map<String, Object> results = engine.executePipeline(engine.buildPipeline("full", Map.of()));

    assertFalse(results.containsKey("process-images"));
    assertEquals(6, results.size());
    ExecutionSnapshot run = engine.getExecutionHistory().get(0);
    assertEquals(ExecutionStatus.COMPLETED, run.status());
    assertEquals(1, run.failures().size());
    assertEquals("process-images", run.failures().get(0).stageName());
    assertFalse(run.failures().get(0).critical());
    assertEquals(6, engine.getStatus().progress().completed());
  }

  @Test
  void criticalFailureAbortsAfterSiblingsSettle() {
    ConnectException cause = new ConnectException("connection refused");
    List<String> events = Collections.synchronizedList(new ArrayList<>());
    PipelineEngine engine = engine(registry(Map.of("seed-database", ctx -> {
      throw cause;
    })));
    engine.events().subscribeAll(e -> events.add(e.type().wireName()));

    StageFailedException e = assertThrows(StageFailedException.class,
        () -> engine.executePipeline(engine.buildPipeline("full", Map.of())));

    assertSame(cause, e.getCause());
    assertEquals("seed-database", e.stageName());
    ExecutionSnapshot run = engine.getExecutionHistory().get(0);
    assertEquals(ExecutionStatus.FAILED, run.status());
    assertSame(cause, run.error());
    assertTrue(run.results().containsKey("process-images"));
    assertTrue(run.results().containsKey("sync-frontend"));
    assertFalse(run.results().containsKey("validate-data"));
    assertTrue(events.contains("stage:error"));
    assertTrue(events.contains("stages:parallel:complete"));
    assertEquals("pipeline:error", events.get(events.size() - 1));
    assertEquals(1, engine.errorHandler().getStats().countOf(ErrorType.SERVICE_UNAVAILABLE));
    assertFalse(engine.isRunning());
  }

  @Test
  void firstCriticalFailureInRegistrationOrderIsReported() {
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("first").parallel(true).build(), ctx -> {
          Thread.sleep(50);
          throw new IllegalStateException("first");
        })
        .register(StageDefinition.builder("second").parallel(true).build(), ctx -> {
          throw new IllegalStateException("second");
        });
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "first", "second").build());

    StageFailedException e = assertThrows(StageFailedException.class,
        () -> engine.executePipeline(engine.buildPipeline("op", Map.of())));

    assertEquals("first", e.stageName());
    assertEquals(2, engine.getExecutionHistory().get(0).failures().size());
  }

  @Test
  void nullResultCountsAsFailure() {
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("a").build(), ctx -> null);
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "a").build());

    StageFailedException e = assertThrows(StageFailedException.class,
        () -> engine.executePipeline(engine.buildPipeline("op", Map.of())));
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void errorThrownByCriticalStageAbortsLikeAnyFailure() {
    OutOfMemoryError oom = new OutOfMemoryError("Java heap space");
    List<PipelineEventType> events = Collections.synchronizedList(new ArrayList<>());
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("a").build(), ctx -> {
          throw oom;
        });
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "a").build());
    engine.events().subscribeAll(e -> events.add(e.type()));

    StageFailedException e = assertThrows(StageFailedException.class,
        () -> engine.executePipeline(engine.buildPipeline("op", Map.of())));

    assertSame(oom, e.getCause());
    assertEquals(PipelineEventType.PIPELINE_ERROR, events.get(events.size() - 1));
    assertTrue(events.contains(PipelineEventType.STAGE_ERROR));
    assertEquals(ExecutionStatus.FAILED, engine.getExecutionHistory().get(0).status());
    assertEquals(StageStatus.FAILED, engine.getStatus().stageProgress().get("a").status());
    assertEquals(1, engine.errorHandler().getErrorLog().size());
    assertEquals(1, engine.errorHandler().getStats().countOf(ErrorType.RESOURCE_EXHAUSTION));
    assertFalse(engine.isRunning());
  }

  @Test
  void errorThrownByNonCriticalStageIsRecordedAndSkipped() {
    PipelineEngine engine = engine(registry(Map.of("sync-frontend", ctx -> {
      throw new AssertionError("bad fixture");
    })));

    Map<String, Object> results = engine.executePipeline(engine.buildPipeline("full", Map.of()));

    assertEquals(6, results.size());
    StageFailure failure = engine.getExecutionHistory().get(0).failures().get(0);
    assertEquals("sync-frontend", failure.stageName());
    assertInstanceOf(AssertionError.class, failure.exception());
  }

  @Test
  void failingProgressListenerDoesNotBreakTheExecution() {
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("a").build(), ctx -> "a")
        .register(StageDefinition.builder("b").dependsOn("a").build(), ctx -> "b");
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "b").build());

    Map<String, Object> results = engine.executePipeline(engine.buildPipeline("op", Map.of()), progress -> {
      throw new IllegalStateException("ui gone");
    });

    assertEquals(Map.of("a", "a", "b", "b"), results);
    assertEquals(ExecutionStatus.COMPLETED, engine.getExecutionHistory().get(0).status());
    assertFalse(engine.isRunning());
  }

  @Test
  void stagesOfAGroupStartInRegistrationOrder() {
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("x").parallel(true).build(), ctx -> "x")
        .register(StageDefinition.builder("y").parallel(true).build(), ctx -> "y")
        .register(StageDefinition.builder("z").parallel(true).build(), ctx -> "z");
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "x", "y", "z").build());
    List<String> started = Collections.synchronizedList(new ArrayList<>());
    engine.events().subscribe(PipelineEventType.STAGE_START,
        e -> started.add(((PipelineEvent.StageStarted) e).stage()));
    PipelineDefinition p = engine.buildPipeline("op", Map.of());

    for (int i = 0; i < 200; i++) {
      started.clear();
      engine.executePipeline(p);
      assertEquals(List.of("x", "y", "z"), started, "run " + i);
    }
  }

  @Test
  void parallelGroupRunsItsStagesConcurrently() {
    CountDownLatch allStarted = new CountDownLatch(3);
    StageBody rendezvous = ctx -> {
      allStarted.countDown();
      if (!allStarted.await(2, TimeUnit.SECONDS)) throw new IllegalStateException("ran sequentially");
      return ctx.stageName();
    };
    PipelineEngine engine = engine(registry(Map.of(
        "process-images", rendezvous,
        "seed-database", rendezvous,
        "sync-frontend", rendezvous)));

    Map<String, Object> results = engine.executePipeline(engine.buildPipeline("full", Map.of()));

    assertEquals("seed-database", results.get("seed-database"));
    assertEquals(7, results.size());
  }

  @Test
  void secondConcurrentExecutionIsRejected() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("blocker").build(), ctx -> {
          ctx.reportProgress(40, "halfway");
          started.countDown();
          if (!release.await(2, TimeUnit.SECONDS)) throw new IllegalStateException("not released");
          return "done";
        });
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "blocker").build());
    PipelineDefinition p = engine.buildPipeline("op", Map.of());

    AtomicReference<Map<String, Object>> firstResult = new AtomicReference<>();
    Thread first = new Thread(() -> firstResult.set(engine.executePipeline(p)), "test-run-1");
    first.start();
    assertTrue(started.await(2, TimeUnit.SECONDS), "first run should start");

    StatusSnapshot status = engine.getStatus();
    assertTrue(status.running());
    assertEquals("blocker", status.currentStage());
    assertEquals(40, status.stageProgress().get("blocker").progress());
    assertEquals(ExecutionStatus.RUNNING, status.currentExecution().status());

    AlreadyRunningException e = assertThrows(AlreadyRunningException.class, () -> engine.executePipeline(p));
    assertTrue(e.getMessage().contains("already running"));

    release.countDown();
    first.join(2_000);
    assertEquals(Map.of("blocker", "done"), firstResult.get());
    assertFalse(engine.isRunning());
  }

  @Test
  void lifecycleEventsArriveInOrder() {
    List<PipelineEvent> events = Collections.synchronizedList(new ArrayList<>());
    StageRegistry r = new StageRegistry()
        .register(StageDefinition.builder("a").build(), ctx -> "a")
        .register(StageDefinition.builder("b").dependsOn("a").build(), ctx -> "b");
    PipelineEngine engine = engine(r, OperationCatalog.builder().operation("op", "b").build());
    engine.events().subscribeAll(events::add);

    engine.executePipeline(engine.buildPipeline("op", Map.of()));

    List<PipelineEventType> types = new ArrayList<>();
    for (PipelineEvent e : events) types.add(e.type());
    assertEquals(List.of(
        PipelineEventType.PIPELINE_START,
        PipelineEventType.STAGE_START,
        PipelineEventType.STAGE_COMPLETE,
        PipelineEventType.STAGE_START,
        PipelineEventType.STAGE_COMPLETE,
        PipelineEventType.PIPELINE_COMPLETE), types);
    PipelineEvent.PipelineCompleted done = (PipelineEvent.PipelineCompleted) events.get(5);
    assertEquals(ExecutionStatus.COMPLETED, done.execution().status());
  }

  @Test
  void historyIsBoundedByCapacity() {
    StageRegistry r = new StageRegistry().register(StageDefinition.builder("a").build(), ctx -> "a");
    PipelineEngine engine = PipelineEngine.builder()
        .registry(r)
        .catalog(OperationCatalog.builder().operation("op", "a").build())
        .history(new ExecutionHistory(2))
        .build();
    engines.add(engine);
    PipelineDefinition p = engine.buildPipeline("op", Map.of());

    engine.executePipeline(p);
    engine.executePipeline(p);
    engine.executePipeline(p);

    assertEquals(2, engine.getExecutionHistory().size());
  }

  private PipelineEngine engine(StageRegistry registry) {
    return engine(registry, OperationCatalog.builder()
        .operation("full", "vp", "dc", "process-images", "seed-database", "sync-frontend", "validate-data", "update-state")
        .operation("images", "process-images", "update-state")
        .build());
  }

  private PipelineEngine engine(StageRegistry registry, OperationCatalog catalog) {
    PipelineEngine engine = PipelineEngine.builder().registry(registry).catalog(catalog).build();
    engines.add(engine);
    return engine;
  }

  private static StageRegistry registry(Map<String, StageBody> overrides) {
    StageRegistry r = new StageRegistry();
    for (StageDefinition d : DependencyResolverTest.setupStages()) {
      r.register(d, overrides.getOrDefault(d.name(), ctx -> ctx.stageName() + "-done"));
    }
    return r;
  }
}
