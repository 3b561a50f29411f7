package com.datapipeline.setup;

import com.datapipeline.config.PipelineSettings;
import com.datapipeline.core.StageBody;
import com.datapipeline.core.StageContext;
import com.datapipeline.core.StageRegistry;
import com.datapipeline.core.ThrowingFn;
import com.datapipeline.core.error.CollaboratorException;
import com.datapipeline.setup.collaborator.CollaboratorRequest;
import com.datapipeline.setup.collaborator.DataValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Binds each {@link SetupStage} to the collaborator call that implements it. */
public final class SetupStageBodies {
  private static final Logger log = LoggerFactory.getLogger(SetupStageBodies.class);

  private final SetupCollaborators collaborators;
  private final Clock clock;

  public SetupStageBodies(SetupCollaborators collaborators) {
    this(collaborators, Clock.systemUTC());
  }

  public SetupStageBodies(SetupCollaborators collaborators, Clock clock) {
    this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public StageBody bodyFor(SetupStage stage) {
    return switch (stage) {
      case VALIDATE_PREREQUISITES -> ctx -> validatePrerequisites(ctx);
      case DETECT_CHANGES -> ctx -> ChangeSummary.of(collaborators.stateManager().detectChanges());
      case PROCESS_IMAGES -> ctx -> processing(stage, ctx, collaborators.imageProcessor()::processImages);
      case SEED_DATABASE -> ctx -> processing(stage, ctx, collaborators.databaseSeeder()::seedAll);
      case SYNC_FRONTEND -> ctx -> processing(stage, ctx, collaborators.frontendSyncProcessor()::syncMockData);
      case VALIDATE_DATA -> ctx -> validateData(ctx);
      case UPDATE_STATE -> ctx -> updateState();
    };
  }

  /** A registry holding every setup stage, with {@code settings}' stage overrides applied. */
  public StageRegistry registry(PipelineSettings settings) {
    for (String name : settings.stageOverrides().keySet()) {
      if (!SetupStage.ids().contains(name)) log.warn("Ignoring settings override for unknown stage '{}'", name);
    }
    StageRegistry registry = new StageRegistry();
    for (SetupStage stage : SetupStage.values()) {
      registry.register(settings.applyTo(stage.definition()), bodyFor(stage));
    }
    return registry;
  }

  private PrerequisiteReport validatePrerequisites(StageContext ctx) throws Exception {
    PrerequisiteReport report = PrerequisiteReport.of(collaborators.prerequisiteChecker().check());
    if (report.allPassed()) return report;
    List<String> down = new ArrayList<>();
    report.checks().forEach((service, ok) -> {
      if (!Boolean.TRUE.equals(ok)) down.add(service);
    });
    if (ctx.flag(OperationType.STRICT_VALIDATION_OPTION)) {
      throw new CollaboratorException("EPREREQ", "Prerequisite services unavailable: " + String.join(", ", down));
    }
    log.warn("Prerequisite services unavailable: {}", down);
    return report;
  }

  private Object processing(SetupStage stage, StageContext ctx, ThrowingFn<CollaboratorRequest, Object> call)
      throws Exception {
    if (shouldSkip(stage, ctx)) {
      log.info("Skipping {}: no relevant changes detected", stage.id());
      return new SkippedStage(stage.id(), "no relevant changes detected");
    }
    return call.apply(new CollaboratorRequest(ctx.options(), ctx::reportProgress));
  }

  // only incremental runs skip, and only when change detection ran and found nothing relevant
  private static boolean shouldSkip(SetupStage stage, StageContext ctx) {
    if (!OperationType.INCREMENTAL.id().equals(ctx.operationType())) return false;
    if (ctx.flag(OperationType.FORCE_ALL_OPTION)) return false;
    return ctx.upstreamResult(SetupStage.DETECT_CHANGES.id(), ChangeSummary.class)
        .map(changes -> relevantChanges(stage, changes) == 0)
        .orElse(false);
  }

  private static int relevantChanges(SetupStage stage, ChangeSummary changes) {
    return stage == SetupStage.PROCESS_IMAGES ? changes.imageChanges() : changes.dataChanges();
  }

  private DataValidationReport validateData(StageContext ctx) throws Exception {
    DataValidationReport report = Objects.requireNonNull(collaborators.dataValidator().validate(), "validate()");
    if (report.valid()) return report;
    if (ctx.flag(OperationType.STRICT_VALIDATION_OPTION)) {
      throw new CollaboratorException("EVALIDATION", "Data validation failed: " + String.join(", ", report.failedChecks()));
    }
    log.warn("Data validation failed checks: {}", report.failedChecks());
    return report;
  }

  private StateUpdate updateState() throws Exception {
    collaborators.stateManager().saveCurrentState();
    return new StateUpdate(true, clock.instant());
  }
}
