package com.datapipeline.setup;

import java.util.Objects;

/** Returned instead of a collaborator result when an incremental run finds nothing for the stage to do. */
public record SkippedStage(String stage, String reason) {
  public SkippedStage {
    stage = Objects.requireNonNull(stage, "stage");
    reason = Objects.requireNonNull(reason, "reason");
  }
}
