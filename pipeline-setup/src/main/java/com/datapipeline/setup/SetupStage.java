package com.datapipeline.setup;

import com.datapipeline.core.StageDefinition;
import com.datapipeline.core.UnknownStageException;

import java.util.ArrayList;
import java.util.List;

/** The stages of a local environment setup, in registration order. */
public enum SetupStage {
  VALIDATE_PREREQUISITES("validate-prerequisites", "Validate prerequisites and service availability",
      List.of(), false, true, 30_000L),
  DETECT_CHANGES("detect-changes", "Detect changes since last run",
      List.of("validate-prerequisites"), false, true, 10_000L),
  PROCESS_IMAGES("process-images", "Process and upload images",
      List.of("detect-changes"), true, false, 300_000L),
  SEED_DATABASE("seed-database", "Seed database with test data",
      List.of("detect-changes"), true, true, 180_000L),
  SYNC_FRONTEND("sync-frontend", "Generate frontend mock data",
      List.of("detect-changes"), true, false, 30_000L),
  VALIDATE_DATA("validate-data", "Validate data consistency",
      List.of("detect-changes"), false, true, 60_000L),
  UPDATE_STATE("update-state", "Update state tracking",
      List.of("validate-data"), false, true, 10_000L);

  private final String id;
  private final StageDefinition definition;

  SetupStage(String id, String description, List<String> dependencies, boolean parallel, boolean critical,
             long timeoutMs) {
    this.id = id;
    this.definition = new StageDefinition(id, description, dependencies, parallel, critical, timeoutMs);
  }

  public String id() {
    return id;
  }

  public StageDefinition definition() {
    return definition;
  }

  /** The stages that call out to a processing collaborator. */
  public boolean isProcessing() {
    return this == PROCESS_IMAGES || this == SEED_DATABASE || this == SYNC_FRONTEND;
  }

  public static SetupStage fromId(String id) {
    for (SetupStage s : values()) {
      if (s.id.equals(id)) return s;
    }
    throw new UnknownStageException(String.valueOf(id));
  }

  public static List<String> ids() {
    List<String> out = new ArrayList<>();
    for (SetupStage s : values()) out.add(s.id);
    return out;
  }
}
