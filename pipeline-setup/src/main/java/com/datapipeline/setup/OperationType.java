package com.datapipeline.setup;

import com.datapipeline.core.OperationCatalog;
import com.datapipeline.core.StageSelector;
import com.datapipeline.core.UnknownOperationTypeException;
import com.datapipeline.core.UnknownStageException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.datapipeline.setup.SetupStage.DETECT_CHANGES;
import static com.datapipeline.setup.SetupStage.PROCESS_IMAGES;
import static com.datapipeline.setup.SetupStage.SEED_DATABASE;
import static com.datapipeline.setup.SetupStage.SYNC_FRONTEND;
import static com.datapipeline.setup.SetupStage.UPDATE_STATE;
import static com.datapipeline.setup.SetupStage.VALIDATE_DATA;
import static com.datapipeline.setup.SetupStage.VALIDATE_PREREQUISITES;

/**
 * Named presets of setup stages. Every operation is bracketed by prerequisite validation, change
 * detection, data validation and the state update; they differ in the processing stages they add.
 */
public enum OperationType {
  FULL_SETUP("full-setup"),
  IMAGES_ONLY("images-only"),
  DATABASE_ONLY("database-only"),
  FRONTEND_ONLY("frontend-only"),
  INCREMENTAL("incremental"),
  VALIDATION_ONLY("validation-only");

  /** Option naming the processing stages an incremental run may touch: a collection or a comma-separated string. */
  public static final String STAGES_OPTION = "stages";

  /** Option that makes an incremental run process everything, changed or not. */
  public static final String FORCE_ALL_OPTION = "forceAll";

  /**
   * Option that turns a failed prerequisite check or an invalid data report into a stage failure
   * instead of a result carrying {@code allPassed=false} or {@code valid=false}.
   */
  public static final String STRICT_VALIDATION_OPTION = "strictValidation";

  private final String id;

  OperationType(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static OperationType fromId(String id) {
    for (OperationType t : values()) {
      if (t.id.equals(id)) return t;
    }
    throw new UnknownOperationTypeException(id);
  }

  public static List<String> ids() {
    List<String> out = new ArrayList<>();
    for (OperationType t : values()) out.add(t.id);
    return out;
  }

  public StageSelector selector() {
    return switch (this) {
      case FULL_SETUP -> options -> bracketed(List.of(PROCESS_IMAGES, SEED_DATABASE, SYNC_FRONTEND));
      case IMAGES_ONLY -> options -> bracketed(List.of(PROCESS_IMAGES));
      case DATABASE_ONLY -> options -> bracketed(List.of(SEED_DATABASE));
      case FRONTEND_ONLY -> options -> bracketed(List.of(SYNC_FRONTEND));
      case INCREMENTAL -> options -> bracketed(incrementalStages(options));
      case VALIDATION_ONLY -> options -> bracketed(List.of());
    };
  }

  /** A catalog holding every operation type. */
  public static OperationCatalog catalog() {
    OperationCatalog.Builder b = OperationCatalog.builder();
    for (OperationType t : values()) b.operation(t.id, t.selector());
    return b.build();
  }

  private static List<String> bracketed(List<SetupStage> processing) {
    List<String> out = new ArrayList<>();
    out.add(VALIDATE_PREREQUISITES.id());
    out.add(DETECT_CHANGES.id());
    for (SetupStage s : processing) out.add(s.id());
    out.add(VALIDATE_DATA.id());
    out.add(UPDATE_STATE.id());
    return out;
  }

  private static List<SetupStage> incrementalStages(Map<String, Object> options) {
    Object requested = options.get(STAGES_OPTION);
    if (requested == null) return List.of(PROCESS_IMAGES, SEED_DATABASE, SYNC_FRONTEND);

    List<String> names = new ArrayList<>();
    if (requested instanceof Collection<?> c) {
      for (Object o : c) names.add(String.valueOf(o).trim());
    } else {
      for (String s : requested.toString().split(",")) {
        if (!s.isBlank()) names.add(s.trim());
      }
    }

    List<SetupStage> out = new ArrayList<>();
    for (String name : names) {
      SetupStage stage = SetupStage.fromId(name);
      if (!stage.isProcessing()) throw new UnknownStageException(name, INCREMENTAL.id + " " + STAGES_OPTION + " option");
      if (!out.contains(stage)) out.add(stage);
    }
    return out;
  }
}
