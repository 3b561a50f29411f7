package com.datapipeline.setup;

import com.datapipeline.setup.collaborator.DataValidationReport;
import com.datapipeline.setup.collaborator.DataValidator;
import com.datapipeline.setup.collaborator.DatabaseSeeder;
import com.datapipeline.setup.collaborator.FrontendSyncProcessor;
import com.datapipeline.setup.collaborator.ImageProcessor;
import com.datapipeline.setup.collaborator.PrerequisiteChecker;
import com.datapipeline.setup.collaborator.StateManager;

import java.util.Map;
import java.util.Objects;

/** The external services the setup stages call. */
public record SetupCollaborators(
    ImageProcessor imageProcessor,
    DatabaseSeeder databaseSeeder,
    FrontendSyncProcessor frontendSyncProcessor,
    StateManager stateManager,
    PrerequisiteChecker prerequisiteChecker,
    DataValidator dataValidator
) {
  /** Used when no checker is configured: reports the four local services as reachable. */
  public static final PrerequisiteChecker ASSUME_SERVICES_UP =
      () -> Map.of("localstack", true, "dynamodb", true, "opensearch", true, "s3", true);

  /** Used when no validator is configured: a report with no checks, which is valid. */
  public static final DataValidator NO_VALIDATION = () -> DataValidationReport.of(Map.of());

  public SetupCollaborators {
    Objects.requireNonNull(imageProcessor, "imageProcessor");
    Objects.requireNonNull(databaseSeeder, "databaseSeeder");
    Objects.requireNonNull(frontendSyncProcessor, "frontendSyncProcessor");
    Objects.requireNonNull(stateManager, "stateManager");
    Objects.requireNonNull(prerequisiteChecker, "prerequisiteChecker");
    Objects.requireNonNull(dataValidator, "dataValidator");
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private ImageProcessor imageProcessor;
    private DatabaseSeeder databaseSeeder;
    private FrontendSyncProcessor frontendSyncProcessor;
    private StateManager stateManager;
    private PrerequisiteChecker prerequisiteChecker = ASSUME_SERVICES_UP;
    private DataValidator dataValidator = NO_VALIDATION;

    private Builder() {}

    public Builder imageProcessor(ImageProcessor p) { this.imageProcessor = p; return this; }
    public Builder databaseSeeder(DatabaseSeeder s) { this.databaseSeeder = s; return this; }
    public Builder frontendSyncProcessor(FrontendSyncProcessor p) { this.frontendSyncProcessor = p; return this; }
    public Builder stateManager(StateManager m) { this.stateManager = m; return this; }
    public Builder prerequisiteChecker(PrerequisiteChecker c) { this.prerequisiteChecker = c; return this; }
    public Builder dataValidator(DataValidator v) { this.dataValidator = v; return this; }

    public SetupCollaborators build() {
      return new SetupCollaborators(imageProcessor, databaseSeeder, frontendSyncProcessor, stateManager,
          prerequisiteChecker, dataValidator);
    }
  }
}
