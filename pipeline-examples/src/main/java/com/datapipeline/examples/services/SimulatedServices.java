package com.datapipeline.examples.services;

import com.datapipeline.core.error.CollaboratorException;
import com.datapipeline.setup.SetupCollaborators;
import com.datapipeline.setup.collaborator.ChangeSet;
import com.datapipeline.setup.collaborator.CollaboratorRequest;
import com.datapipeline.setup.collaborator.DataValidationReport;
import com.datapipeline.setup.collaborator.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Stand-ins for the local services, so the examples run without containers. */
public final class SimulatedServices {
  private static final Logger log = LoggerFactory.getLogger(SimulatedServices.class);

  private SimulatedServices() {}

  public static SetupCollaborators healthy(ChangeSet changes) {
    return SetupCollaborators.builder()
        .imageProcessor(SimulatedServices::processImages)
        .databaseSeeder(req -> {
          int count = ((Number) req.options().getOrDefault("count", 25)).intValue();
          pause(40);
          return Map.of("tables", 4, "items", count);
        })
        .frontendSyncProcessor(req -> {
          pause(20);
          return Map.of("scenario", req.options().getOrDefault("scenario", "default"), "studios", 6);
        })
        .stateManager(new InMemoryState(changes))
        .dataValidator(() -> DataValidationReport.of(Map.of(
            "dynamodb", new DataValidationReport.Check(true, 25),
            "opensearch", new DataValidationReport.Check(true, 25),
            "s3", new DataValidationReport.Check(true, 12))))
        .build();
  }

  /** Image uploads fail with a connection error the first {@code failures} times they are called. */
  public static SetupCollaborators flakyImages(ChangeSet changes, int failures) {
    AtomicInteger left = new AtomicInteger(failures);
    SetupCollaborators base = healthy(changes);
    return SetupCollaborators.builder()
        .imageProcessor(req -> {
          if (left.getAndDecrement() > 0) {
            throw new CollaboratorException("ECONNREFUSED", "connect ECONNREFUSED 127.0.0.1:4566");
          }
          return processImages(req);
        })
        .databaseSeeder(base.databaseSeeder())
        .frontendSyncProcessor(base.frontendSyncProcessor())
        .stateManager(base.stateManager())
        .dataValidator(base.dataValidator())
        .build();
  }

  private static Object processImages(CollaboratorRequest req) {
    int total = 4;
    for (int i = 1; i <= total; i++) {
      pause(10);
      req.reportProgress(i * 100 / total, "uploaded " + i + "/" + total);
    }
    return Map.of("processed", total, "bucket", "local-images");
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted", e);
    }
  }

  private static final class InMemoryState implements StateManager {
    private final ChangeSet changes;
    private final Map<String, Object> saved = new LinkedHashMap<>();

    private InMemoryState(ChangeSet changes) {
      this.changes = changes;
    }

    @Override
    public ChangeSet detectChanges() {
      return saved.isEmpty() ? changes : ChangeSet.of(List.of(), List.of(), List.of());
    }

    @Override
    public synchronized void saveCurrentState() {
      saved.put("lastRun", System.currentTimeMillis());
      log.debug("state saved: {}", saved);
    }
  }
}
