package com.datapipeline.setup;

import com.datapipeline.setup.collaborator.ChangeSet;

import java.util.Objects;

/** Result of {@code detect-changes}: counts per kind plus the raw change set. */
public record ChangeSummary(boolean hasChanges, int imageChanges, int dataChanges, int configChanges, ChangeSet details) {
  public ChangeSummary {
    details = Objects.requireNonNull(details, "details");
  }

  static ChangeSummary of(ChangeSet changes) {
    return new ChangeSummary(changes.hasChanges(), changes.images().size(), changes.data().size(),
        changes.config().size(), changes);
  }
}
