package com.datapipeline.setup;

import java.time.Instant;
import java.util.Objects;

public record StateUpdate(boolean stateUpdated, Instant timestamp) {
  public StateUpdate {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }
}
