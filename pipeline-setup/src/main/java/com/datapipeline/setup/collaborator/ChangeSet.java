package com.datapipeline.setup.collaborator;

import java.util.List;
import java.util.Objects;

/** Paths that changed since the last saved state, grouped by kind. */
public record ChangeSet(boolean hasChanges, List<String> images, List<String> data, List<String> config) {
  public static final ChangeSet NONE = new ChangeSet(false, List.of(), List.of(), List.of());

  public ChangeSet {
    images = List.copyOf(Objects.requireNonNull(images, "images"));
    data = List.copyOf(Objects.requireNonNull(data, "data"));
    config = List.copyOf(Objects.requireNonNull(config, "config"));
  }

  public static ChangeSet of(List<String> images, List<String> data, List<String> config) {
    return new ChangeSet(!images.isEmpty() || !data.isEmpty() || !config.isEmpty(), images, data, config);
  }
}
