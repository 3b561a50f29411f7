package com.datapipeline.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a pipeline stage. Dependencies name other registered stages.
 * A {@code timeoutMs} of {@link #NO_TIMEOUT} means no hint was given; the value is only used to
 * estimate pipeline duration and never cancels a running stage.
 */
public record StageDefinition(
    String name,
    String description,
    List<String> dependencies,
    boolean parallel,
    boolean critical,
    long timeoutMs
) {
  public static final long NO_TIMEOUT = 0L;

  public StageDefinition {
    name = Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
    description = description == null ? "" : description;
    dependencies = List.copyOf(new LinkedHashSet<>(Objects.requireNonNull(dependencies, "dependencies")));
    if (dependencies.contains(name)) throw new IllegalArgumentException("Stage depends on itself: " + name);
    if (timeoutMs < 0) throw new IllegalArgumentException("timeoutMs must be >= 0");
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public boolean hasTimeout() {
    return timeoutMs > NO_TIMEOUT;
  }

  public long timeoutOr(long defaultTimeoutMs) {
    return hasTimeout() ? timeoutMs : defaultTimeoutMs;
  }

  public StageDefinition withTimeoutMs(long newTimeoutMs) {
    return new StageDefinition(name, description, dependencies, parallel, critical, newTimeoutMs);
  }

  public StageDefinition withCritical(boolean newCritical) {
    return new StageDefinition(name, description, dependencies, parallel, newCritical, timeoutMs);
  }

  public static final class Builder {
    private final String name;
    private String description = "";
    private final List<String> dependencies = new ArrayList<>();
    private boolean parallel = false;
    private boolean critical = true;
    private long timeoutMs = NO_TIMEOUT;

    private Builder(String name) { this.name = name; }

    public Builder description(String d) { this.description = d; return this; }

    public Builder dependsOn(String... names) {
      for (String n : names) dependencies.add(Objects.requireNonNull(n, "dependency"));
      return this;
    }

    public Builder dependsOn(List<String> names) {
      for (String n : names) dependencies.add(Objects.requireNonNull(n, "dependency"));
      return this;
    }

    public Builder parallel(boolean b) { this.parallel = b; return this; }
    public Builder critical(boolean b) { this.critical = b; return this; }
    public Builder timeoutMs(long ms) { this.timeoutMs = ms; return this; }

    public StageDefinition build() {
      return new StageDefinition(name, description, dependencies, parallel, critical, timeoutMs);
    }
  }
}
