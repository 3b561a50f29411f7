package com.datapipeline.setup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record PrerequisiteReport(Map<String, Boolean> checks, boolean allPassed) {
  public PrerequisiteReport {
    checks = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(checks, "checks")));
  }

  static PrerequisiteReport of(Map<String, Boolean> checks) {
    boolean all = true;
    for (Boolean ok : checks.values()) all &= Boolean.TRUE.equals(ok);
    return new PrerequisiteReport(checks, all);
  }
}
