package com.datapipeline.setup.collaborator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Outcome of checking the seeded stores; {@code valid} holds only when every check passed. */
public record DataValidationReport(boolean valid, Map<String, Check> checks) {
  public DataValidationReport {
    checks = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(checks, "checks")));
  }

  public static DataValidationReport of(Map<String, Check> checks) {
    boolean valid = true;
    for (Check c : checks.values()) valid &= c.valid();
    return new DataValidationReport(valid, checks);
  }

  public List<String> failedChecks() {
    List<String> out = new ArrayList<>();
    checks.forEach((name, c) -> {
      if (!c.valid()) out.add(name);
    });
    return out;
  }

  public record Check(boolean valid, long itemCount) { }
}
