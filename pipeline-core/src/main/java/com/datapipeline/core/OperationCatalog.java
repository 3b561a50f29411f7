package com.datapipeline.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Maps operation-type identifiers to the stages they require. */
public final class OperationCatalog {
  private final Map<String, StageSelector> operations;

  private OperationCatalog(Map<String, StageSelector> operations) {
    this.operations = operations;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> operationTypes() {
    return List.copyOf(operations.keySet());
  }

  public boolean has(String operationType) {
    return operations.containsKey(operationType);
  }

  public List<String> stagesFor(String operationType, Map<String, Object> options) {
    StageSelector selector = operationType == null ? null : operations.get(operationType);
    if (selector == null) throw new UnknownOperationTypeException(operationType);
    return List.copyOf(Objects.requireNonNull(selector.select(options), "selector.select()"));
  }

  public static final class Builder {
    private final Map<String, StageSelector> operations = new LinkedHashMap<>();

    public Builder operation(String operationType, StageSelector selector) {
      Objects.requireNonNull(operationType, "operationType");
      Objects.requireNonNull(selector, "selector");
      if (operations.putIfAbsent(operationType, selector) != null) {
        throw new IllegalArgumentException("Operation already defined: " + operationType);
      }
      return this;
    }

    public Builder operation(String operationType, String... stageNames) {
      return operation(operationType, StageSelector.fixed(stageNames));
    }

    public OperationCatalog build() {
      return new OperationCatalog(new LinkedHashMap<>(operations));
    }
  }
}
