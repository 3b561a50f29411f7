package com.datapipeline.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Where an error happened and what may be done about it: an optional recovery {@code operation}
 * (re-invoked according to the classified strategy) and optional {@code fallbackData} used by
 * wrapped functions when nothing else succeeds.
 */
public final class ErrorContext<T> {
  private final String stage;
  private final Map<String, Object> attributes;
  private final Callable<T> operation;
  private final T fallbackData;

  private ErrorContext(String stage, Map<String, Object> attributes, Callable<T> operation, T fallbackData) {
    this.stage = stage;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.operation = operation;
    this.fallbackData = fallbackData;
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  public static <T> ErrorContext<T> empty() {
    return new Builder<T>().build();
  }

  public static <T> ErrorContext<T> forStage(String stage) {
    return new Builder<T>().stage(stage).build();
  }

  public String stage() { return stage; }
  public Map<String, Object> attributes() { return attributes; }
  public Callable<T> operation() { return operation; }
  public T fallbackData() { return fallbackData; }
  public boolean hasOperation() { return operation != null; }
  public boolean hasFallback() { return fallbackData != null; }

  public ErrorContext<T> withOperation(Callable<T> newOperation) {
    return new ErrorContext<>(stage, attributes, Objects.requireNonNull(newOperation, "operation"), fallbackData);
  }

  /** Stage plus attributes, as recorded in the error log. */
  public Map<String, Object> describe() {
    Map<String, Object> out = new LinkedHashMap<>();
    if (stage != null) out.put("stage", stage);
    out.putAll(attributes);
    return out;
  }

  public static final class Builder<T> {
    private String stage;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private Callable<T> operation;
    private T fallbackData;

    private Builder() {}

    public Builder<T> stage(String s) { this.stage = s; return this; }

    public Builder<T> attribute(String key, Object value) {
      attributes.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder<T> operation(Callable<T> op) { this.operation = op; return this; }
    public Builder<T> fallbackData(T data) { this.fallbackData = data; return this; }

    public ErrorContext<T> build() {
      return new ErrorContext<>(stage, attributes, operation, fallbackData);
    }
  }
}
