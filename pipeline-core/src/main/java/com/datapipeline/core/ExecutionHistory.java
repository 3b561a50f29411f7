package com.datapipeline.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Append-only log of finished executions. With a capacity, the oldest entries are evicted first. */
public final class ExecutionHistory {
  public static final int UNBOUNDED = 0;

  private final int capacity;
  private final Deque<ExecutionSnapshot> entries = new ArrayDeque<>();

  public ExecutionHistory() {
    this(UNBOUNDED);
  }

  public ExecutionHistory(int capacity) {
    if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
    this.capacity = capacity;
  }

  public synchronized void append(ExecutionSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    if (snapshot.status() == ExecutionStatus.RUNNING) {
      throw new IllegalArgumentException("Only finished executions belong in history: " + snapshot.id());
    }
    entries.addLast(snapshot);
    if (capacity > 0) {
      while (entries.size() > capacity) entries.removeFirst();
    }
  }

  public synchronized List<ExecutionSnapshot> entries() {
    return List.copyOf(entries);
  }

  public synchronized Optional<ExecutionSnapshot> latest() {
    return Optional.ofNullable(entries.peekLast());
  }

  public synchronized int size() {
    return entries.size();
  }
}
