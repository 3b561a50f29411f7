package com.datapipeline.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Publish/subscribe channel for {@link PipelineEvent}s. Stages of a parallel group publish from
 * worker threads, so listeners must be thread-safe. A failing listener is logged and skipped; the
 * remaining listeners still receive the event.
 */
public final class PipelineEventBus {
  private static final Logger log = LoggerFactory.getLogger(PipelineEventBus.class);

  private final Map<PipelineEventType, List<PipelineEventListener>> byType = new EnumMap<>(PipelineEventType.class);
  private final List<PipelineEventListener> catchAll = new CopyOnWriteArrayList<>();

  public PipelineEventBus() {
    for (PipelineEventType t : PipelineEventType.values()) {
      byType.put(t, new CopyOnWriteArrayList<>());
    }
  }

  public Subscription subscribe(PipelineEventType type, PipelineEventListener listener) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(listener, "listener");
    List<PipelineEventListener> listeners = byType.get(type);
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  /** Typed convenience: subscribes to the event type carried by {@code eventClass}. */
  public <E extends PipelineEvent> Subscription on(PipelineEventType type, Class<E> eventClass, Consumer<? super E> handler) {
    Objects.requireNonNull(eventClass, "eventClass");
    Objects.requireNonNull(handler, "handler");
    return subscribe(type, event -> {
      if (eventClass.isInstance(event)) handler.accept(eventClass.cast(event));
    });
  }

  public Subscription subscribeAll(PipelineEventListener listener) {
    Objects.requireNonNull(listener, "listener");
    catchAll.add(listener);
    return () -> catchAll.remove(listener);
  }

  public void publish(PipelineEvent event) {
    Objects.requireNonNull(event, "event");
    log.debug("event {}", event.type().wireName());
    deliver(byType.get(event.type()), event);
    deliver(catchAll, event);
  }

  private static void deliver(List<PipelineEventListener> listeners, PipelineEvent event) {
    for (PipelineEventListener l : listeners) {
      try {
        l.onEvent(event);
      } catch (RuntimeException e) {
        log.error("Listener {} failed on {}", l.getClass().getName(), event.type().wireName(), e);
      }
    }
  }

  @FunctionalInterface
  public interface Subscription {
    void cancel();
  }
}
