package com.venuelink.testsupport;

import com.venuelink.adapter.core.event.AdapterEvent;
import com.venuelink.adapter.core.event.AdapterEventBus;
import com.venuelink.adapter.core.event.Subscription;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** Captures every event published on an adapter bus and lets tests block until one arrives. */
public final class EventRecorder implements AutoCloseable {
  private final List<AdapterEvent> events = new ArrayList<>();
  private final Subscription subscription;

  private EventRecorder(AdapterEventBus bus) {
    this.subscription = bus.subscribeAll(this::record);
  }

  public static EventRecorder attach(AdapterEventBus bus) {
    return new EventRecorder(bus);
  }

  public synchronized List<AdapterEvent> events() {
    return List.copyOf(events);
  }

  public synchronized <E extends AdapterEvent> List<E> eventsOf(Class<E> type) {
    List<E> matches = new ArrayList<>();
    for (AdapterEvent event : events) {
      if (type.isInstance(event)) {
        matches.add(type.cast(event));
      }
    }
    return matches;
  }

  public <E extends AdapterEvent> E awaitFirst(Class<E> type, Duration timeout) {
    return await(type, event -> true, timeout);
  }

  public synchronized <E extends AdapterEvent> E await(
      Class<E> type, Predicate<? super E> condition, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      for (AdapterEvent event : events) {
        if (type.isInstance(event) && condition.test(type.cast(event))) {
          return type.cast(event);
        }
      }
      long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
      if (remainingMs <= 0) {
        throw new AssertionError(
            "No " + type.getSimpleName() + " event within " + timeout + ", saw " + events);
      }
      try {
        wait(remainingMs);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new AssertionError("Interrupted while waiting for " + type.getSimpleName(), ex);
      }
    }
  }

  public synchronized <E extends AdapterEvent> List<E> awaitCount(
      Class<E> type, int count, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      List<E> matches = eventsOf(type);
      if (matches.size() >= count) {
        return matches;
      }
      long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
      if (remainingMs <= 0) {
        throw new AssertionError(
            "Expected " + count + " " + type.getSimpleName() + " events, saw " + matches.size());
      }
      try {
        wait(remainingMs);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new AssertionError("Interrupted while waiting for " + type.getSimpleName(), ex);
      }
    }
  }

  public synchronized void clear() {
    events.clear();
  }

  @Override
  public void close() {
    subscription.unsubscribe();
  }

  private synchronized void record(AdapterEvent event) {
    events.add(event);
    notifyAll();
  }
}
