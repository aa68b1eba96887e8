package com.venuelink.adapter.core.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AdapterEventBus {
  private static final Logger log = LoggerFactory.getLogger(AdapterEventBus.class);

  private final String venue;
  private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();

  public AdapterEventBus(String venue) {
    this.venue = Objects.requireNonNull(venue, "venue must not be null");
  }

  public <E extends AdapterEvent> Subscription subscribe(
      Class<E> eventType, Consumer<? super E> listener) {
    Registration<E> registration =
        new Registration<>(
            Objects.requireNonNull(eventType, "eventType must not be null"),
            Objects.requireNonNull(listener, "listener must not be null"));
    registrations.add(registration);
    return registration;
  }

  public Subscription subscribeAll(Consumer<? super AdapterEvent> listener) {
    return subscribe(AdapterEvent.class, listener);
  }

  public void publish(AdapterEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    for (Registration<?> registration : registrations) {
      registration.deliver(event);
    }
  }

  public int subscriberCount() {
    return registrations.size();
  }

  public void clear() {
    for (Registration<?> registration : registrations) {
      registration.unsubscribe();
    }
  }

  private final class Registration<E extends AdapterEvent> implements Subscription {
    private final Class<E> eventType;
    private final Consumer<? super E> listener;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private Registration(Class<E> eventType, Consumer<? super E> listener) {
      this.eventType = eventType;
      this.listener = listener;
    }

    private void deliver(AdapterEvent event) {
      if (!active.get() || !eventType.isInstance(event)) {
        return;
      }
      try {
        listener.accept(eventType.cast(event));
      } catch (RuntimeException ex) {
        log.warn(
            "Event listener failed venue={} event_kind={}", venue, event.kind().code(), ex);
      }
    }

    @Override
    public void unsubscribe() {
      if (active.compareAndSet(true, false)) {
        registrations.remove(this);
      }
    }

    @Override
    public boolean isActive() {
      return active.get();
    }
  }
}
