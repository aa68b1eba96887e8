package com.venuelink.autoconfigure;

import com.venuelink.adapter.core.ExchangeAdapter;
import com.venuelink.adapter.core.HealthStatus;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Venue factories by id and the adapter instances created from them. Closing the registry
 * disconnects every live instance.
 */
public class ExchangeAdapterRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ExchangeAdapterRegistry.class);

  private final Clock clock;
  private final Map<String, Registration> registrations = new LinkedHashMap<>();
  private final Map<String, AdapterInstance> instances = new LinkedHashMap<>();
  private final AtomicLong instanceSequence = new AtomicLong(0L);

  public ExchangeAdapterRegistry(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public synchronized void register(
      String venueId, ExchangeAdapterFactory factory, VenueMetadata metadata) {
    Objects.requireNonNull(factory, "factory must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
    if (venueId == null || venueId.isBlank()) {
      throw new IllegalArgumentException("venueId is required");
    }
    if (!venueId.equals(metadata.venueId())) {
      throw new IllegalArgumentException(
          "metadata describes " + metadata.venueId() + ", not " + venueId);
    }
    if (registrations.containsKey(venueId)) {
      throw new IllegalStateException("Venue " + venueId + " is already registered");
    }
    registrations.put(venueId, new Registration(factory, metadata));
    log.info(
        "Registered venue adapter venue={} capabilities={}", venueId, metadata.capabilities());
  }

  /** Builds a new adapter for {@code venueId} and returns the id it is tracked under. */
  public String create(String venueId) {
    Registration registration;
    synchronized (this) {
      registration = registrations.get(venueId);
    }
    if (registration == null) {
      throw new IllegalArgumentException("Venue " + venueId + " is not registered");
    }
    ExchangeAdapter adapter = registration.factory().create();
    if (adapter == null || !venueId.equals(adapter.venueId())) {
      throw new IllegalStateException(
          "Factory for " + venueId + " produced " + (adapter == null ? null : adapter.venueId()));
    }
    String instanceId = venueId + "-" + instanceSequence.incrementAndGet();
    synchronized (this) {
      instances.put(
          instanceId,
          new AdapterInstance(
              instanceId, venueId, adapter, registration.metadata(), clock.instant()));
    }
    log.info("Created venue adapter venue={} instance_id={}", venueId, instanceId);
    return instanceId;
  }

  public synchronized ExchangeAdapter get(String instanceId) {
    return instance(instanceId).adapter();
  }

  /** Disconnects the instance and forgets it. */
  public void destroy(String instanceId) {
    AdapterInstance removed;
    synchronized (this) {
      removed = instance(instanceId);
      instances.remove(instanceId);
    }
    removed.adapter().disconnect();
    log.info("Destroyed venue adapter venue={} instance_id={}", removed.venueId(), instanceId);
  }

  public HealthStatus health(String instanceId) {
    return get(instanceId).healthCheck();
  }

  public synchronized Optional<VenueMetadata> metadata(String venueId) {
    Registration registration = registrations.get(venueId);
    return registration == null ? Optional.empty() : Optional.of(registration.metadata());
  }

  public synchronized List<VenueMetadata> registeredVenues() {
    List<VenueMetadata> venues = new ArrayList<>();
    registrations.values().forEach(registration -> venues.add(registration.metadata()));
    return List.copyOf(venues);
  }

  public synchronized List<AdapterInstance> activeInstances() {
    return List.copyOf(instances.values());
  }

  @Override
  public void close() {
    List<String> ids;
    synchronized (this) {
      ids = new ArrayList<>(instances.keySet());
    }
    for (String instanceId : ids) {
      try {
        destroy(instanceId);
      } catch (RuntimeException ex) {
        log.warn("Failed to destroy venue adapter instance_id={}", instanceId, ex);
      }
    }
  }

  private AdapterInstance instance(String instanceId) {
    AdapterInstance instance = instances.get(instanceId);
    if (instance == null) {
      throw new IllegalArgumentException("Adapter instance " + instanceId + " not found");
    }
    return instance;
  }

  private record Registration(ExchangeAdapterFactory factory, VenueMetadata metadata) {}
}
