package com.venuelink.autoconfigure;

import com.venuelink.adapter.core.ConnectionState;
import com.venuelink.adapter.core.ExchangeAdapter;
import java.time.Instant;
import java.util.Objects;

public record AdapterInstance(
    String instanceId,
    String venueId,
    ExchangeAdapter adapter,
    VenueMetadata metadata,
    Instant createdAt) {
  public AdapterInstance {
    Objects.requireNonNull(instanceId, "instanceId must not be null");
    Objects.requireNonNull(adapter, "adapter must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public ConnectionState connectionState() {
    return adapter.connectionState();
  }
}
