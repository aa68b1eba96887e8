package com.venuelink.autoconfigure;

import com.venuelink.adapter.core.AdapterCapability;
import java.util.List;
import java.util.Set;

/**
 * Describes a registered venue before any adapter for it exists.
 *
 * @param requiredCredentials names of the secrets the venue needs for private calls
 */
public record VenueMetadata(
    String venueId,
    String name,
    String description,
    Set<AdapterCapability> capabilities,
    List<String> requiredCredentials,
    boolean sandbox,
    boolean testMode) {
  public VenueMetadata {
    if (venueId == null || venueId.isBlank()) {
      throw new IllegalArgumentException("venueId is required");
    }
    name = name == null || name.isBlank() ? venueId : name;
    description = description == null ? "" : description;
    capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    requiredCredentials =
        requiredCredentials == null ? List.of() : List.copyOf(requiredCredentials);
  }
}
