package com.venuelink.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.venuelink.adapter.core.AdapterCapability;
import com.venuelink.adapter.core.ConnectionState;
import com.venuelink.adapter.core.ExchangeAdapter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExchangeAdapterRegistryTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private ExchangeAdapterRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ExchangeAdapterRegistry(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void shouldCreateTrackAndDestroyInstances() {
    ExchangeAdapter first = adapter("mock");
    ExchangeAdapter second = adapter("mock");
    List<ExchangeAdapter> produced = new ArrayList<>(List.of(first, second));
    registry.register("mock", () -> produced.remove(0), metadata("mock"));

    String firstId = registry.create("mock");
    String secondId = registry.create("mock");

    assertThat(firstId).isEqualTo("mock-1");
    assertThat(secondId).isEqualTo("mock-2");
    assertThat(registry.get(firstId)).isSameAs(first);
    assertThat(registry.activeInstances())
        .extracting(AdapterInstance::instanceId, AdapterInstance::createdAt)
        .containsExactly(
            tuple(firstId, NOW),
            tuple(secondId, NOW));

    registry.destroy(firstId);

    verify(first).disconnect();
    verify(second, never()).disconnect();
    assertThatThrownBy(() -> registry.get(firstId))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(firstId);
  }

  @Test
  void shouldReportConnectionStateOfInstances() {
    ExchangeAdapter adapter = adapter("gemini");
    when(adapter.connectionState()).thenReturn(ConnectionState.AUTHENTICATED);
    registry.register("gemini", () -> adapter, metadata("gemini"));

    registry.create("gemini");

    assertThat(registry.activeInstances())
        .singleElement()
        .extracting(AdapterInstance::connectionState)
        .isEqualTo(ConnectionState.AUTHENTICATED);
  }

  @Test
  void shouldRejectUnknownVenuesAndInstances() {
    assertThatThrownBy(() -> registry.create("kraken"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("kraken");
    assertThatThrownBy(() -> registry.destroy("kraken-1"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(registry.metadata("kraken")).isEmpty();
  }

  @Test
  void shouldRejectDuplicateRegistration() {
    registry.register("mock", () -> adapter("mock"), metadata("mock"));

    assertThatThrownBy(() -> registry.register("mock", () -> adapter("mock"), metadata("mock")))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldRejectMetadataForAnotherVenue() {
    assertThatThrownBy(() -> registry.register("mock", () -> adapter("mock"), metadata("gemini")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldRejectFactoryProducingAnotherVenue() {
    registry.register("mock", () -> adapter("gemini"), metadata("mock"));

    assertThatThrownBy(() -> registry.create("mock")).isInstanceOf(IllegalStateException.class);
    assertThat(registry.activeInstances()).isEmpty();
  }

  @Test
  void shouldListRegisteredVenuesInRegistrationOrder() {
    registry.register("gemini", () -> adapter("gemini"), metadata("gemini"));
    registry.register("cryptocom", () -> adapter("cryptocom"), metadata("cryptocom"));

    assertThat(registry.registeredVenues())
        .extracting(VenueMetadata::venueId)
        .containsExactly("gemini", "cryptocom");
    assertThat(registry.metadata("gemini"))
        .get()
        .extracting(VenueMetadata::capabilities)
        .isEqualTo(Set.of(AdapterCapability.SPOT_TRADING));
  }

  @Test
  void shouldDisconnectEveryInstanceOnCloseEvenWhenOneFails() {
    ExchangeAdapter failing = adapter("mock");
    ExchangeAdapter healthy = adapter("mock");
    doThrow(new IllegalStateException("socket stuck")).when(failing).disconnect();
    List<ExchangeAdapter> produced = new ArrayList<>(List.of(failing, healthy));
    registry.register("mock", () -> produced.remove(0), metadata("mock"));
    registry.create("mock");
    registry.create("mock");

    registry.close();

    verify(failing).disconnect();
    verify(healthy).disconnect();
  }

  private static ExchangeAdapter adapter(String venueId) {
    ExchangeAdapter adapter = mock(ExchangeAdapter.class);
    when(adapter.venueId()).thenReturn(venueId);
    return adapter;
  }

  private static VenueMetadata metadata(String venueId) {
    return new VenueMetadata(
        venueId, venueId, "", Set.of(AdapterCapability.SPOT_TRADING), List.of(), false, false);
  }
}
