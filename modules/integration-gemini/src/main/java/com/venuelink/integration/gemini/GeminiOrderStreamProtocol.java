package com.venuelink.integration.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.venuelink.adapter.core.event.AdapterEvent;
import com.venuelink.adapter.core.event.OrderUpdate;
import com.venuelink.adapter.core.signing.NonceSource;
import com.venuelink.adapter.core.stream.HandshakeStatus;
import com.venuelink.adapter.core.stream.StreamProtocol;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Gemini order events socket. Authentication rides on the upgrade request headers, so every
 * reconnect signs a fresh nonce and there are no subscribe frames to send.
 */
class GeminiOrderStreamProtocol implements StreamProtocol {
  static final String ORDERS_CHANNEL = "orders";

  private final GeminiNormalizer normalizer;
  private final GeminiRequestSigner signer;
  private final NonceSource nonces;
  private final Clock clock;

  GeminiOrderStreamProtocol(
      GeminiNormalizer normalizer, GeminiRequestSigner signer, NonceSource nonces, Clock clock) {
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    this.signer = Objects.requireNonNull(signer, "signer must not be null");
    this.nonces = Objects.requireNonNull(nonces, "nonces must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public Map<String, String> handshakeHeaders() {
    return signer.streamHeaders(GeminiPaths.ORDER_EVENTS, nonces.next());
  }

  @Override
  public HandshakeStatus handshakeStatus(JsonNode message) {
    return "subscription_ack".equals(message.path("type").asText())
        ? HandshakeStatus.ACCEPTED
        : HandshakeStatus.NONE;
  }

  @Override
  public List<String> subscribeMessages(Set<String> channels) {
    return List.of();
  }

  @Override
  public List<String> unsubscribeMessages(Set<String> channels) {
    return List.of();
  }

  @Override
  public List<AdapterEvent> decode(JsonNode message) {
    if (!message.isArray()) {
      return List.of();
    }
    Instant now = clock.instant();
    List<AdapterEvent> events = new ArrayList<>();
    for (JsonNode event : message) {
      if (event.hasNonNull("order_id")) {
        events.add(
            new OrderUpdate(GeminiExchangeAdapter.VENUE_ID, normalizer.order(event, now), now));
      }
    }
    return events;
  }
}
