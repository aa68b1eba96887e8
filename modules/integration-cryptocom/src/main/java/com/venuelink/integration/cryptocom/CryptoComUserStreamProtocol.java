package com.venuelink.integration.cryptocom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.error.VenueErrorClassifier;
import com.venuelink.adapter.core.event.AdapterEvent;
import com.venuelink.adapter.core.event.OrderUpdate;
import com.venuelink.adapter.core.stream.HandshakeStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Private socket: authenticates with {@code public/auth} before subscribing. */
class CryptoComUserStreamProtocol extends CryptoComStreamProtocol {
  static final String ORDER_CHANNEL = "user.order";

  private final CryptoComNormalizer normalizer;
  private final CryptoComRequestSigner signer;

  CryptoComUserStreamProtocol(
      ObjectMapper objectMapper,
      CryptoComNormalizer normalizer,
      CryptoComRequestSigner signer,
      VenueErrorClassifier classifier,
      Clock clock) {
    super(objectMapper, classifier, clock);
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    this.signer = Objects.requireNonNull(signer, "signer must not be null");
  }

  @Override
  public Optional<String> handshakeMessage() {
    return Optional.of(signer.authMessage(nextRequestId(), nextNonce()));
  }

  @Override
  public HandshakeStatus handshakeStatus(JsonNode message) {
    if (!CryptoComMethods.AUTH.equals(message.path("method").asText())) {
      return HandshakeStatus.NONE;
    }
    return message.path("code").asInt(-1) == 0
        ? HandshakeStatus.ACCEPTED
        : HandshakeStatus.REJECTED;
  }

  @Override
  protected List<AdapterEvent> decodeResult(JsonNode result) {
    if (!result.path("channel").asText().startsWith(ORDER_CHANNEL)) {
      return List.of();
    }
    Instant now = clock.instant();
    List<AdapterEvent> events = new ArrayList<>();
    for (JsonNode info : result.get("data")) {
      events.add(
          new OrderUpdate(CryptoComExchangeAdapter.VENUE_ID, normalizer.order(info, now), now));
    }
    return events;
  }
}
