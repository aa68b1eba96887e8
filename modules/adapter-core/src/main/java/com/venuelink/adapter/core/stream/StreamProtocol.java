package com.venuelink.adapter.core.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.venuelink.adapter.core.event.AdapterEvent;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Venue specific framing for a {@link WebSocketStreamManager}. Implementations are called from the
 * manager's socket threads, one message at a time.
 */
public interface StreamProtocol {
  default Map<String, String> handshakeHeaders() {
    return Map.of();
  }

  /** Message sent once per connection before any subscription; empty when none is needed. */
  default Optional<String> handshakeMessage() {
    return Optional.empty();
  }

  default HandshakeStatus handshakeStatus(JsonNode message) {
    return HandshakeStatus.NONE;
  }

  List<String> subscribeMessages(Set<String> channels);

  List<String> unsubscribeMessages(Set<String> channels);

  default Optional<String> heartbeatReply(JsonNode message) {
    return Optional.empty();
  }

  List<AdapterEvent> decode(JsonNode message);

  /** Clears per-connection state such as partially assembled books. */
  default void reset() {}
}
