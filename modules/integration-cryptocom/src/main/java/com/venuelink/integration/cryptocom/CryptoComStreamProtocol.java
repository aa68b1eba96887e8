package com.venuelink.integration.cryptocom;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.venuelink.adapter.core.error.VenueErrorClassifier;
import com.venuelink.adapter.core.error.VenueFailure;
import com.venuelink.adapter.core.event.AdapterEvent;
import com.venuelink.adapter.core.signing.NonceSource;
import com.venuelink.adapter.core.stream.StreamProtocol;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/** Framing shared by the Crypto.com market and user sockets. */
abstract class CryptoComStreamProtocol implements StreamProtocol {
  protected final ObjectMapper objectMapper;
  protected final Clock clock;
  private final VenueErrorClassifier classifier;
  private final NonceSource nonces;
  private final AtomicLong requestIds = new AtomicLong(0L);

  CryptoComStreamProtocol(ObjectMapper objectMapper, VenueErrorClassifier classifier, Clock clock) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.nonces = new NonceSource(clock);
  }

  /** Decodes a {@code result} frame carrying channel data. */
  protected abstract List<AdapterEvent> decodeResult(JsonNode result);

  @Override
  public List<String> subscribeMessages(Set<String> channels) {
    return List.of(channelMessage(CryptoComMethods.SUBSCRIBE, channels));
  }

  @Override
  public List<String> unsubscribeMessages(Set<String> channels) {
    return List.of(channelMessage(CryptoComMethods.UNSUBSCRIBE, channels));
  }

  @Override
  public Optional<String> heartbeatReply(JsonNode message) {
    if (!CryptoComMethods.HEARTBEAT.equals(message.path("method").asText())) {
      return Optional.empty();
    }
    ObjectNode reply = objectMapper.createObjectNode();
    reply.set("id", message.get("id"));
    reply.put("method", CryptoComMethods.RESPOND_HEARTBEAT);
    return Optional.of(write(reply));
  }

  @Override
  public List<AdapterEvent> decode(JsonNode message) {
    String code = message.hasNonNull("code") ? message.get("code").asText() : "0";
    if (!"0".equals(code)) {
      String description =
          message.path("method").asText("stream") + " failed: " + message.path("message").asText();
      throw classifier.classify(
          VenueFailure.of(CryptoComExchangeAdapter.VENUE_ID, 200, code, description));
    }
    JsonNode result = message.get("result");
    if (result == null || !result.isObject() || !result.has("data")) {
      return List.of();
    }
    return decodeResult(result);
  }

  protected long nextRequestId() {
    return requestIds.incrementAndGet();
  }

  protected long nextNonce() {
    return nonces.next();
  }

  protected String write(ObjectNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize Crypto.com stream frame", ex);
    }
  }

  private String channelMessage(String method, Set<String> channels) {
    ObjectNode message = objectMapper.createObjectNode();
    message.put("id", nextRequestId());
    message.put("method", method);
    ArrayNode names = message.putObject("params").putArray("channels");
    channels.forEach(names::add);
    message.put("nonce", nextNonce());
    return write(message);
  }
}
