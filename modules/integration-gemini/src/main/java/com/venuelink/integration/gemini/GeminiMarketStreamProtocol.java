package com.venuelink.integration.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.venuelink.adapter.core.MarketChannel;
import com.venuelink.adapter.core.error.VenueErrorClassifier;
import com.venuelink.adapter.core.error.VenueFailure;
import com.venuelink.adapter.core.event.AdapterEvent;
import com.venuelink.adapter.core.event.MarketUpdate;
import com.venuelink.adapter.core.stream.StreamProtocol;
import com.venuelink.domain.market.MarketPayload;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.Trade;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gemini v2 market data. One {@code l2} subscription per symbol carries both book changes and
 * trades, so the channels each symbol was requested for decide what gets published.
 */
class GeminiMarketStreamProtocol implements StreamProtocol {
  private final ObjectMapper objectMapper;
  private final GeminiNormalizer normalizer;
  private final GeminiSymbolCodec codec;
  private final VenueErrorClassifier classifier;
  private final Clock clock;
  private final int bookDepth;
  private final Map<String, Set<MarketChannel>> requested = new ConcurrentHashMap<>();
  // Guarded by itself: reconnects reset the books while a frame may still be decoding.
  private final Map<String, OrderBookAccumulator> books = new HashMap<>();

  GeminiMarketStreamProtocol(
      ObjectMapper objectMapper,
      GeminiNormalizer normalizer,
      GeminiSymbolCodec codec,
      VenueErrorClassifier classifier,
      Clock clock,
      int bookDepth) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.bookDepth = bookDepth;
  }

  static String streamSymbol(String venueSymbol) {
    return venueSymbol.toUpperCase(Locale.ROOT);
  }

  void request(String streamSymbol, Set<MarketChannel> channels) {
    requested.merge(
        streamSymbol,
        EnumSet.copyOf(channels),
        (current, added) -> {
          Set<MarketChannel> merged = EnumSet.copyOf(current);
          merged.addAll(added);
          return merged;
        });
  }

  void release(String streamSymbol) {
    requested.remove(streamSymbol);
  }

  @Override
  public List<String> subscribeMessages(Set<String> channels) {
    return List.of(subscription("subscribe", channels));
  }

  @Override
  public List<String> unsubscribeMessages(Set<String> channels) {
    return List.of(subscription("unsubscribe", channels));
  }

  @Override
  public List<AdapterEvent> decode(JsonNode message) {
    String type = message.path("type").asText();
    return switch (type) {
      case "l2_updates" -> l2Updates(message);
      case "trade" -> trade(message);
      case "error" ->
          throw classifier.classify(
              VenueFailure.of(
                  GeminiExchangeAdapter.VENUE_ID,
                  200,
                  message.path("reason").asText(null),
                  "Gemini market stream error: " + message.path("message").asText()));
      default -> List.of();
    };
  }

  @Override
  public void reset() {
    synchronized (books) {
      books.clear();
    }
  }

  private List<AdapterEvent> l2Updates(JsonNode message) {
    String streamSymbol = message.path("symbol").asText();
    String symbol = codec.toCanonical(streamSymbol);
    Set<MarketChannel> channels = requested.getOrDefault(streamSymbol, Set.of());
    Instant now = clock.instant();
    OrderBookSnapshot snapshot;
    synchronized (books) {
      OrderBookAccumulator book =
          books.computeIfAbsent(streamSymbol, key -> new OrderBookAccumulator(symbol));
      for (JsonNode change : message.path("changes")) {
        normalizer.applyBookChange(book, change);
      }
      snapshot =
          channels.contains(MarketChannel.ORDER_BOOK) ? book.snapshot(now, bookDepth) : null;
    }
    List<AdapterEvent> events = new ArrayList<>();
    if (snapshot != null) {
      events.add(update(MarketChannel.ORDER_BOOK, symbol, snapshot, now));
    }
    if (channels.contains(MarketChannel.TRADES)) {
      for (JsonNode item : message.path("trades")) {
        events.add(update(MarketChannel.TRADES, symbol, normalizer.streamTrade(item, symbol), now));
      }
    }
    return events;
  }

  private List<AdapterEvent> trade(JsonNode message) {
    String streamSymbol = message.path("symbol").asText();
    if (!requested.getOrDefault(streamSymbol, Set.of()).contains(MarketChannel.TRADES)) {
      return List.of();
    }
    Trade trade = normalizer.streamTrade(message, codec.toCanonical(streamSymbol));
    return List.of(update(MarketChannel.TRADES, trade.symbol(), trade, clock.instant()));
  }

  private String subscription(String type, Set<String> symbols) {
    ObjectNode frame = objectMapper.createObjectNode();
    frame.put("type", type);
    ObjectNode l2 = frame.putArray("subscriptions").addObject();
    l2.put("name", "l2");
    ArrayNode names = l2.putArray("symbols");
    symbols.forEach(names::add);
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize Gemini subscription", ex);
    }
  }

  private static MarketUpdate update(
      MarketChannel channel, String symbol, MarketPayload payload, Instant now) {
    return new MarketUpdate(GeminiExchangeAdapter.VENUE_ID, channel.code(), symbol, payload, now);
  }
}
