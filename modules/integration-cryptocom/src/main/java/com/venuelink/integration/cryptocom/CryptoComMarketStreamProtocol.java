package com.venuelink.integration.cryptocom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.MarketChannel;
import com.venuelink.adapter.core.error.VenueErrorClassifier;
import com.venuelink.adapter.core.event.AdapterEvent;
import com.venuelink.adapter.core.event.MarketUpdate;
import com.venuelink.domain.market.MarketPayload;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.Trade;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

class CryptoComMarketStreamProtocol extends CryptoComStreamProtocol {
  private final CryptoComNormalizer normalizer;
  private final CryptoComSymbolCodec codec;

  CryptoComMarketStreamProtocol(
      ObjectMapper objectMapper,
      CryptoComNormalizer normalizer,
      CryptoComSymbolCodec codec,
      VenueErrorClassifier classifier,
      Clock clock) {
    super(objectMapper, classifier, clock);
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
  }

  static String channelName(MarketChannel channel, String venueSymbol) {
    return switch (channel) {
      case TICKER -> "ticker." + venueSymbol;
      case ORDER_BOOK -> "book." + venueSymbol;
      case TRADES -> "trade." + venueSymbol;
    };
  }

  @Override
  protected List<AdapterEvent> decodeResult(JsonNode result) {
    String channel = result.path("channel").asText();
    String venueSymbol = result.path("instrument_name").asText(null);
    String symbol = venueSymbol == null ? null : codec.toCanonical(venueSymbol);
    Instant now = clock.instant();
    List<AdapterEvent> events = new ArrayList<>();
    switch (channel) {
      case "ticker" -> {
        for (JsonNode item : result.get("data")) {
          Ticker ticker = normalizer.ticker(item, now);
          events.add(update(MarketChannel.TICKER, ticker.symbol(), ticker, now));
        }
      }
      case "book" ->
          events.add(
              new MarketUpdate(
                  CryptoComExchangeAdapter.VENUE_ID,
                  MarketChannel.ORDER_BOOK.code(),
                  symbol,
                  normalizer.orderBook(normalizer.bookData(result), symbol, now),
                  now));
      case "trade" -> {
        for (JsonNode item : result.get("data")) {
          Trade trade = normalizer.trade(item, symbol);
          events.add(update(MarketChannel.TRADES, trade.symbol(), trade, now));
        }
      }
      default -> {
        return List.of();
      }
    }
    return events;
  }

  private static MarketUpdate update(
      MarketChannel channel, String symbol, MarketPayload payload, Instant now) {
    return new MarketUpdate(
        CryptoComExchangeAdapter.VENUE_ID, channel.code(), symbol, payload, now);
  }
}
