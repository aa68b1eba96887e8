package com.venuelink.integration.gemini;

import com.venuelink.adapter.core.normalize.SymbolCodec;
import com.venuelink.domain.market.CanonicalSymbol;
import com.venuelink.domain.market.Instrument;
import com.venuelink.domain.market.MarketDomainException;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code BTC/USD <-> btcusd}. Gemini symbols carry no separator, so loaded instruments are
 * consulted first and the quote suffix list only decides symbols that were never loaded.
 */
public class GeminiSymbolCodec implements SymbolCodec {
  static final List<String> QUOTE_PRIORITY =
      List.of("GUSD", "USDT", "USDC", "DAI", "USD", "BTC", "ETH", "EUR", "GBP", "SGD");

  private volatile Map<String, String> known = Map.of();

  @Override
  public String toVenue(String canonicalSymbol) {
    CanonicalSymbol symbol = CanonicalSymbol.parse(canonicalSymbol);
    return (symbol.base() + symbol.quote()).toLowerCase(Locale.ROOT);
  }

  @Override
  public String toCanonical(String venueSymbol) {
    if (venueSymbol == null || venueSymbol.isBlank()) {
      throw new MarketDomainException("venue symbol must not be blank");
    }
    String key = venueSymbol.trim().toLowerCase(Locale.ROOT);
    String loaded = known.get(key);
    if (loaded != null) {
      return loaded;
    }
    String upper = key.toUpperCase(Locale.ROOT);
    for (String quote : QUOTE_PRIORITY) {
      if (upper.length() > quote.length() && upper.endsWith(quote)) {
        return CanonicalSymbol.of(upper.substring(0, upper.length() - quote.length()), quote)
            .toString();
      }
    }
    if (upper.length() < 4) {
      throw new MarketDomainException("Cannot split Gemini symbol " + venueSymbol);
    }
    return CanonicalSymbol.of(upper.substring(0, 3), upper.substring(3)).toString();
  }

  public void register(Collection<Instrument> instruments) {
    Map<String, String> next = new HashMap<>();
    for (Instrument instrument : instruments) {
      next.put(instrument.venueSymbol().toLowerCase(Locale.ROOT), instrument.symbol());
    }
    known = Map.copyOf(next);
  }
}
