package com.venuelink.integration.cryptocom;

import com.venuelink.adapter.core.normalize.SymbolCodec;
import com.venuelink.domain.market.CanonicalSymbol;
import com.venuelink.domain.market.MarketDomainException;

/** {@code BTC/USD <-> BTC_USD}. */
public class CryptoComSymbolCodec implements SymbolCodec {
  private static final char SEPARATOR = '_';

  @Override
  public String toVenue(String canonicalSymbol) {
    CanonicalSymbol symbol = CanonicalSymbol.parse(canonicalSymbol);
    return symbol.base() + SEPARATOR + symbol.quote();
  }

  @Override
  public String toCanonical(String venueSymbol) {
    if (venueSymbol == null) {
      throw new MarketDomainException("venue symbol must not be null");
    }
    String trimmed = venueSymbol.trim();
    int separator = trimmed.indexOf(SEPARATOR);
    if (separator <= 0 || separator == trimmed.length() - 1) {
      throw new MarketDomainException("Not a Crypto.com spot instrument: " + venueSymbol);
    }
    return CanonicalSymbol.of(trimmed.substring(0, separator), trimmed.substring(separator + 1))
        .toString();
  }

  public boolean isSpotInstrument(String venueSymbol) {
    if (venueSymbol == null) {
      return false;
    }
    int separator = venueSymbol.indexOf(SEPARATOR);
    return separator > 0
        && separator == venueSymbol.lastIndexOf(SEPARATOR)
        && separator < venueSymbol.length() - 1;
  }
}
