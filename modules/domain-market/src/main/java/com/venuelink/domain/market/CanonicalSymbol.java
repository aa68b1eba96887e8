package com.venuelink.domain.market;

import java.util.Locale;

public record CanonicalSymbol(String base, String quote) {
  public CanonicalSymbol {
    base = normalizeAsset(base, "base");
    quote = normalizeAsset(quote, "quote");
  }

  public static CanonicalSymbol of(String base, String quote) {
    return new CanonicalSymbol(base, quote);
  }

  public static CanonicalSymbol parse(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      throw new MarketDomainException("symbol must not be blank");
    }
    String[] parts = symbol.trim().split("/", -1);
    if (parts.length != 2) {
      throw new MarketDomainException("symbol must be BASE/QUOTE: " + symbol);
    }
    return new CanonicalSymbol(parts[0], parts[1]);
  }

  public static boolean isValid(String symbol) {
    try {
      parse(symbol);
      return true;
    } catch (MarketDomainException ex) {
      return false;
    }
  }

  @Override
  public String toString() {
    return base + "/" + quote;
  }

  private static String normalizeAsset(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new MarketDomainException(fieldName + " must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if (normalized.contains("/")) {
      throw new MarketDomainException(fieldName + " must not contain '/'");
    }
    return normalized;
  }
}
