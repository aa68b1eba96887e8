package com.venuelink.domain.market;

import java.math.BigDecimal;
import java.util.Objects;

public record Instrument(
    String venueSymbol,
    String symbol,
    String base,
    String quote,
    boolean active,
    MarketType marketType,
    int pricePrecision,
    int amountPrecision,
    BigDecimal minAmount,
    BigDecimal maxAmount,
    BigDecimal minPrice,
    BigDecimal maxPrice) {
  public Instrument {
    DomainChecks.requireNonBlank(venueSymbol, "venueSymbol");
    CanonicalSymbol canonical = CanonicalSymbol.parse(symbol);
    symbol = canonical.toString();
    base = base == null ? canonical.base() : base;
    quote = quote == null ? canonical.quote() : quote;
    if (!canonical.base().equals(base) || !canonical.quote().equals(quote)) {
      throw new MarketDomainException("base/quote do not match symbol " + symbol);
    }
    Objects.requireNonNull(marketType, "marketType must not be null");
    if (pricePrecision < 0 || amountPrecision < 0) {
      throw new MarketDomainException("precision must be >= 0");
    }
    DomainChecks.requireOptionalNonNegative(minAmount, "minAmount");
    DomainChecks.requireOptionalNonNegative(maxAmount, "maxAmount");
    DomainChecks.requireOptionalNonNegative(minPrice, "minPrice");
    DomainChecks.requireOptionalNonNegative(maxPrice, "maxPrice");
    if (minAmount != null && maxAmount != null && maxAmount.compareTo(minAmount) < 0) {
      throw new MarketDomainException("maxAmount must be >= minAmount");
    }
  }

  public CanonicalSymbol canonicalSymbol() {
    return new CanonicalSymbol(base, quote);
  }
}
