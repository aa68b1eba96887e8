package com.venuelink.adapter.core.normalize;

public interface SymbolCodec {
  String toVenue(String canonicalSymbol);

  String toCanonical(String venueSymbol);
}
