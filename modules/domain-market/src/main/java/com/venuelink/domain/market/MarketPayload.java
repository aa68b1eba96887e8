package com.venuelink.domain.market;

public interface MarketPayload {
  String symbol();
}
