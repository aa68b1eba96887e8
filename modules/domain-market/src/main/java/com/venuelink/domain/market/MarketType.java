package com.venuelink.domain.market;

public enum MarketType {
  SPOT,
  MARGIN
}
