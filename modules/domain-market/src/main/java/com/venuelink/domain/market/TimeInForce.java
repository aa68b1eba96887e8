package com.venuelink.domain.market;

public enum TimeInForce {
  GTC,
  IOC,
  FOK,
  POST_ONLY
}
