package com.venuelink.domain.market;

public class MarketDomainException extends RuntimeException {
  public MarketDomainException(String message) {
    super(message);
  }
}
