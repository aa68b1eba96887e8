package com.venuelink.adapter.core.error;

@FunctionalInterface
public interface VenueErrorClassifier {
  ExchangeException classify(VenueFailure failure);
}
