package com.venuelink.integration.mock;

/** Probability in {@code [0, 1]} that a simulated call of each class fails. */
public record MockFailureRates(
    double connection, double authentication, double orderPlacement, double rateLimit) {
  public MockFailureRates {
    requireRate(connection, "connection");
    requireRate(authentication, "authentication");
    requireRate(orderPlacement, "orderPlacement");
    requireRate(rateLimit, "rateLimit");
  }

  public static MockFailureRates none() {
    return new MockFailureRates(0.0d, 0.0d, 0.0d, 0.0d);
  }

  private static void requireRate(double rate, String name) {
    if (Double.isNaN(rate) || rate < 0.0d || rate > 1.0d) {
      throw new IllegalArgumentException(name + " failure rate must be within [0, 1]");
    }
  }
}
