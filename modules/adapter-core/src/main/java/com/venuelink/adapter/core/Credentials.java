package com.venuelink.adapter.core;

public record Credentials(String apiKey, String apiSecret) {
  public Credentials {
    apiKey = apiKey == null ? "" : apiKey.trim();
    apiSecret = apiSecret == null ? "" : apiSecret.trim();
  }

  public static Credentials none() {
    return new Credentials("", "");
  }

  public boolean isPresent() {
    return !apiKey.isEmpty() && !apiSecret.isEmpty();
  }

  @Override
  public String toString() {
    return "Credentials[apiKey=" + mask(apiKey) + ", apiSecret=****]";
  }

  private static String mask(String value) {
    if (value.length() <= 4) {
      return "****";
    }
    return value.substring(0, 4) + "****";
  }
}
