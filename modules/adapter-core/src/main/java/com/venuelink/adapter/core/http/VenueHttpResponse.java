package com.venuelink.adapter.core.http;

import java.net.http.HttpHeaders;
import java.util.Map;
import java.util.Optional;

public record VenueHttpResponse(int statusCode, String body, HttpHeaders headers) {
  public VenueHttpResponse {
    body = body == null ? "" : body;
    headers = headers == null ? HttpHeaders.of(Map.of(), (name, value) -> true) : headers;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  public Optional<String> header(String name) {
    return headers.firstValue(name);
  }
}
