package com.venuelink.adapter.core.signing;

import java.util.Map;

public record SignedRequest(String body, Map<String, String> headers, String signature) {
  public SignedRequest {
    body = body == null ? "" : body;
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}
