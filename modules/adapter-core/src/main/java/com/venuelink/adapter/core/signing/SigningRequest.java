package com.venuelink.adapter.core.signing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SigningRequest(
    String method, Map<String, Object> params, long requestId, long nonce) {
  public SigningRequest {
    if (method == null || method.isBlank()) {
      throw new IllegalArgumentException("method is required");
    }
    params =
        params == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}
