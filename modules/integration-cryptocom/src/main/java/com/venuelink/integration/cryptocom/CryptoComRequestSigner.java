package com.venuelink.integration.cryptocom;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.venuelink.adapter.core.Credentials;
import com.venuelink.adapter.core.signing.Hmac;
import com.venuelink.adapter.core.signing.RequestSigner;
import com.venuelink.adapter.core.signing.SignedRequest;
import com.venuelink.adapter.core.signing.SigningRequest;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Signs Crypto.com JSON-RPC style requests. The signature covers {@code method + id + api_key +
 * params + nonce}, where params are flattened as sorted {@code key + value} pairs.
 */
public class CryptoComRequestSigner implements RequestSigner {
  private static final Map<String, String> JSON_HEADERS =
      Map.of("Content-Type", "application/json");

  private final Credentials credentials;
  private final ObjectMapper objectMapper;

  public CryptoComRequestSigner(Credentials credentials, ObjectMapper objectMapper) {
    this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  @Override
  public SignedRequest sign(SigningRequest request) {
    String payload =
        request.method()
            + request.requestId()
            + credentials.apiKey()
            + paramString(request.params())
            + request.nonce();
    String signature = Hmac.hex(Hmac.SHA256, credentials.apiSecret(), payload);

    ObjectNode body = objectMapper.createObjectNode();
    body.put("id", request.requestId());
    body.put("method", request.method());
    body.put("api_key", credentials.apiKey());
    body.set("params", objectMapper.valueToTree(request.params()));
    body.put("sig", signature);
    body.put("nonce", request.nonce());
    return new SignedRequest(write(body), JSON_HEADERS, signature);
  }

  /** Builds the {@code public/auth} frame that unlocks a user stream. */
  public String authMessage(long requestId, long nonce) {
    return sign(new SigningRequest(CryptoComMethods.AUTH, Map.of(), requestId, nonce)).body();
  }

  static String paramString(Map<?, ?> params) {
    if (params == null || params.isEmpty()) {
      return "";
    }
    List<String> keys = new ArrayList<>();
    for (Object key : params.keySet()) {
      keys.add(String.valueOf(key));
    }
    keys.sort(null);
    StringBuilder out = new StringBuilder();
    for (String key : keys) {
      out.append(key).append(render(params.get(key)));
    }
    return out.toString();
  }

  private static String render(Object value) {
    if (value instanceof Map<?, ?> nested) {
      return paramString(nested);
    }
    if (value instanceof List<?> items) {
      StringBuilder out = new StringBuilder();
      for (Object item : items) {
        out.append(render(item));
      }
      return out.toString();
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    return String.valueOf(value);
  }

  private String write(ObjectNode body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize Crypto.com request body", ex);
    }
  }
}
