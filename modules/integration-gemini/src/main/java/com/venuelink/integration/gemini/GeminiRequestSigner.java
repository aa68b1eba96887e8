package com.venuelink.integration.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.venuelink.adapter.core.Credentials;
import com.venuelink.adapter.core.signing.Hmac;
import com.venuelink.adapter.core.signing.RequestSigner;
import com.venuelink.adapter.core.signing.SignedRequest;
import com.venuelink.adapter.core.signing.SigningRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Gemini private requests carry no body: the JSON payload travels base64 encoded in {@code
 * X-GEMINI-PAYLOAD} and is signed with HMAC-SHA384.
 */
public class GeminiRequestSigner implements RequestSigner {
  static final String API_KEY_HEADER = "X-GEMINI-APIKEY";
  static final String PAYLOAD_HEADER = "X-GEMINI-PAYLOAD";
  static final String SIGNATURE_HEADER = "X-GEMINI-SIGNATURE";

  private final Credentials credentials;
  private final ObjectMapper objectMapper;

  public GeminiRequestSigner(Credentials credentials, ObjectMapper objectMapper) {
    this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  /** {@link SigningRequest#method()} is the request path, for example {@code /v1/order/new}. */
  @Override
  public SignedRequest sign(SigningRequest request) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("request", request.method());
    payload.put("nonce", request.nonce());
    request.params().forEach((key, value) -> payload.set(key, objectMapper.valueToTree(value)));

    String encoded =
        Base64.getEncoder().encodeToString(write(payload).getBytes(StandardCharsets.UTF_8));
    String signature = Hmac.hex(Hmac.SHA384, credentials.apiSecret(), encoded);

    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "text/plain");
    headers.put("Cache-Control", "no-cache");
    headers.put(API_KEY_HEADER, credentials.apiKey());
    headers.put(PAYLOAD_HEADER, encoded);
    headers.put(SIGNATURE_HEADER, signature);
    return new SignedRequest("", headers, signature);
  }

  /** Headers that authenticate the order events socket upgrade. */
  public Map<String, String> streamHeaders(String path, long nonce) {
    Map<String, String> signed = sign(new SigningRequest(path, Map.of(), 0L, nonce)).headers();
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(API_KEY_HEADER, signed.get(API_KEY_HEADER));
    headers.put(PAYLOAD_HEADER, signed.get(PAYLOAD_HEADER));
    headers.put(SIGNATURE_HEADER, signed.get(SIGNATURE_HEADER));
    return headers;
  }

  private String write(ObjectNode payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize Gemini payload", ex);
    }
  }
}
