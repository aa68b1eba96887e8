package com.venuelink.integration.cryptocom;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.venuelink.adapter.core.error.ExchangeException;
import com.venuelink.adapter.core.error.VenueErrorClassifier;
import com.venuelink.adapter.core.error.VenueFailure;
import com.venuelink.adapter.core.http.VenueHttpResponse;
import com.venuelink.adapter.core.http.VenueHttpTransport;
import com.venuelink.adapter.core.normalize.JsonFields;
import com.venuelink.adapter.core.retry.RetryAfterParser;
import com.venuelink.adapter.core.signing.NonceSource;
import com.venuelink.adapter.core.signing.RequestSigner;
import com.venuelink.adapter.core.signing.SignedRequest;
import com.venuelink.adapter.core.signing.SigningRequest;
import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/** POSTs JSON-RPC style requests to {@code <base>/<method>} and unwraps {@code result}. */
class CryptoComRestClient {
  private static final Map<String, String> JSON_HEADERS =
      Map.of("Content-Type", "application/json");

  private final URI baseUri;
  private final VenueHttpTransport transport;
  private final ObjectMapper objectMapper;
  private final JsonFields fields;
  private final RequestSigner signer;
  private final VenueErrorClassifier classifier;
  private final NonceSource nonces;
  private final RetryAfterParser retryAfterParser;
  private final AtomicLong requestIds = new AtomicLong(0L);

  CryptoComRestClient(
      URI baseUri,
      VenueHttpTransport transport,
      ObjectMapper objectMapper,
      JsonFields fields,
      RequestSigner signer,
      VenueErrorClassifier classifier,
      NonceSource nonces,
      RetryAfterParser retryAfterParser) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri must not be null");
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.fields = Objects.requireNonNull(fields, "fields must not be null");
    this.signer = Objects.requireNonNull(signer, "signer must not be null");
    this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    this.nonces = Objects.requireNonNull(nonces, "nonces must not be null");
    this.retryAfterParser =
        Objects.requireNonNull(retryAfterParser, "retryAfterParser must not be null");
  }

  JsonNode publicCall(String method, Map<String, Object> params, String symbol) {
    long id = requestIds.incrementAndGet();
    ObjectNode body = objectMapper.createObjectNode();
    body.put("id", id);
    body.put("method", method);
    body.set("params", objectMapper.valueToTree(params));
    body.put("nonce", nonces.next());
    return send(method, write(body), JSON_HEADERS, symbol, null);
  }

  JsonNode privateCall(String method, Map<String, Object> params, String symbol, String orderId) {
    SigningRequest request =
        new SigningRequest(method, params, requestIds.incrementAndGet(), nonces.next());
    SignedRequest signed = signer.sign(request);
    return send(method, signed.body(), signed.headers(), symbol, orderId);
  }

  private JsonNode send(
      String method, String body, Map<String, String> headers, String symbol, String orderId) {
    VenueHttpResponse response = transport.post(resolve(method), body, headers, method);
    JsonNode root;
    try {
      root = fields.parse(response.body());
    } catch (ExchangeException ex) {
      if (response.isSuccessful()) {
        throw ex;
      }
      throw classify(response, null, "HTTP " + response.statusCode(), symbol, orderId);
    }
    String code = root.hasNonNull("code") ? root.get("code").asText() : null;
    if (!response.isSuccessful() || (code != null && !"0".equals(code))) {
      String message = fields.optionalText(root, "message");
      if (message == null) {
        message = fields.optionalText(root, "msg");
      }
      throw classify(response, code, message, symbol, orderId);
    }
    JsonNode result = root.get("result");
    return result == null || result.isNull() ? objectMapper.createObjectNode() : result;
  }

  private ExchangeException classify(
      VenueHttpResponse response, String code, String message, String symbol, String orderId) {
    VenueFailure failure =
        VenueFailure.of(CryptoComExchangeAdapter.VENUE_ID, response.statusCode(), code, message)
            .withContext(symbol, orderId);
    failure =
        failure.withRetryAfter(
            response.header("Retry-After").flatMap(retryAfterParser::parse).orElse(null));
    return classifier.classify(failure);
  }

  private URI resolve(String method) {
    String base = baseUri.toString();
    return URI.create(base.endsWith("/") ? base + method : base + "/" + method);
  }

  private String write(ObjectNode body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize Crypto.com request body", ex);
    }
  }
}
