package com.venuelink.integration.gemini;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicLong;

/** Public calls are plain GETs; private calls POST an empty body with the signed headers. */
class GeminiRestClient {
  private final URI baseUri;
  private final VenueHttpTransport transport;
  private final JsonFields fields;
  private final RequestSigner signer;
  private final VenueErrorClassifier classifier;
  private final NonceSource nonces;
  private final RetryAfterParser retryAfterParser;
  private final AtomicLong requestIds = new AtomicLong(0L);

  GeminiRestClient(
      URI baseUri,
      VenueHttpTransport transport,
      JsonFields fields,
      RequestSigner signer,
      VenueErrorClassifier classifier,
      NonceSource nonces,
      RetryAfterParser retryAfterParser) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri must not be null");
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.fields = Objects.requireNonNull(fields, "fields must not be null");
    this.signer = Objects.requireNonNull(signer, "signer must not be null");
    this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    this.nonces = Objects.requireNonNull(nonces, "nonces must not be null");
    this.retryAfterParser =
        Objects.requireNonNull(retryAfterParser, "retryAfterParser must not be null");
  }

  JsonNode get(String path, Map<String, Object> query, String symbol) {
    VenueHttpResponse response = transport.get(resolve(path, query), Map.of(), path);
    return unwrap(response, symbol, null);
  }

  JsonNode post(String path, Map<String, Object> params, String symbol, String orderId) {
    SignedRequest signed =
        signer.sign(
            new SigningRequest(path, params, requestIds.incrementAndGet(), nonces.next()));
    VenueHttpResponse response =
        transport.post(resolve(path, Map.of()), signed.body(), signed.headers(), path);
    return unwrap(response, symbol, orderId);
  }

  private JsonNode unwrap(VenueHttpResponse response, String symbol, String orderId) {
    JsonNode root;
    try {
      root = fields.parse(response.body());
    } catch (ExchangeException ex) {
      if (response.isSuccessful()) {
        throw ex;
      }
      throw classify(response, null, "HTTP " + response.statusCode(), symbol, orderId);
    }
    boolean errorBody = root.isObject() && "error".equals(root.path("result").asText());
    if (!response.isSuccessful() || errorBody) {
      String reason = fields.optionalText(root, "reason");
      String message = fields.optionalText(root, "message");
      throw classify(response, reason, message == null ? reason : message, symbol, orderId);
    }
    return root;
  }

  private ExchangeException classify(
      VenueHttpResponse response, String reason, String message, String symbol, String orderId) {
    VenueFailure failure =
        VenueFailure.of(GeminiExchangeAdapter.VENUE_ID, response.statusCode(), reason, message)
            .withContext(symbol, orderId)
            .withRetryAfter(
                response.header("Retry-After").flatMap(retryAfterParser::parse).orElse(null));
    return classifier.classify(failure);
  }

  private URI resolve(String path, Map<String, Object> query) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    if (query.isEmpty()) {
      return URI.create(base + path);
    }
    StringJoiner joiner = new StringJoiner("&", "?", "");
    query.forEach(
        (key, value) ->
            joiner.add(
                key + "=" + URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8)));
    return URI.create(base + path + joiner);
  }
}
