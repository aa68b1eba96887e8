package com.venuelink.integration.gemini;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.Credentials;
import com.venuelink.adapter.core.signing.Hmac;
import com.venuelink.adapter.core.signing.SignedRequest;
import com.venuelink.adapter.core.signing.SigningRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GeminiRequestSignerTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final GeminiRequestSigner signer =
      new GeminiRequestSigner(new Credentials("account-key", "account-secret"), objectMapper);

  @Test
  void shouldCarryPathNonceAndParamsInEncodedPayload() throws Exception {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("symbol", "btcusd");
    params.put("options", List.of("maker-or-cancel"));

    SignedRequest signed =
        signer.sign(new SigningRequest("/v1/order/new", params, 1L, 1709251200000L));

    JsonNode payload = decode(signed.headers().get(GeminiRequestSigner.PAYLOAD_HEADER));
    assertEquals("/v1/order/new", payload.get("request").asText());
    assertEquals(1709251200000L, payload.get("nonce").asLong());
    assertEquals("btcusd", payload.get("symbol").asText());
    assertEquals("maker-or-cancel", payload.get("options").get(0).asText());
    assertEquals("", signed.body());
  }

  @Test
  void shouldSignEncodedPayloadWithHmacSha384() {
    SignedRequest signed =
        signer.sign(new SigningRequest("/v1/balances", Map.of(), 1L, 5L));

    String encoded = signed.headers().get(GeminiRequestSigner.PAYLOAD_HEADER);
    String expected = Hmac.hex(Hmac.SHA384, "account-secret", encoded);
    assertEquals(expected, signed.signature());
    assertEquals(expected, signed.headers().get(GeminiRequestSigner.SIGNATURE_HEADER));
    assertEquals(96, signed.signature().length());
    assertEquals("account-key", signed.headers().get(GeminiRequestSigner.API_KEY_HEADER));
    assertEquals("text/plain", signed.headers().get("Content-Type"));
    assertFalse(signed.headers().containsKey("Content-Length"));
  }

  @Test
  void shouldLimitStreamHeadersToCredentials() throws Exception {
    Map<String, String> headers = signer.streamHeaders("/v1/order/events", 77L);

    assertEquals(
        Set.of(
            GeminiRequestSigner.API_KEY_HEADER,
            GeminiRequestSigner.PAYLOAD_HEADER,
            GeminiRequestSigner.SIGNATURE_HEADER),
        headers.keySet());
    JsonNode payload = decode(headers.get(GeminiRequestSigner.PAYLOAD_HEADER));
    assertEquals("/v1/order/events", payload.get("request").asText());
    assertEquals(77L, payload.get("nonce").asLong());
  }

  private JsonNode decode(String encoded) throws Exception {
    return objectMapper.readTree(
        new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8));
  }
}
