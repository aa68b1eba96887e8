package com.venuelink.adapter.core.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.error.ErrorKind;
import com.venuelink.adapter.core.error.MalformedPayloadException;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JsonFieldsTest {
  private final JsonFields fields = new JsonFields("gemini", new ObjectMapper());

  @Test
  void shouldReadDecimalsFromStringsAndNumbers() {
    JsonNode node = fields.parse("{\"a\":\"50000.10\",\"b\":0.5,\"c\":null,\"d\":\"\"}");

    assertEquals(new BigDecimal("50000.10"), fields.decimal(node, "a"));
    assertEquals(new BigDecimal("0.5"), fields.decimal(node, "b"));
    assertNull(fields.optionalDecimal(node, "c"));
    assertNull(fields.optionalDecimal(node, "d"));
    assertEquals(BigDecimal.ZERO, fields.decimalOrZero(node, "missing"));
  }

  @Test
  void shouldRaiseMalformedPayloadForMissingOrBadFields() {
    JsonNode node = fields.parse("{\"price\":\"abc\",\"ts\":\"x\"}");

    MalformedPayloadException missing =
        assertThrows(MalformedPayloadException.class, () -> fields.text(node, "symbol"));
    assertEquals(ErrorKind.UNCLASSIFIED, missing.kind());
    assertThrows(MalformedPayloadException.class, () -> fields.decimal(node, "price"));
    assertThrows(MalformedPayloadException.class, () -> fields.longValue(node, "ts"));
    assertThrows(MalformedPayloadException.class, () -> fields.array(node, "price"));
  }

  @Test
  void shouldRejectUnparseablePayloads() {
    assertThrows(MalformedPayloadException.class, () -> fields.parse("{not-json"));
    assertThrows(MalformedPayloadException.class, () -> fields.parse(" "));
  }

  @Test
  void shouldReadEpochMillisWithFallback() {
    JsonNode node = fields.parse("{\"t\":1771977600123,\"s\":\"1771977600000\"}");
    Instant fallback = Instant.parse("2026-03-01T00:00:00Z");

    assertEquals(Instant.ofEpochMilli(1771977600123L), fields.epochMillis(node, "t"));
    assertEquals(Instant.ofEpochMilli(1771977600000L), fields.epochMillis(node, "s"));
    assertEquals(fallback, fields.optionalEpochMillis(node, "missing", fallback));
  }
}
