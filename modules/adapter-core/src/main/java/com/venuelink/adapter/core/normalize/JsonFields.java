package com.venuelink.adapter.core.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.error.MalformedPayloadException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public class JsonFields {
  private final String venue;
  private final ObjectMapper objectMapper;

  public JsonFields(String venue, ObjectMapper objectMapper) {
    this.venue = Objects.requireNonNull(venue, "venue must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      throw new MalformedPayloadException(venue, venue + " returned an empty payload");
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new MalformedPayloadException(venue, "Failed to parse " + venue + " JSON payload", ex);
    }
  }

  public JsonNode object(JsonNode node, String field) {
    JsonNode value = node == null ? null : node.get(field);
    if (value == null || !value.isObject()) {
      throw missing(field);
    }
    return value;
  }

  public JsonNode array(JsonNode node, String field) {
    JsonNode value = node == null ? null : node.get(field);
    if (value == null || !value.isArray()) {
      throw missing(field);
    }
    return value;
  }

  public String text(JsonNode node, String field) {
    String value = optionalText(node, field);
    if (value == null) {
      throw missing(field);
    }
    return value;
  }

  public String optionalText(JsonNode node, String field) {
    JsonNode value = node == null ? null : node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText();
    return text == null || text.isBlank() ? null : text.trim();
  }

  public BigDecimal decimal(JsonNode node, String field) {
    BigDecimal value = optionalDecimal(node, field);
    if (value == null) {
      throw missing(field);
    }
    return value;
  }

  public BigDecimal decimalOrZero(JsonNode node, String field) {
    BigDecimal value = optionalDecimal(node, field);
    return value == null ? BigDecimal.ZERO : value;
  }

  public BigDecimal optionalDecimal(JsonNode node, String field) {
    JsonNode value = node == null ? null : node.get(field);
    return value == null ? null : toDecimal(value, field);
  }

  public BigDecimal toDecimal(JsonNode value, String field) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return value.decimalValue();
    }
    String text = value.asText();
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      return new BigDecimal(text.trim());
    } catch (NumberFormatException ex) {
      throw new MalformedPayloadException(
          venue, venue + " field " + field + " is not a decimal: " + text, ex);
    }
  }

  public long longValue(JsonNode node, String field) {
    JsonNode value = node == null ? null : node.get(field);
    if (value == null || value.isNull()) {
      throw missing(field);
    }
    if (value.canConvertToLong()) {
      return value.asLong();
    }
    try {
      return Long.parseLong(value.asText().trim());
    } catch (NumberFormatException ex) {
      throw new MalformedPayloadException(
          venue, venue + " field " + field + " is not an integer: " + value.asText(), ex);
    }
  }

  public Instant epochMillis(JsonNode node, String field) {
    return Instant.ofEpochMilli(longValue(node, field));
  }

  public Instant optionalEpochMillis(JsonNode node, String field, Instant fallback) {
    JsonNode value = node == null ? null : node.get(field);
    if (value == null || value.isNull() || value.asText().isBlank()) {
      return fallback;
    }
    return epochMillis(node, field);
  }

  public MalformedPayloadException malformed(String message) {
    return new MalformedPayloadException(venue, message);
  }

  public String venue() {
    return venue;
  }

  private MalformedPayloadException missing(String field) {
    return new MalformedPayloadException(
        venue, venue + " payload missing required field " + field);
  }
}
