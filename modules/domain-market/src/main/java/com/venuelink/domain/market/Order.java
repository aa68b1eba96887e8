package com.venuelink.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public record Order(
    String id,
    String clientOrderId,
    String symbol,
    OrderType type,
    OrderSide side,
    BigDecimal price,
    BigDecimal stopPrice,
    BigDecimal amount,
    BigDecimal filled,
    BigDecimal remaining,
    BigDecimal averagePrice,
    OrderStatus status,
    String venueStatus,
    Fee fee,
    Instant createdAt,
    Instant updatedAt,
    String raw) {
  public Order {
    DomainChecks.requireNonBlank(id, "id");
    symbol = CanonicalSymbol.parse(symbol).toString();
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(side, "side must not be null");
    DomainChecks.requireOptionalNonNegative(price, "price");
    DomainChecks.requireOptionalNonNegative(stopPrice, "stopPrice");
    DomainChecks.requireNonNegative(amount, "amount");
    DomainChecks.requireNonNegative(filled, "filled");
    if (filled.compareTo(amount) > 0) {
      throw new MarketDomainException("filled must be between 0 and amount");
    }
    BigDecimal expectedRemaining = amount.subtract(filled);
    if (remaining == null) {
      remaining = expectedRemaining;
    } else if (remaining.compareTo(expectedRemaining) != 0) {
      throw new MarketDomainException(
          "filled + remaining must equal amount: filled="
              + filled
              + ", remaining="
              + remaining
              + ", amount="
              + amount);
    }
    DomainChecks.requireOptionalNonNegative(averagePrice, "averagePrice");
    Objects.requireNonNull(status, "status must not be null");
    venueStatus =
        venueStatus == null || venueStatus.isBlank()
            ? status.code()
            : venueStatus.trim().toLowerCase(Locale.ROOT);
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    updatedAt = updatedAt == null ? createdAt : updatedAt;
  }

  public static Order pending(
      String id,
      String clientOrderId,
      String symbol,
      OrderType type,
      OrderSide side,
      BigDecimal price,
      BigDecimal stopPrice,
      BigDecimal amount,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return new Order(
        id,
        clientOrderId,
        symbol,
        type,
        side,
        price,
        stopPrice,
        DomainChecks.requirePositive(amount, "amount"),
        BigDecimal.ZERO,
        null,
        null,
        OrderStatus.PENDING,
        null,
        null,
        now,
        now,
        null);
  }

  public Order transitionTo(
      OrderStatus toStatus,
      BigDecimal nextFilled,
      BigDecimal nextAveragePrice,
      Fee nextFee,
      Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    OrderStateMachine.validateTransition(status, toStatus);
    BigDecimal safeFilled = nextFilled == null ? filled : nextFilled;
    if (safeFilled.compareTo(filled) < 0) {
      throw new MarketDomainException("filled must not decrease");
    }
    if (toStatus == OrderStatus.FILLED && safeFilled.compareTo(amount) != 0) {
      throw new MarketDomainException("filled order must have filled == amount");
    }
    return new Order(
        id,
        clientOrderId,
        symbol,
        type,
        side,
        price,
        stopPrice,
        amount,
        safeFilled,
        null,
        nextAveragePrice == null ? averagePrice : nextAveragePrice,
        toStatus,
        null,
        nextFee == null ? fee : nextFee,
        createdAt,
        now,
        raw);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public String statusCode() {
    return status == OrderStatus.UNKNOWN ? venueStatus : status.code();
  }
}
