package com.venuelink.adapter.core;

import com.venuelink.adapter.core.error.OrderException;
import com.venuelink.domain.market.CanonicalSymbol;
import com.venuelink.domain.market.OrderSide;
import com.venuelink.domain.market.OrderType;
import com.venuelink.domain.market.TimeInForce;
import java.math.BigDecimal;
import java.util.Objects;

public record OrderRequest(
    String symbol,
    OrderSide side,
    OrderType type,
    BigDecimal amount,
    BigDecimal price,
    BigDecimal stopPrice,
    TimeInForce timeInForce,
    String clientOrderId) {
  public OrderRequest {
    if (!CanonicalSymbol.isValid(symbol)) {
      throw new OrderException(null, "symbol must be BASE/QUOTE: " + symbol);
    }
    symbol = CanonicalSymbol.parse(symbol).toString();
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(type, "type must not be null");
    if (amount == null || amount.signum() <= 0) {
      throw new OrderException(null, "Order amount must be positive");
    }
    if (type.requiresPrice() && (price == null || price.signum() <= 0)) {
      throw new OrderException(null, "Price is required for " + type.code() + " orders");
    }
    if (type.requiresStopPrice() && (stopPrice == null || stopPrice.signum() <= 0)) {
      throw new OrderException(null, "Stop price is required for " + type.code() + " orders");
    }
    timeInForce = timeInForce == null ? TimeInForce.GTC : timeInForce;
    clientOrderId = clientOrderId == null || clientOrderId.isBlank() ? null : clientOrderId.trim();
  }

  public static OrderRequest market(String symbol, OrderSide side, BigDecimal amount) {
    return new OrderRequest(symbol, side, OrderType.MARKET, amount, null, null, null, null);
  }

  public static OrderRequest limit(
      String symbol, OrderSide side, BigDecimal amount, BigDecimal price) {
    return new OrderRequest(symbol, side, OrderType.LIMIT, amount, price, null, null, null);
  }

  public OrderRequest withClientOrderId(String value) {
    return new OrderRequest(symbol, side, type, amount, price, stopPrice, timeInForce, value);
  }
}
