package com.venuelink.adapter.core;

import com.venuelink.adapter.core.event.AdapterEventBus;
import com.venuelink.adapter.core.ratelimit.RateLimitPolicy;
import com.venuelink.domain.market.AccountInfo;
import com.venuelink.domain.market.BalanceSheet;
import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.Instrument;
import com.venuelink.domain.market.Order;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.Position;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.Timeframe;
import com.venuelink.domain.market.Trade;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

public interface ExchangeAdapter extends AutoCloseable {
  String venueId();

  String venueName();

  Set<AdapterCapability> capabilities();

  default boolean supports(AdapterCapability capability) {
    return capabilities().contains(capability);
  }

  Set<MarketChannel> marketChannels();

  ConnectionState connectionState();

  AdapterEventBus events();

  RateLimitPolicy rateLimits();

  Map<String, Instrument> instruments();

  List<String> supportedSymbols();

  void connect();

  void disconnect();

  void authenticate();

  boolean validateCredentials();

  HealthStatus healthCheck();

  VenueResult<Ticker> getTicker(String symbol);

  VenueResult<OrderBookSnapshot> getOrderBook(String symbol, int depth);

  VenueResult<List<Trade>> getTrades(String symbol, int limit);

  VenueResult<List<Candle>> getCandles(String symbol, Timeframe timeframe, int limit);

  VenueResult<BalanceSheet> getBalance();

  VenueResult<List<Position>> getPositions();

  VenueResult<AccountInfo> getAccountInfo();

  VenueResult<Order> createOrder(OrderRequest request);

  VenueResult<Order> cancelOrder(String orderId, String symbol);

  VenueResult<Order> getOrder(String orderId, String symbol);

  VenueResult<List<Order>> getOrders(String symbol, OrderStatus status, int limit);

  VenueResult<List<Order>> getOrderHistory(String symbol, int limit);

  void subscribeToMarketData(Collection<String> symbols, Set<MarketChannel> channels);

  default void subscribeToMarketData(Collection<String> symbols) {
    subscribeToMarketData(symbols, marketChannels());
  }

  void unsubscribeFromMarketData(Collection<String> symbols);

  void subscribeToOrderUpdates();

  void unsubscribeFromOrderUpdates();

  @Override
  default void close() {
    disconnect();
  }
}
