package com.venuelink.integration.gemini;

final class GeminiPaths {
  static final String SYMBOLS = "/v1/symbols";
  static final String SYMBOL_DETAILS_ALL = "/v1/symbols/details/all";
  static final String TICKER = "/v1/pubticker/";
  static final String BOOK = "/v1/book/";
  static final String TRADES = "/v1/trades/";
  static final String CANDLES = "/v2/candles/";
  static final String BALANCES = "/v1/balances";
  static final String ACCOUNT = "/v1/account";
  static final String NEW_ORDER = "/v1/order/new";
  static final String CANCEL_ORDER = "/v1/order/cancel";
  static final String ORDER_STATUS = "/v1/order/status";
  static final String ACTIVE_ORDERS = "/v1/orders";
  static final String ORDER_HISTORY = "/v1/orders/history";
  static final String MARKET_DATA = "/v2/marketdata";
  static final String ORDER_EVENTS = "/v1/order/events";

  private GeminiPaths() {}
}
