package com.venuelink.integration.cryptocom;

final class CryptoComMethods {
  static final String GET_INSTRUMENTS = "public/get-instruments";
  static final String GET_TICKER = "public/get-ticker";
  static final String GET_BOOK = "public/get-book";
  static final String GET_TRADES = "public/get-trades";
  static final String GET_CANDLESTICK = "public/get-candlestick";
  static final String AUTH = "public/auth";
  static final String HEARTBEAT = "public/heartbeat";
  static final String RESPOND_HEARTBEAT = "public/respond-heartbeat";
  static final String GET_ACCOUNT_SUMMARY = "private/get-account-summary";
  static final String CREATE_ORDER = "private/create-order";
  static final String CANCEL_ORDER = "private/cancel-order";
  static final String GET_ORDER_DETAIL = "private/get-order-detail";
  static final String GET_OPEN_ORDERS = "private/get-open-orders";
  static final String GET_ORDER_HISTORY = "private/get-order-history";
  static final String SUBSCRIBE = "subscribe";
  static final String UNSUBSCRIBE = "unsubscribe";

  private CryptoComMethods() {}
}
