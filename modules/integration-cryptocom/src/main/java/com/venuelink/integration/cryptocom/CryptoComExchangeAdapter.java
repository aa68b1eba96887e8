package com.venuelink.integration.cryptocom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.AbstractExchangeAdapter;
import com.venuelink.adapter.core.AdapterCapability;
import com.venuelink.adapter.core.AdapterSettings;
import com.venuelink.adapter.core.MarketChannel;
import com.venuelink.adapter.core.OrderRequest;
import com.venuelink.adapter.core.RequestClass;
import com.venuelink.adapter.core.VenueResult;
import com.venuelink.adapter.core.error.InvalidSymbolException;
import com.venuelink.adapter.core.error.MalformedPayloadException;
import com.venuelink.adapter.core.error.OrderException;
import com.venuelink.adapter.core.http.VenueHttpTransport;
import com.venuelink.adapter.core.normalize.JsonFields;
import com.venuelink.adapter.core.retry.RetryAfterParser;
import com.venuelink.adapter.core.signing.NonceSource;
import com.venuelink.adapter.core.stream.WebSocketStreamManager;
import com.venuelink.adapter.core.telemetry.AdapterTelemetry;
import com.venuelink.adapter.core.telemetry.NoOpAdapterTelemetry;
import com.venuelink.domain.market.AccountInfo;
import com.venuelink.domain.market.BalanceSheet;
import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.Instrument;
import com.venuelink.domain.market.Order;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.OrderType;
import com.venuelink.domain.market.Position;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.Timeframe;
import com.venuelink.domain.market.Trade;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CryptoComExchangeAdapter extends AbstractExchangeAdapter {
  public static final String VENUE_ID = "cryptocom";

  public static final Set<AdapterCapability> CAPABILITIES =
      Set.copyOf(
          EnumSet.of(
              AdapterCapability.SPOT_TRADING,
              AdapterCapability.MARGIN_TRADING,
              AdapterCapability.WEBSOCKET_MARKET_DATA,
              AdapterCapability.WEBSOCKET_ACCOUNT_DATA,
              AdapterCapability.ORDER_BOOK_STREAMING,
              AdapterCapability.REAL_TIME_TRADES,
              AdapterCapability.HISTORICAL_DATA,
              AdapterCapability.STOP_ORDERS,
              AdapterCapability.ADVANCED_ORDERS));

  private static final Logger log = LoggerFactory.getLogger(CryptoComExchangeAdapter.class);
  private static final int DEFAULT_BOOK_DEPTH = 50;
  private static final int MAX_BOOK_DEPTH = 150;
  private static final int DEFAULT_LIMIT = 100;
  private static final int MAX_TRADES = 200;
  private static final int MAX_CANDLES = 300;
  private static final int MAX_ORDER_PAGE = 200;

  private final CryptoComConfig config;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final CryptoComSymbolCodec codec = new CryptoComSymbolCodec();
  private final CryptoComErrorClassifier classifier = new CryptoComErrorClassifier();
  private final CryptoComRequestSigner signer;
  private final CryptoComNormalizer normalizer;
  private final CryptoComRestClient client;
  private WebSocketStreamManager marketStream;
  private WebSocketStreamManager userStream;

  public CryptoComExchangeAdapter(AdapterSettings settings) {
    this(settings, CryptoComConfig.forEnvironment(settings.sandbox()), new NoOpAdapterTelemetry());
  }

  public CryptoComExchangeAdapter(
      AdapterSettings settings, CryptoComConfig config, AdapterTelemetry telemetry) {
    this(
        settings,
        config,
        HttpClient.newBuilder().connectTimeout(settings.timeout()).build(),
        new ObjectMapper(),
        telemetry);
  }

  public CryptoComExchangeAdapter(
      AdapterSettings settings,
      CryptoComConfig config,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      AdapterTelemetry telemetry) {
    super(
        VENUE_ID,
        "Crypto.com",
        CAPABILITIES,
        EnumSet.allOf(MarketChannel.class),
        settings,
        Objects.requireNonNull(config, "config is required").rateLimits(),
        telemetry);
    this.config = config;
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    JsonFields fields = new JsonFields(VENUE_ID, objectMapper);
    this.signer = new CryptoComRequestSigner(settings.credentials(), objectMapper);
    this.normalizer = new CryptoComNormalizer(fields, codec);
    this.client =
        new CryptoComRestClient(
            config.restBaseUri(),
            new VenueHttpTransport(VENUE_ID, httpClient, settings.timeout()),
            objectMapper,
            fields,
            signer,
            classifier,
            new NonceSource(clock),
            new RetryAfterParser(clock));
  }

  @Override
  protected List<Instrument> loadInstruments() {
    return normalizer.instruments(
        client.publicCall(CryptoComMethods.GET_INSTRUMENTS, Map.of(), null));
  }

  @Override
  protected void verifyCredentials() {
    client.privateCall(CryptoComMethods.GET_ACCOUNT_SUMMARY, Map.of(), null, null);
  }

  @Override
  protected void probe() {
    client.publicCall(CryptoComMethods.GET_INSTRUMENTS, Map.of(), null);
  }

  @Override
  public VenueResult<Ticker> getTicker(String symbol) {
    return execute(
        "get_ticker",
        RequestClass.PUBLIC,
        () -> {
          Instrument instrument = requireInstrument(symbol);
          JsonNode result =
              client.publicCall(
                  CryptoComMethods.GET_TICKER,
                  Map.of("instrument_name", instrument.venueSymbol()),
                  instrument.symbol());
          JsonNode data = result.get("data");
          JsonNode item = data != null && data.isArray() ? data.get(0) : data;
          if (item == null || item.isNull()) {
            throw new InvalidSymbolException(
                VENUE_ID, instrument.symbol(), "Crypto.com returned no ticker for " + symbol);
          }
          return normalizer.ticker(item, now());
        });
  }

  @Override
  public VenueResult<OrderBookSnapshot> getOrderBook(String symbol, int depth) {
    int boundedDepth = boundedLimit(depth, DEFAULT_BOOK_DEPTH, MAX_BOOK_DEPTH);
    return execute(
        "get_order_book",
        RequestClass.PUBLIC,
        () -> {
          Instrument instrument = requireInstrument(symbol);
          Map<String, Object> params = new LinkedHashMap<>();
          params.put("instrument_name", instrument.venueSymbol());
          params.put("depth", boundedDepth);
          JsonNode result =
              client.publicCall(CryptoComMethods.GET_BOOK, params, instrument.symbol());
          return normalizer
              .orderBook(normalizer.bookData(result), instrument.symbol(), now())
              .limit(boundedDepth);
        });
  }

  @Override
  public VenueResult<List<Trade>> getTrades(String symbol, int limit) {
    int boundedLimit = boundedLimit(limit, DEFAULT_LIMIT, MAX_TRADES);
    return execute(
        "get_trades",
        RequestClass.PUBLIC,
        () -> {
          Instrument instrument = requireInstrument(symbol);
          JsonNode result =
              client.publicCall(
                  CryptoComMethods.GET_TRADES,
                  Map.of("instrument_name", instrument.venueSymbol()),
                  instrument.symbol());
          return tail(normalizer.trades(result, instrument.symbol()), boundedLimit);
        });
  }

  @Override
  public VenueResult<List<Candle>> getCandles(String symbol, Timeframe timeframe, int limit) {
    Objects.requireNonNull(timeframe, "timeframe must not be null");
    String interval = CryptoComMappings.timeframe(timeframe);
    int boundedLimit = boundedLimit(limit, DEFAULT_LIMIT, MAX_CANDLES);
    return execute(
        "get_candles",
        RequestClass.PUBLIC,
        () -> {
          Instrument instrument = requireInstrument(symbol);
          Map<String, Object> params = new LinkedHashMap<>();
          params.put("instrument_name", instrument.venueSymbol());
          params.put("timeframe", interval);
          JsonNode result =
              client.publicCall(CryptoComMethods.GET_CANDLESTICK, params, instrument.symbol());
          return tail(normalizer.candles(result), boundedLimit);
        });
  }

  @Override
  public VenueResult<BalanceSheet> getBalance() {
    return execute("get_balance", RequestClass.PRIVATE, this::fetchBalances);
  }

  @Override
  public VenueResult<List<Position>> getPositions() {
    return execute("get_positions", RequestClass.PRIVATE, () -> positionsFrom(fetchBalances()));
  }

  @Override
  public VenueResult<AccountInfo> getAccountInfo() {
    return execute(
        "get_account_info",
        RequestClass.PRIVATE,
        () -> {
          BalanceSheet balances = fetchBalances();
          return new AccountInfo(
              "spot",
              "spot",
              true,
              Set.of("read", "trade"),
              balances,
              positionsFrom(balances),
              balances.timestamp());
        });
  }

  @Override
  public VenueResult<Order> createOrder(OrderRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    String venueType = CryptoComMappings.venueOrderType(request.type());
    return execute(
        "create_order",
        RequestClass.PRIVATE,
        () -> {
          Instrument instrument = requireInstrument(request.symbol());
          if (instrument.minAmount() != null
              && request.amount().compareTo(instrument.minAmount()) < 0) {
            throw new OrderException(
                VENUE_ID,
                "Order amount "
                    + request.amount().toPlainString()
                    + " is below the "
                    + instrument.symbol()
                    + " minimum of "
                    + instrument.minAmount().toPlainString());
          }
          JsonNode result =
              client.privateCall(
                  CryptoComMethods.CREATE_ORDER,
                  orderParams(instrument, request, venueType),
                  instrument.symbol(),
                  null);
          String orderId = requiredText(result, "order_id");
          String clientOrderId =
              result.hasNonNull("client_oid")
                  ? result.get("client_oid").asText()
                  : request.clientOrderId();
          log.info(
              "Crypto.com order accepted order_id={} symbol={} side={} type={}",
              orderId,
              instrument.symbol(),
              request.side(),
              request.type());
          return Order.pending(
              orderId,
              clientOrderId,
              instrument.symbol(),
              request.type(),
              request.side(),
              request.price(),
              request.stopPrice(),
              request.amount(),
              now());
        });
  }

  @Override
  public VenueResult<Order> cancelOrder(String orderId, String symbol) {
    requireOrderId(orderId);
    return execute(
        "cancel_order",
        RequestClass.PRIVATE,
        () -> {
          Instrument instrument = requireInstrument(symbol);
          Map<String, Object> params = new LinkedHashMap<>();
          params.put("instrument_name", instrument.venueSymbol());
          params.put("order_id", orderId);
          client.privateCall(CryptoComMethods.CANCEL_ORDER, params, instrument.symbol(), orderId);
          return fetchOrder(orderId, instrument.symbol());
        });
  }

  @Override
  public VenueResult<Order> getOrder(String orderId, String symbol) {
    requireOrderId(orderId);
    return execute(
        "get_order",
        RequestClass.PRIVATE,
        () -> fetchOrder(orderId, symbol == null ? null : requireInstrument(symbol).symbol()));
  }

  @Override
  public VenueResult<List<Order>> getOrders(String symbol, OrderStatus status, int limit) {
    int pageSize = boundedLimit(limit, DEFAULT_LIMIT, MAX_ORDER_PAGE);
    return execute(
        "get_orders",
        RequestClass.PRIVATE,
        () -> {
          String method =
              status != null && status.isTerminal()
                  ? CryptoComMethods.GET_ORDER_HISTORY
                  : CryptoComMethods.GET_OPEN_ORDERS;
          List<Order> orders = listOrders(method, symbol, pageSize);
          if (status == null) {
            return orders;
          }
          List<Order> matching = new ArrayList<>();
          for (Order order : orders) {
            if (order.status() == status) {
              matching.add(order);
            }
          }
          return List.copyOf(matching);
        });
  }

  @Override
  public VenueResult<List<Order>> getOrderHistory(String symbol, int limit) {
    int pageSize = boundedLimit(limit, DEFAULT_LIMIT, MAX_ORDER_PAGE);
    return execute(
        "get_order_history",
        RequestClass.PRIVATE,
        () -> listOrders(CryptoComMethods.GET_ORDER_HISTORY, symbol, pageSize));
  }

  @Override
  public void subscribeToMarketData(Collection<String> symbols, Set<MarketChannel> channels) {
    Objects.requireNonNull(symbols, "symbols must not be null");
    Objects.requireNonNull(channels, "channels must not be null");
    Set<String> names = new LinkedHashSet<>();
    for (String symbol : symbols) {
      Instrument instrument = requireInstrument(symbol);
      for (MarketChannel channel : channels) {
        names.add(CryptoComMarketStreamProtocol.channelName(channel, instrument.venueSymbol()));
      }
    }
    if (names.isEmpty()) {
      return;
    }
    WebSocketStreamManager stream = marketStream();
    stream.subscribe(names);
    stream.open();
  }

  @Override
  public void unsubscribeFromMarketData(Collection<String> symbols) {
    Objects.requireNonNull(symbols, "symbols must not be null");
    WebSocketStreamManager stream;
    synchronized (this) {
      stream = marketStream;
    }
    if (stream == null) {
      return;
    }
    Set<String> names = new LinkedHashSet<>();
    for (String symbol : symbols) {
      String venueSymbol = codec.toVenue(canonicalSymbol(symbol));
      for (MarketChannel channel : MarketChannel.values()) {
        names.add(CryptoComMarketStreamProtocol.channelName(channel, venueSymbol));
      }
    }
    stream.unsubscribe(names);
  }

  @Override
  public void subscribeToOrderUpdates() {
    connection.requireAuthenticated();
    WebSocketStreamManager stream = userStream();
    stream.subscribe(Set.of(CryptoComUserStreamProtocol.ORDER_CHANNEL));
    stream.open();
  }

  @Override
  public synchronized void unsubscribeFromOrderUpdates() {
    if (userStream != null) {
      userStream.close();
      userStream = null;
    }
  }

  @Override
  protected synchronized void closeStreams() {
    if (marketStream != null) {
      marketStream.close();
      marketStream = null;
    }
    if (userStream != null) {
      userStream.close();
      userStream = null;
    }
  }

  private synchronized WebSocketStreamManager marketStream() {
    if (marketStream == null) {
      marketStream =
          new WebSocketStreamManager(
              VENUE_ID,
              "market",
              httpClient,
              objectMapper,
              config.marketStream(),
              new CryptoComMarketStreamProtocol(objectMapper, normalizer, codec, classifier, clock),
              eventBus,
              telemetry,
              clock);
    }
    return marketStream;
  }

  private synchronized WebSocketStreamManager userStream() {
    if (userStream == null) {
      userStream =
          new WebSocketStreamManager(
              VENUE_ID,
              "user",
              httpClient,
              objectMapper,
              config.userStream(),
              new CryptoComUserStreamProtocol(objectMapper, normalizer, signer, classifier, clock),
              eventBus,
              telemetry,
              clock);
    }
    return userStream;
  }

  private BalanceSheet fetchBalances() {
    JsonNode result =
        client.privateCall(CryptoComMethods.GET_ACCOUNT_SUMMARY, Map.of(), null, null);
    return normalizer.balances(result, now());
  }

  private Order fetchOrder(String orderId, String symbol) {
    JsonNode result =
        client.privateCall(
            CryptoComMethods.GET_ORDER_DETAIL, Map.of("order_id", orderId), symbol, orderId);
    JsonNode info = result.get("order_info");
    return normalizer.order(info == null ? result : info, now());
  }

  private List<Order> listOrders(String method, String symbol, int pageSize) {
    Map<String, Object> params = new LinkedHashMap<>();
    String canonical = null;
    if (symbol != null) {
      Instrument instrument = requireInstrument(symbol);
      canonical = instrument.symbol();
      params.put("instrument_name", instrument.venueSymbol());
    }
    params.put("page_size", pageSize);
    JsonNode result = client.privateCall(method, params, canonical, null);
    return tail(normalizer.orders(result, now()), pageSize);
  }

  private Map<String, Object> orderParams(
      Instrument instrument, OrderRequest request, String venueType) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("instrument_name", instrument.venueSymbol());
    params.put("side", request.side().name());
    params.put("type", venueType);
    params.put("quantity", request.amount().toPlainString());
    if (request.price() != null && request.type().requiresPrice()) {
      params.put("price", request.price().toPlainString());
    }
    if (request.stopPrice() != null && request.type().requiresStopPrice()) {
      params.put("trigger_price", request.stopPrice().toPlainString());
    }
    if (request.clientOrderId() != null) {
      params.put("client_oid", request.clientOrderId());
    }
    if (request.type() != OrderType.MARKET) {
      String timeInForce = CryptoComMappings.timeInForce(request.timeInForce());
      if (timeInForce == null) {
        params.put("exec_inst", CryptoComMappings.POST_ONLY);
      } else {
        params.put("time_in_force", timeInForce);
      }
    }
    return params;
  }

  private static String requiredText(JsonNode result, String field) {
    JsonNode value = result.get(field);
    if (value == null || value.isNull() || value.asText().isBlank()) {
      throw new MalformedPayloadException(
          VENUE_ID, "Crypto.com create-order response missing " + field);
    }
    return value.asText();
  }
}
