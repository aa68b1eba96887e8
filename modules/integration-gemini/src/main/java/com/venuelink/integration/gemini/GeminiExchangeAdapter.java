package com.venuelink.integration.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.AbstractExchangeAdapter;
import com.venuelink.adapter.core.AdapterCapability;
import com.venuelink.adapter.core.AdapterSettings;
import com.venuelink.adapter.core.MarketChannel;
import com.venuelink.adapter.core.OrderRequest;
import com.venuelink.adapter.core.RequestClass;
import com.venuelink.adapter.core.VenueResult;
import com.venuelink.adapter.core.error.MalformedPayloadException;
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
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GeminiExchangeAdapter extends AbstractExchangeAdapter {
  public static final String VENUE_ID = "gemini";

  public static final Set<AdapterCapability> CAPABILITIES =
      Set.copyOf(
          EnumSet.of(
              AdapterCapability.SPOT_TRADING,
              AdapterCapability.WEBSOCKET_MARKET_DATA,
              AdapterCapability.WEBSOCKET_ACCOUNT_DATA,
              AdapterCapability.ORDER_BOOK_STREAMING,
              AdapterCapability.REAL_TIME_TRADES,
              AdapterCapability.HISTORICAL_DATA,
              AdapterCapability.STOP_ORDERS));

  private static final Logger log = LoggerFactory.getLogger(GeminiExchangeAdapter.class);
  private static final Set<MarketChannel> MARKET_CHANNELS =
      EnumSet.of(MarketChannel.ORDER_BOOK, MarketChannel.TRADES);
  private static final int DEFAULT_BOOK_DEPTH = 50;
  private static final int MAX_BOOK_DEPTH = 500;
  private static final int DEFAULT_LIMIT = 100;
  private static final int MAX_TRADES = 500;
  private static final int MAX_CANDLES = 1440;
  private static final int MAX_ORDER_PAGE = 500;

  private final GeminiConfig config;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final GeminiSymbolCodec codec = new GeminiSymbolCodec();
  private final GeminiErrorClassifier classifier = new GeminiErrorClassifier();
  private final GeminiRequestSigner signer;
  private final GeminiNormalizer normalizer;
  private final GeminiRestClient client;
  private final NonceSource nonces;
  private WebSocketStreamManager marketStream;
  private GeminiMarketStreamProtocol marketProtocol;
  private WebSocketStreamManager orderStream;

  public GeminiExchangeAdapter(AdapterSettings settings) {
    this(settings, GeminiConfig.forEnvironment(settings.sandbox()), new NoOpAdapterTelemetry());
  }

  public GeminiExchangeAdapter(
      AdapterSettings settings, GeminiConfig config, AdapterTelemetry telemetry) {
    this(
        settings,
        config,
        HttpClient.newBuilder().connectTimeout(settings.timeout()).build(),
        new ObjectMapper(),
        telemetry);
  }

  public GeminiExchangeAdapter(
      AdapterSettings settings,
      GeminiConfig config,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      AdapterTelemetry telemetry) {
    super(
        VENUE_ID,
        "Gemini",
        CAPABILITIES,
        MARKET_CHANNELS,
        settings,
        Objects.requireNonNull(config, "config is required").rateLimits(),
        telemetry);
    this.config = config;
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    JsonFields fields = new JsonFields(VENUE_ID, objectMapper);
    this.signer = new GeminiRequestSigner(settings.credentials(), objectMapper);
    this.normalizer = new GeminiNormalizer(fields, codec);
    this.nonces = new NonceSource(clock);
    this.client =
        new GeminiRestClient(
            config.restBaseUri(),
            new VenueHttpTransport(VENUE_ID, httpClient, settings.timeout()),
            fields,
            signer,
            classifier,
            nonces,
            new RetryAfterParser(clock));
  }

  /**
   * Loads every listing from {@code /v1/symbols/details/all} in one request, keeping only the
   * configured symbols when a subset is set.
   */
  @Override
  protected List<Instrument> loadInstruments() {
    JsonNode listings = client.get(GeminiPaths.SYMBOL_DETAILS_ALL, Map.of(), null);
    if (!listings.isArray()) {
      throw new MalformedPayloadException(VENUE_ID, "Gemini symbol details must be an array");
    }
    Set<String> wanted = config.symbols();
    List<Instrument> instruments = new ArrayList<>(listings.size());
    for (JsonNode details : listings) {
      Instrument instrument = normalizer.instrument(details);
      if (wanted.isEmpty() || wanted.contains(instrument.symbol())) {
        instruments.add(instrument);
      }
    }
    if (!wanted.isEmpty() && instruments.size() < wanted.size()) {
      Set<String> missing = new LinkedHashSet<>(wanted);
      instruments.forEach(instrument -> missing.remove(instrument.symbol()));
      log.warn("Configured Gemini symbols are not listed symbols={}", missing);
    }
    codec.register(instruments);
    log.debug("Loaded Gemini symbol details count={}", instruments.size());
    return instruments;
  }

  @Override
  protected void verifyCredentials() {
    client.post(GeminiPaths.BALANCES, Map.of(), null, null);
  }

  @Override
  protected void probe() {
    client.get(GeminiPaths.SYMBOLS, Map.of(), null);
  }

  @Override
  public VenueResult<Ticker> getTicker(String symbol) {
    return execute(
        "get_ticker",
        RequestClass.PUBLIC,
        () -> {
          Instrument instrument = requireInstrument(symbol);
          JsonNode body =
              client.get(
                  GeminiPaths.TICKER + instrument.venueSymbol(), Map.of(), instrument.symbol());
          return normalizer.ticker(body, instrument.symbol(), now());
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
          Map<String, Object> query = new LinkedHashMap<>();
          query.put("limit_bids", boundedDepth);
          query.put("limit_asks", boundedDepth);
          JsonNode body =
              client.get(GeminiPaths.BOOK + instrument.venueSymbol(), query, instrument.symbol());
          return normalizer.orderBook(body, instrument.symbol(), now()).limit(boundedDepth);
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
          JsonNode body =
              client.get(
                  GeminiPaths.TRADES + instrument.venueSymbol(),
                  Map.of("limit_trades", boundedLimit),
                  instrument.symbol());
          return tail(normalizer.trades(body, instrument.symbol()), boundedLimit);
        });
  }

  @Override
  public VenueResult<List<Candle>> getCandles(String symbol, Timeframe timeframe, int limit) {
    Objects.requireNonNull(timeframe, "timeframe must not be null");
    String interval = GeminiMappings.timeframe(timeframe);
    int boundedLimit = boundedLimit(limit, DEFAULT_LIMIT, MAX_CANDLES);
    return execute(
        "get_candles",
        RequestClass.PUBLIC,
        () -> {
          Instrument instrument = requireInstrument(symbol);
          JsonNode body =
              client.get(
                  GeminiPaths.CANDLES + instrument.venueSymbol() + "/" + interval,
                  Map.of(),
                  instrument.symbol());
          return tail(normalizer.candles(body), boundedLimit);
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
          JsonNode account = client.post(GeminiPaths.ACCOUNT, Map.of(), null, null).path("account");
          admit(RequestClass.PRIVATE);
          BalanceSheet balances = fetchBalances();
          String accountId = account.path("shortName").asText("");
          if (accountId.isBlank()) {
            accountId = account.path("accountName").asText("primary");
          }
          return new AccountInfo(
              accountId,
              account.path("type").asText("exchange"),
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
    String venueType = GeminiMappings.venueOrderType(request.type());
    return execute(
        "create_order",
        RequestClass.PRIVATE,
        () -> {
          Instrument instrument = requireInstrument(request.symbol());
          JsonNode body =
              client.post(
                  GeminiPaths.NEW_ORDER,
                  orderParams(instrument, request, venueType),
                  instrument.symbol(),
                  null);
          Order order = normalizer.order(body, now());
          log.info(
              "Gemini order accepted order_id={} symbol={} side={} type={} status={}",
              order.id(),
              order.symbol(),
              order.side(),
              order.type(),
              order.statusCode());
          return order;
        });
  }

  @Override
  public VenueResult<Order> cancelOrder(String orderId, String symbol) {
    requireOrderId(orderId);
    return execute(
        "cancel_order",
        RequestClass.PRIVATE,
        () -> {
          String canonical = symbol == null ? null : requireInstrument(symbol).symbol();
          JsonNode body =
              client.post(
                  GeminiPaths.CANCEL_ORDER,
                  Map.of("order_id", orderIdParam(orderId)),
                  canonical,
                  orderId);
          return normalizer.order(body, now());
        });
  }

  @Override
  public VenueResult<Order> getOrder(String orderId, String symbol) {
    requireOrderId(orderId);
    return execute(
        "get_order",
        RequestClass.PRIVATE,
        () -> {
          String canonical = symbol == null ? null : requireInstrument(symbol).symbol();
          JsonNode body =
              client.post(
                  GeminiPaths.ORDER_STATUS,
                  Map.of("order_id", orderIdParam(orderId)),
                  canonical,
                  orderId);
          return normalizer.order(body, now());
        });
  }

  @Override
  public VenueResult<List<Order>> getOrders(String symbol, OrderStatus status, int limit) {
    int pageSize = boundedLimit(limit, DEFAULT_LIMIT, MAX_ORDER_PAGE);
    return execute(
        "get_orders",
        RequestClass.PRIVATE,
        () -> {
          String canonical = symbol == null ? null : requireInstrument(symbol).symbol();
          List<Order> orders =
              status != null && status.isTerminal()
                  ? history(canonical, pageSize)
                  : normalizer.orders(
                      client.post(GeminiPaths.ACTIVE_ORDERS, Map.of(), canonical, null), now());
          List<Order> matching = new ArrayList<>();
          for (Order order : orders) {
            if ((canonical == null || canonical.equals(order.symbol()))
                && (status == null || order.status() == status)) {
              matching.add(order);
            }
          }
          return tail(matching, pageSize);
        });
  }

  @Override
  public VenueResult<List<Order>> getOrderHistory(String symbol, int limit) {
    int pageSize = boundedLimit(limit, DEFAULT_LIMIT, MAX_ORDER_PAGE);
    return execute(
        "get_order_history",
        RequestClass.PRIVATE,
        () -> history(symbol == null ? null : requireInstrument(symbol).symbol(), pageSize));
  }

  @Override
  public void subscribeToMarketData(Collection<String> symbols, Set<MarketChannel> channels) {
    Objects.requireNonNull(symbols, "symbols must not be null");
    Objects.requireNonNull(channels, "channels must not be null");
    Set<MarketChannel> supported = EnumSet.noneOf(MarketChannel.class);
    for (MarketChannel channel : channels) {
      if (MARKET_CHANNELS.contains(channel)) {
        supported.add(channel);
      } else {
        log.debug("Gemini has no {} stream, skipping", channel.code());
      }
    }
    if (supported.isEmpty()) {
      return;
    }
    Set<String> streamSymbols = new LinkedHashSet<>();
    for (String symbol : symbols) {
      streamSymbols.add(
          GeminiMarketStreamProtocol.streamSymbol(requireInstrument(symbol).venueSymbol()));
    }
    if (streamSymbols.isEmpty()) {
      return;
    }
    WebSocketStreamManager stream;
    GeminiMarketStreamProtocol protocol;
    synchronized (this) {
      stream = marketStream();
      protocol = marketProtocol;
    }
    for (String streamSymbol : streamSymbols) {
      protocol.request(streamSymbol, supported);
    }
    stream.subscribe(streamSymbols);
    stream.open();
  }

  @Override
  public void unsubscribeFromMarketData(Collection<String> symbols) {
    Objects.requireNonNull(symbols, "symbols must not be null");
    WebSocketStreamManager stream;
    GeminiMarketStreamProtocol protocol;
    synchronized (this) {
      stream = marketStream;
      protocol = marketProtocol;
    }
    if (stream == null) {
      return;
    }
    Set<String> streamSymbols = new LinkedHashSet<>();
    for (String symbol : symbols) {
      streamSymbols.add(
          GeminiMarketStreamProtocol.streamSymbol(codec.toVenue(canonicalSymbol(symbol))));
    }
    stream.unsubscribe(streamSymbols);
    streamSymbols.forEach(protocol::release);
  }

  @Override
  public void subscribeToOrderUpdates() {
    connection.requireAuthenticated();
    WebSocketStreamManager stream = orderStream();
    stream.subscribe(Set.of(GeminiOrderStreamProtocol.ORDERS_CHANNEL));
    stream.open();
  }

  @Override
  public synchronized void unsubscribeFromOrderUpdates() {
    if (orderStream != null) {
      orderStream.close();
      orderStream = null;
    }
  }

  @Override
  protected synchronized void closeStreams() {
    if (marketStream != null) {
      marketStream.close();
      marketStream = null;
      marketProtocol = null;
    }
    if (orderStream != null) {
      orderStream.close();
      orderStream = null;
    }
  }

  private synchronized WebSocketStreamManager marketStream() {
    if (marketStream == null) {
      marketProtocol =
          new GeminiMarketStreamProtocol(
              objectMapper, normalizer, codec, classifier, clock, config.bookDepth());
      marketStream =
          new WebSocketStreamManager(
              VENUE_ID,
              "market",
              httpClient,
              objectMapper,
              config.marketStream(),
              marketProtocol,
              eventBus,
              telemetry,
              clock);
    }
    return marketStream;
  }

  private synchronized WebSocketStreamManager orderStream() {
    if (orderStream == null) {
      orderStream =
          new WebSocketStreamManager(
              VENUE_ID,
              "orders",
              httpClient,
              objectMapper,
              config.orderStream(),
              new GeminiOrderStreamProtocol(normalizer, signer, nonces, clock),
              eventBus,
              telemetry,
              clock);
    }
    return orderStream;
  }

  private BalanceSheet fetchBalances() {
    return normalizer.balances(client.post(GeminiPaths.BALANCES, Map.of(), null, null), now());
  }

  private List<Order> history(String canonical, int pageSize) {
    Map<String, Object> params = new LinkedHashMap<>();
    if (canonical != null) {
      params.put("symbol", codec.toVenue(canonical));
    }
    params.put("limit_orders", pageSize);
    JsonNode body = client.post(GeminiPaths.ORDER_HISTORY, params, canonical, null);
    return normalizer.orders(body, now());
  }

  private Map<String, Object> orderParams(
      Instrument instrument, OrderRequest request, String venueType) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("symbol", instrument.venueSymbol());
    params.put("amount", request.amount().toPlainString());
    if (request.price() != null) {
      params.put("price", request.price().toPlainString());
    }
    params.put("side", request.side().name().toLowerCase(Locale.ROOT));
    params.put("type", venueType);
    if (request.stopPrice() != null && request.type().requiresStopPrice()) {
      params.put("stop_price", request.stopPrice().toPlainString());
    }
    if (request.clientOrderId() != null) {
      params.put("client_order_id", request.clientOrderId());
    }
    String option = GeminiMappings.executionOption(request.timeInForce());
    if (option != null) {
      params.put("options", List.of(option));
    }
    return params;
  }

  private static Object orderIdParam(String orderId) {
    try {
      return Long.parseLong(orderId.trim());
    } catch (NumberFormatException ex) {
      return orderId.trim();
    }
  }
}
