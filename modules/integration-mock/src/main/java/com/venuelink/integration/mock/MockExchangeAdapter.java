package com.venuelink.integration.mock;

import com.venuelink.adapter.core.AbstractExchangeAdapter;
import com.venuelink.adapter.core.AdapterCapability;
import com.venuelink.adapter.core.AdapterSettings;
import com.venuelink.adapter.core.MarketChannel;
import com.venuelink.adapter.core.OrderRequest;
import com.venuelink.adapter.core.RequestClass;
import com.venuelink.adapter.core.VenueResult;
import com.venuelink.adapter.core.error.AuthenticationException;
import com.venuelink.adapter.core.error.ConnectionException;
import com.venuelink.adapter.core.error.ErrorKind;
import com.venuelink.adapter.core.error.ExchangeException;
import com.venuelink.adapter.core.error.InsufficientFundsException;
import com.venuelink.adapter.core.error.OrderException;
import com.venuelink.adapter.core.error.RateLimitException;
import com.venuelink.adapter.core.event.MarketUpdate;
import com.venuelink.adapter.core.event.OrderUpdate;
import com.venuelink.adapter.core.retry.BackoffPolicy;
import com.venuelink.adapter.core.retry.RetryExecutor;
import com.venuelink.adapter.core.telemetry.AdapterTelemetry;
import com.venuelink.adapter.core.telemetry.NoOpAdapterTelemetry;
import com.venuelink.domain.market.AccountInfo;
import com.venuelink.domain.market.BalanceSheet;
import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.CanonicalSymbol;
import com.venuelink.domain.market.Instrument;
import com.venuelink.domain.market.MarketPayload;
import com.venuelink.domain.market.MarketType;
import com.venuelink.domain.market.Order;
import com.venuelink.domain.market.OrderBookSnapshot;
import com.venuelink.domain.market.OrderSide;
import com.venuelink.domain.market.OrderStateMachine;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.OrderType;
import com.venuelink.domain.market.Position;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.Timeframe;
import com.venuelink.domain.market.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process venue for paper trading and tests. Prices follow a random walk, orders fill on a
 * timer against a reserved-funds ledger, and every call pays a simulated latency and may fail at
 * the configured rates.
 */
public class MockExchangeAdapter extends AbstractExchangeAdapter {
  public static final String VENUE_ID = "mock";
  public static final String ACCOUNT_ID = "mock_account_123";

  public static final Set<AdapterCapability> CAPABILITIES =
      Set.copyOf(
          EnumSet.of(
              AdapterCapability.SPOT_TRADING,
              AdapterCapability.WEBSOCKET_MARKET_DATA,
              AdapterCapability.WEBSOCKET_ACCOUNT_DATA,
              AdapterCapability.ORDER_BOOK_STREAMING,
              AdapterCapability.REAL_TIME_TRADES,
              AdapterCapability.HISTORICAL_DATA,
              AdapterCapability.PAPER_TRADING,
              AdapterCapability.ADVANCED_ORDERS,
              AdapterCapability.STOP_ORDERS));

  private static final Logger log = LoggerFactory.getLogger(MockExchangeAdapter.class);
  private static final Set<MarketChannel> MARKET_CHANNELS = EnumSet.allOf(MarketChannel.class);
  private static final int DEFAULT_LIMIT = 100;
  private static final int MAX_CANDLES = 1000;
  private static final int MAX_ORDER_PAGE = 500;
  private static final int AMOUNT_SCALE = 8;
  private static final BigDecimal MIN_AMOUNT = new BigDecimal("0.0001");

  private final MockConfig config;
  private final Random random;
  private final MockMarket market;
  private final MockLedger ledger;
  private final Map<String, MockOrder> orders = new LinkedHashMap<>();
  private final Map<String, Set<MarketChannel>> marketSubscriptions = new ConcurrentHashMap<>();
  private final AtomicLong orderSequence = new AtomicLong(0L);
  private volatile boolean orderUpdatesSubscribed;
  private ScheduledExecutorService scheduler;
  private boolean streamsClosed;

  public MockExchangeAdapter(AdapterSettings settings) {
    this(settings, MockConfig.defaults(), new NoOpAdapterTelemetry());
  }

  public MockExchangeAdapter(
      AdapterSettings settings, MockConfig config, AdapterTelemetry telemetry) {
    super(
        VENUE_ID,
        "Mock Exchange",
        CAPABILITIES,
        MARKET_CHANNELS,
        settings,
        Objects.requireNonNull(config, "config is required").rateLimits(),
        telemetry);
    this.config = config;
    this.random = config.seed() == null ? new Random() : new Random(config.seed());
    this.market = new MockMarket(config.prices(), random, clock.instant());
    this.ledger = new MockLedger(VENUE_ID, config.balances());
  }

  public MockConfig config() {
    return config;
  }

  @Override
  protected List<Instrument> loadInstruments() {
    synchronized (this) {
      streamsClosed = false;
    }
    simulateLatency();
    maybeFail(
        config.failureRates().connection(),
        () -> new ConnectionException(VENUE_ID, "Simulated connection failure"));
    List<Instrument> instruments = new ArrayList<>();
    for (String symbol : config.prices().keySet()) {
      instruments.add(
          new Instrument(
              symbol,
              symbol,
              null,
              null,
              true,
              MarketType.SPOT,
              AMOUNT_SCALE,
              AMOUNT_SCALE,
              MIN_AMOUNT,
              null,
              null,
              null));
    }
    return instruments;
  }

  @Override
  protected void verifyCredentials() {
    simulateLatency();
    maybeFail(
        config.failureRates().authentication(),
        () -> new AuthenticationException(VENUE_ID, "Simulated authentication failure"));
  }

  @Override
  protected void probe() {
    simulateLatency();
  }

  @Override
  protected void closeStreams() {
    ScheduledExecutorService current;
    synchronized (this) {
      current = scheduler;
      scheduler = null;
      streamsClosed = true;
    }
    marketSubscriptions.clear();
    orderUpdatesSubscribed = false;
    if (current != null) {
      int cancelled = current.shutdownNow().size();
      log.info("Mock simulator stopped venue={} cancelled_tasks={}", VENUE_ID, cancelled);
    }
  }

  @Override
  protected <T> VenueResult<T> execute(
      String operation, RequestClass requestClass, Supplier<T> call) {
    return super.execute(
        operation,
        requestClass,
        () -> {
          simulateLatency();
          maybeFail(
              config.failureRates().rateLimit(),
              () ->
                  new RateLimitException(
                      VENUE_ID, "Simulated rate limit rejection", Duration.ofSeconds(60)));
          return call.get();
        });
  }

  @Override
  public VenueResult<Ticker> getTicker(String symbol) {
    return execute(
        "get_ticker",
        RequestClass.PUBLIC,
        () -> market.ticker(requireInstrument(symbol).symbol(), now()));
  }

  @Override
  public VenueResult<OrderBookSnapshot> getOrderBook(String symbol, int depth) {
    int levels = boundedLimit(depth, MockMarket.BOOK_LEVELS, MockMarket.BOOK_LEVELS);
    return execute(
        "get_order_book",
        RequestClass.PUBLIC,
        () -> market.orderBook(requireInstrument(symbol).symbol(), now()).limit(levels));
  }

  @Override
  public VenueResult<List<Trade>> getTrades(String symbol, int limit) {
    int count = boundedLimit(limit, DEFAULT_LIMIT, MockMarket.RECENT_TRADES);
    return execute(
        "get_trades",
        RequestClass.PUBLIC,
        () -> tail(market.trades(requireInstrument(symbol).symbol()), count));
  }

  @Override
  public VenueResult<List<Candle>> getCandles(String symbol, Timeframe timeframe, int limit) {
    Objects.requireNonNull(timeframe, "timeframe must not be null");
    int count = boundedLimit(limit, DEFAULT_LIMIT, MAX_CANDLES);
    return execute(
        "get_candles",
        RequestClass.PUBLIC,
        () -> market.candles(requireInstrument(symbol).symbol(), timeframe, count, now()));
  }

  @Override
  public VenueResult<BalanceSheet> getBalance() {
    return execute("get_balance", RequestClass.PRIVATE, () -> ledger.snapshot(now()));
  }

  @Override
  public VenueResult<List<Position>> getPositions() {
    return execute(
        "get_positions", RequestClass.PRIVATE, () -> positionsFrom(ledger.snapshot(now())));
  }

  @Override
  public VenueResult<AccountInfo> getAccountInfo() {
    return execute(
        "get_account_info",
        RequestClass.PRIVATE,
        () -> {
          BalanceSheet balances = ledger.snapshot(now());
          return new AccountInfo(
              ACCOUNT_ID,
              "spot",
              true,
              Set.of("spot", "margin"),
              balances,
              positionsFrom(balances),
              now());
        });
  }

  @Override
  public VenueResult<Order> createOrder(OrderRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    return execute("create_order", RequestClass.PRIVATE, () -> place(request));
  }

  @Override
  public VenueResult<Order> cancelOrder(String orderId, String symbol) {
    requireOrderId(orderId);
    return execute("cancel_order", RequestClass.PRIVATE, () -> cancel(orderId, symbol));
  }

  @Override
  public VenueResult<Order> getOrder(String orderId, String symbol) {
    requireOrderId(orderId);
    return execute(
        "get_order",
        RequestClass.PRIVATE,
        () -> {
          synchronized (orders) {
            return find(orderId, symbol).order;
          }
        });
  }

  @Override
  public VenueResult<List<Order>> getOrders(String symbol, OrderStatus status, int limit) {
    String canonical = symbol == null ? null : canonicalSymbol(symbol);
    int count = boundedLimit(limit, DEFAULT_LIMIT, MAX_ORDER_PAGE);
    return execute(
        "get_orders",
        RequestClass.PRIVATE,
        () ->
            tail(
                matching(canonical, order -> status == null || order.status() == status),
                count));
  }

  @Override
  public VenueResult<List<Order>> getOrderHistory(String symbol, int limit) {
    String canonical = symbol == null ? null : canonicalSymbol(symbol);
    int count = boundedLimit(limit, DEFAULT_LIMIT, MAX_ORDER_PAGE);
    return execute(
        "get_order_history",
        RequestClass.PRIVATE,
        () -> tail(matching(canonical, Order::isTerminal), count));
  }

  @Override
  public void subscribeToMarketData(Collection<String> symbols, Set<MarketChannel> channels) {
    Objects.requireNonNull(symbols, "symbols must not be null");
    connection.requireConnected();
    Set<MarketChannel> wanted =
        channels == null || channels.isEmpty()
            ? EnumSet.allOf(MarketChannel.class)
            : EnumSet.copyOf(channels);
    for (String symbol : symbols) {
      String canonical = requireInstrument(symbol).symbol();
      marketSubscriptions.merge(
          canonical,
          Set.copyOf(wanted),
          (current, added) -> {
            Set<MarketChannel> union = EnumSet.copyOf(current);
            union.addAll(added);
            return Set.copyOf(union);
          });
    }
    log.info(
        "Mock market data subscribed venue={} symbols={} channels={}", VENUE_ID, symbols, wanted);
  }

  @Override
  public void unsubscribeFromMarketData(Collection<String> symbols) {
    Objects.requireNonNull(symbols, "symbols must not be null");
    for (String symbol : symbols) {
      marketSubscriptions.remove(canonicalSymbol(symbol));
    }
  }

  @Override
  public void subscribeToOrderUpdates() {
    connection.requireAuthenticated();
    orderUpdatesSubscribed = true;
    log.info("Mock order updates subscribed venue={}", VENUE_ID);
  }

  @Override
  public void unsubscribeFromOrderUpdates() {
    orderUpdatesSubscribed = false;
  }

  /**
   * Runs {@code operation} up to {@code maxAttempts} times on any venue error, waiting
   * {@code attempt * retryDelay} between attempts.
   */
  public <T> T retry(RetryExecutor.Operation<T> operation, int maxAttempts) {
    Objects.requireNonNull(operation, "operation must not be null");
    Duration step = config.retryDelay();
    RetryExecutor executor =
        new RetryExecutor(
            maxAttempts,
            BackoffPolicy.linear(step, step.multipliedBy(Math.max(1, maxAttempts))),
            EnumSet.allOf(ErrorKind.class),
            duration -> Thread.sleep(duration.toMillis()));
    return executor.execute(operation);
  }

  private Order place(OrderRequest request) {
    Instrument instrument = requireInstrument(request.symbol());
    maybeFail(
        config.failureRates().orderPlacement(),
        () -> new OrderException(VENUE_ID, "Simulated order placement failure"));
    OrderType type = request.type();
    if (type == OrderType.TRAILING_STOP || type == OrderType.OCO) {
      throw new OrderException(VENUE_ID, "Order type " + type.code() + " is not simulated");
    }
    boolean buy = request.side() == OrderSide.BUY;
    String currency = buy ? instrument.quote() : instrument.base();
    BigDecimal reserve = buy ? quoteReservation(request, instrument) : request.amount();
    String id = "mock_order_" + orderSequence.incrementAndGet();
    Order order =
        Order.pending(
            id,
            request.clientOrderId() == null ? id : request.clientOrderId(),
            instrument.symbol(),
            type,
            request.side(),
            request.price(),
            request.stopPrice(),
            request.amount(),
            now());
    synchronized (orders) {
      ledger.reserve(currency, reserve);
      orders.put(id, new MockOrder(order, currency, reserve));
    }
    log.info(
        "Mock order accepted venue={} order_id={} symbol={} side={} type={} amount={}",
        VENUE_ID,
        id,
        order.symbol(),
        order.side(),
        type.code(),
        order.amount());
    publishOrder(order);
    Duration delay = config.orderExecutionDelay();
    if (type == OrderType.MARKET) {
      schedule(() -> fillAtMarket(id), delay);
    } else if (type == OrderType.LIMIT) {
      schedule(() -> fillFirstTranche(id), delay.multipliedBy(2));
    }
    return order;
  }

  private BigDecimal quoteReservation(OrderRequest request, Instrument instrument) {
    BigDecimal cushion = BigDecimal.ONE.add(config.maxSlippage());
    BigDecimal notional =
        switch (request.type()) {
          case MARKET -> request
              .amount()
              .multiply(market.price(instrument.symbol()))
              .multiply(cushion);
          case STOP -> request.amount().multiply(request.stopPrice()).multiply(cushion);
          default -> request.amount().multiply(request.price());
        };
    return notional.setScale(AMOUNT_SCALE, RoundingMode.UP);
  }

  private Order cancel(String orderId, String symbol) {
    Order cancelled;
    synchronized (orders) {
      MockOrder state = find(orderId, symbol);
      if (state.order.isTerminal()) {
        throw new OrderException(
            VENUE_ID,
            "Order " + orderId + " is already " + state.order.status().code(),
            orderId);
      }
      release(state);
      state.order = state.order.transitionTo(OrderStatus.CANCELED, null, null, null, now());
      cancelled = state.order;
    }
    log.info("Mock order cancelled venue={} order_id={}", VENUE_ID, orderId);
    publishOrder(cancelled);
    return cancelled;
  }

  private void fillAtMarket(String orderId) {
    Order updated;
    synchronized (orders) {
      MockOrder state = orders.get(orderId);
      if (state == null || state.order.status() != OrderStatus.PENDING) {
        return;
      }
      BigDecimal reference = market.price(state.order.symbol());
      BigDecimal slippage = slippage();
      BigDecimal fillPrice =
          state.order.side() == OrderSide.BUY
              ? reference.multiply(BigDecimal.ONE.add(slippage))
              : reference.multiply(BigDecimal.ONE.subtract(slippage));
      fillPrice = fillPrice.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
      updated = settle(state, state.order.amount(), fillPrice);
    }
    publishOrder(updated);
  }

  private void fillFirstTranche(String orderId) {
    Order updated;
    synchronized (orders) {
      MockOrder state = orders.get(orderId);
      if (state == null || state.order.status() != OrderStatus.PENDING) {
        return;
      }
      BigDecimal ratio = BigDecimal.valueOf(0.3d + random.nextDouble() * 0.4d);
      BigDecimal tranche =
          state.order.amount().multiply(ratio).setScale(AMOUNT_SCALE, RoundingMode.DOWN);
      if (tranche.signum() == 0 || tranche.compareTo(state.order.amount()) >= 0) {
        tranche = state.order.amount();
      }
      updated = settle(state, tranche, limitPrice(state.order));
    }
    publishOrder(updated);
    if (updated.status() == OrderStatus.PARTIALLY_FILLED) {
      schedule(() -> fillRemainder(orderId), config.orderExecutionDelay().multipliedBy(2));
    }
  }

  private void fillRemainder(String orderId) {
    Order updated;
    synchronized (orders) {
      MockOrder state = orders.get(orderId);
      if (state == null || state.order.status() != OrderStatus.PARTIALLY_FILLED) {
        return;
      }
      updated = settle(state, state.order.remaining(), limitPrice(state.order));
    }
    publishOrder(updated);
  }

  /** Fires pending stop orders whose trigger the latest price crossed. */
  private void triggerStops() {
    List<MockOrder> triggered = new ArrayList<>();
    synchronized (orders) {
      for (MockOrder state : orders.values()) {
        Order order = state.order;
        if (state.triggered
            || order.status() != OrderStatus.PENDING
            || order.stopPrice() == null
            || !(order.type() == OrderType.STOP || order.type() == OrderType.STOP_LIMIT)) {
          continue;
        }
        int comparison = market.price(order.symbol()).compareTo(order.stopPrice());
        if (order.side() == OrderSide.BUY ? comparison >= 0 : comparison <= 0) {
          state.triggered = true;
          triggered.add(state);
        }
      }
    }
    for (MockOrder state : triggered) {
      String id = state.order.id();
      log.info("Mock stop order triggered venue={} order_id={}", VENUE_ID, id);
      if (state.order.type() == OrderType.STOP) {
        schedule(() -> fillAtMarket(id), config.orderExecutionDelay());
      } else {
        schedule(() -> fillFirstTranche(id), config.orderExecutionDelay().multipliedBy(2));
      }
    }
  }

  /**
   * Books a fill of {@code quantity} at {@code price}: the paying currency leaves the reservation
   * first and free funds only for any excess, the receiving currency is credited, and a completed
   * order returns whatever stays reserved.
   */
  private Order settle(MockOrder state, BigDecimal quantity, BigDecimal price) {
    Order order = state.order;
    CanonicalSymbol pair = CanonicalSymbol.parse(order.symbol());
    BigDecimal notional = quantity.multiply(price).setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    try {
      if (order.side() == OrderSide.BUY) {
        BigDecimal fromReserve = notional.min(state.reserved);
        ledger.spend(pair.quote(), fromReserve, notional.subtract(fromReserve));
        state.reserved = state.reserved.subtract(fromReserve);
        ledger.credit(pair.base(), quantity);
      } else {
        ledger.spend(pair.base(), quantity, BigDecimal.ZERO);
        state.reserved = state.reserved.subtract(quantity);
        ledger.credit(pair.quote(), notional);
      }
    } catch (InsufficientFundsException ex) {
      log.warn(
          "Mock fill rejected venue={} order_id={} reason={}",
          VENUE_ID,
          order.id(),
          ex.getMessage());
      release(state);
      OrderStatus closing =
          OrderStateMachine.canTransition(order.status(), OrderStatus.REJECTED)
              ? OrderStatus.REJECTED
              : OrderStatus.CANCELED;
      state.order = order.transitionTo(closing, null, null, null, now());
      return state.order;
    }
    BigDecimal filled = order.filled().add(quantity);
    BigDecimal previousCost =
        order.averagePrice() == null
            ? BigDecimal.ZERO
            : order.averagePrice().multiply(order.filled());
    BigDecimal average =
        previousCost
            .add(price.multiply(quantity))
            .divide(filled, AMOUNT_SCALE, RoundingMode.HALF_UP);
    boolean complete = filled.compareTo(order.amount()) == 0;
    state.order =
        order.transitionTo(
            complete ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED,
            filled,
            average,
            null,
            now());
    if (complete) {
      release(state);
    }
    log.info(
        "Mock order fill venue={} order_id={} quantity={} price={} status={}",
        VENUE_ID,
        order.id(),
        quantity,
        price,
        state.order.status().code());
    return state.order;
  }

  private void release(MockOrder state) {
    if (state.reserved.signum() > 0) {
      ledger.release(state.currency, state.reserved);
      state.reserved = BigDecimal.ZERO;
    }
  }

  private BigDecimal limitPrice(Order order) {
    return order.price() != null ? order.price() : market.price(order.symbol());
  }

  private BigDecimal slippage() {
    BigDecimal spread = config.maxSlippage().subtract(config.minSlippage());
    return config
        .minSlippage()
        .add(spread.multiply(BigDecimal.valueOf(random.nextDouble())))
        .setScale(6, RoundingMode.HALF_UP);
  }

  private MockOrder find(String orderId, String symbol) {
    MockOrder state = orders.get(orderId);
    if (state == null
        || (symbol != null && !state.order.symbol().equals(canonicalSymbol(symbol)))) {
      throw new OrderException(VENUE_ID, "Order " + orderId + " not found", orderId);
    }
    return state;
  }

  private List<Order> matching(String symbol, Predicate<Order> filter) {
    List<Order> matches = new ArrayList<>();
    synchronized (orders) {
      for (MockOrder state : orders.values()) {
        if ((symbol == null || state.order.symbol().equals(symbol)) && filter.test(state.order)) {
          matches.add(state.order);
        }
      }
    }
    return matches;
  }

  private void tick() {
    Instant now = now();
    for (String symbol : market.symbols()) {
      Trade trade = market.tick(symbol, now);
      Set<MarketChannel> channels = marketSubscriptions.get(symbol);
      if (channels == null) {
        continue;
      }
      if (channels.contains(MarketChannel.TICKER)) {
        publishMarket(MarketChannel.TICKER, symbol, market.ticker(symbol, now), now);
      }
      if (channels.contains(MarketChannel.ORDER_BOOK)) {
        publishMarket(MarketChannel.ORDER_BOOK, symbol, market.orderBook(symbol, now), now);
      }
      if (channels.contains(MarketChannel.TRADES)) {
        publishMarket(MarketChannel.TRADES, symbol, trade, now);
      }
    }
    triggerStops();
  }

  private void publishMarket(
      MarketChannel channel, String symbol, MarketPayload payload, Instant now) {
    publish(new MarketUpdate(VENUE_ID, channel.code(), symbol, payload, now));
  }

  private void publishOrder(Order order) {
    if (orderUpdatesSubscribed) {
      publish(new OrderUpdate(VENUE_ID, order, now()));
    }
  }

  /** Starts the tick timer unless a disconnect already closed the streams of this connect. */
  @Override
  protected synchronized void onConnected() {
    if (streamsClosed || scheduler != null) {
      return;
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, VENUE_ID + "-simulator");
              thread.setDaemon(true);
              return thread;
            });
    long interval = config.tickInterval().toMillis();
    scheduler.scheduleAtFixedRate(
        guarded("tick", this::tick), interval, interval, TimeUnit.MILLISECONDS);
    log.info("Mock simulator started venue={} tick_ms={}", VENUE_ID, interval);
  }

  private void schedule(Runnable task, Duration delay) {
    ScheduledExecutorService current;
    synchronized (this) {
      current = scheduler;
    }
    if (current == null) {
      log.warn("Mock simulator is stopped; dropping scheduled fill venue={}", VENUE_ID);
      return;
    }
    try {
      current.schedule(guarded("fill", task), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.warn("Mock simulator rejected scheduled fill venue={}", VENUE_ID, ex);
    }
  }

  private Runnable guarded(String name, Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (ExchangeException ex) {
        log.warn("Mock simulator task failed venue={} task={}", VENUE_ID, name, ex);
        publishError(ex);
      } catch (RuntimeException ex) {
        log.error("Mock simulator task crashed venue={} task={}", VENUE_ID, name, ex);
      }
    };
  }

  private void simulateLatency() {
    long min = config.minLatency().toMillis();
    long max = config.maxLatency().toMillis();
    long delay = max > min ? min + (long) (random.nextDouble() * (max - min + 1)) : min;
    if (delay <= 0L) {
      return;
    }
    try {
      Thread.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ConnectionException(VENUE_ID, "Interrupted during simulated latency", ex);
    }
  }

  private void maybeFail(double rate, Supplier<? extends ExchangeException> failure) {
    if (rate > 0.0d && random.nextDouble() < rate) {
      throw failure.get();
    }
  }

  private static final class MockOrder {
    private Order order;
    private final String currency;
    private BigDecimal reserved;
    private boolean triggered;

    private MockOrder(Order order, String currency, BigDecimal reserved) {
      this.order = order;
      this.currency = currency;
      this.reserved = reserved;
    }
  }
}
