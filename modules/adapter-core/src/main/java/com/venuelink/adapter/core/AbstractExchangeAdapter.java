package com.venuelink.adapter.core;

import com.venuelink.adapter.core.error.AuthenticationException;
import com.venuelink.adapter.core.error.ConnectionException;
import com.venuelink.adapter.core.error.ExchangeException;
import com.venuelink.adapter.core.error.InvalidSymbolException;
import com.venuelink.adapter.core.error.MalformedPayloadException;
import com.venuelink.adapter.core.error.RateLimitException;
import com.venuelink.adapter.core.error.UnclassifiedExchangeException;
import com.venuelink.adapter.core.event.AdapterEvent;
import com.venuelink.adapter.core.event.AdapterEventBus;
import com.venuelink.adapter.core.event.Connected;
import com.venuelink.adapter.core.event.Disconnected;
import com.venuelink.adapter.core.event.ErrorEvent;
import com.venuelink.adapter.core.ratelimit.RateLimitPolicy;
import com.venuelink.adapter.core.ratelimit.SlidingWindowRateLimiter;
import com.venuelink.adapter.core.telemetry.AdapterTelemetry;
import com.venuelink.domain.market.Balance;
import com.venuelink.domain.market.BalanceSheet;
import com.venuelink.domain.market.CanonicalSymbol;
import com.venuelink.domain.market.Instrument;
import com.venuelink.domain.market.MarketDomainException;
import com.venuelink.domain.market.Position;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractExchangeAdapter implements ExchangeAdapter {
  private static final Logger log = LoggerFactory.getLogger(AbstractExchangeAdapter.class);
  private static final String ADAPTER_STREAM = "adapter";

  private final String venueId;
  private final String venueName;
  private final Set<AdapterCapability> capabilities;
  private final Set<MarketChannel> marketChannels;
  private final RateLimitPolicy rateLimitPolicy;
  private final Map<RequestClass, SlidingWindowRateLimiter> limiters;
  private final AtomicLong requestSequence = new AtomicLong(0L);
  private volatile Map<String, Instrument> instruments = Map.of();

  protected final AdapterSettings settings;
  protected final AdapterEventBus eventBus;
  protected final ConnectionStateTracker connection;
  protected final AdapterTelemetry telemetry;
  protected final Clock clock;

  protected AbstractExchangeAdapter(
      String venueId,
      String venueName,
      Set<AdapterCapability> capabilities,
      Set<MarketChannel> marketChannels,
      AdapterSettings settings,
      RateLimitPolicy rateLimitPolicy,
      AdapterTelemetry telemetry) {
    if (venueId == null || venueId.isBlank()) {
      throw new IllegalArgumentException("venueId is required");
    }
    this.venueId = venueId;
    this.venueName = venueName == null || venueName.isBlank() ? venueId : venueName;
    this.capabilities =
        Set.copyOf(Objects.requireNonNull(capabilities, "capabilities is required"));
    this.marketChannels =
        marketChannels == null || marketChannels.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(marketChannels));
    this.settings = Objects.requireNonNull(settings, "settings is required");
    this.rateLimitPolicy = Objects.requireNonNull(rateLimitPolicy, "rateLimitPolicy is required");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry is required");
    this.clock = settings.clock();
    this.limiters = rateLimitPolicy.createLimiters(venueId, clock);
    this.eventBus = new AdapterEventBus(venueId);
    this.connection = new ConnectionStateTracker(venueId);
  }

  protected abstract List<Instrument> loadInstruments();

  protected abstract void verifyCredentials();

  protected abstract void probe();

  protected abstract void closeStreams();

  @Override
  public String venueId() {
    return venueId;
  }

  @Override
  public String venueName() {
    return venueName;
  }

  @Override
  public Set<AdapterCapability> capabilities() {
    return capabilities;
  }

  @Override
  public Set<MarketChannel> marketChannels() {
    return marketChannels;
  }

  @Override
  public ConnectionState connectionState() {
    return connection.current();
  }

  @Override
  public AdapterEventBus events() {
    return eventBus;
  }

  @Override
  public RateLimitPolicy rateLimits() {
    return rateLimitPolicy;
  }

  @Override
  public Map<String, Instrument> instruments() {
    return instruments;
  }

  @Override
  public List<String> supportedSymbols() {
    return List.copyOf(instruments.keySet());
  }

  @Override
  public void connect() {
    if (!connection.beginConnecting()) {
      if (connection.current().isConnected()) {
        return;
      }
      throw new ConnectionException(venueId, venueId + " adapter is already connecting");
    }
    log.info("Connecting venue adapter venue={} sandbox={}", venueId, settings.sandbox());
    try {
      List<Instrument> loaded =
          dispatch("load_instruments", RequestClass.PUBLIC, this::loadInstruments).data();
      replaceInstruments(loaded);
      connection.markConnected();
      onConnected();
    } catch (RuntimeException ex) {
      connection.markDisconnected();
      log.warn("Venue adapter connect failed venue={} error={}", venueId, ex.getMessage());
      throw ex;
    }
    log.info("Venue adapter connected venue={} instruments={}", venueId, instruments.size());
    publish(new Connected(venueId, ADAPTER_STREAM, now()));
  }

  /**
   * Runs once the adapter is {@link ConnectionState#CONNECTED} and before {@link Connected} is
   * published. A failure here fails the connect.
   */
  protected void onConnected() {}

  @Override
  public void disconnect() {
    try {
      closeStreams();
    } catch (RuntimeException ex) {
      log.warn("Failed to close venue streams cleanly venue={}", venueId, ex);
    }
    ConnectionState previous = connection.markDisconnected();
    if (previous != ConnectionState.DISCONNECTED) {
      log.info("Venue adapter disconnected venue={}", venueId);
      publish(new Disconnected(venueId, ADAPTER_STREAM, "client_disconnect", now()));
    }
  }

  @Override
  public void authenticate() {
    connection.requireConnected();
    if (!settings.credentials().isPresent()) {
      throw new AuthenticationException(venueId, venueId + " API credentials are not configured");
    }
    try {
      dispatch(
          "authenticate",
          RequestClass.PRIVATE,
          () -> {
            verifyCredentials();
            return Boolean.TRUE;
          });
      connection.markAuthenticated();
      log.info("Venue adapter authenticated venue={}", venueId);
    } catch (AuthenticationException ex) {
      connection.revokeAuthentication();
      throw ex;
    }
  }

  @Override
  public boolean validateCredentials() {
    if (!settings.credentials().isPresent()) {
      return false;
    }
    try {
      dispatch(
          "validate_credentials",
          RequestClass.PRIVATE,
          () -> {
            verifyCredentials();
            return Boolean.TRUE;
          });
      return true;
    } catch (AuthenticationException ex) {
      log.debug("Credential validation rejected venue={} error={}", venueId, ex.getMessage());
      return false;
    }
  }

  @Override
  public HealthStatus healthCheck() {
    ConnectionState state = connection.current();
    if (!state.isConnected()) {
      return health(false, state, Duration.ZERO, "not connected");
    }
    long started = System.nanoTime();
    try {
      dispatch(
          "health_check",
          RequestClass.PUBLIC,
          () -> {
            probe();
            return Boolean.TRUE;
          });
      return health(true, state, Duration.ofNanos(System.nanoTime() - started), "ok");
    } catch (ExchangeException ex) {
      return health(
          false, state, Duration.ofNanos(System.nanoTime() - started), ex.getMessage());
    }
  }

  protected <T> VenueResult<T> execute(
      String operation, RequestClass requestClass, Supplier<T> call) {
    if (requestClass == RequestClass.PRIVATE) {
      connection.requireAuthenticated();
    } else {
      connection.requireConnected();
    }
    return dispatch(operation, requestClass, call);
  }

  protected <T> VenueResult<T> dispatch(
      String operation, RequestClass requestClass, Supplier<T> call) {
    SlidingWindowRateLimiter limiter = admit(requestClass);
    long started = System.nanoTime();
    try {
      T data = call.get();
      long elapsed = System.nanoTime() - started;
      telemetry.onRequestSuccess(venueId, operation, elapsed);
      return new VenueResult<>(
          data,
          new ResponseMetadata(
              venueId,
              venueId + "-" + requestSequence.incrementAndGet(),
              Duration.ofNanos(elapsed),
              limiter.remaining(),
              now()));
    } catch (ExchangeException ex) {
      throw recordFailure(operation, started, ex);
    } catch (MarketDomainException ex) {
      throw recordFailure(
          operation,
          started,
          new MalformedPayloadException(
              venueId, venueId + " " + operation + " returned an inconsistent record", ex));
    } catch (RuntimeException ex) {
      throw recordFailure(
          operation,
          started,
          new UnclassifiedExchangeException(
              venueId, venueId + " " + operation + " failed: " + ex.getMessage(), ex));
    }
  }

  /**
   * Takes one admission from the limiter of {@code requestClass}. {@link #dispatch} admits the
   * first venue request of an operation; an operation that sends more requests admits each extra
   * one here before sending it.
   */
  protected SlidingWindowRateLimiter admit(RequestClass requestClass) {
    SlidingWindowRateLimiter limiter = limiters.get(requestClass);
    try {
      limiter.acquire();
    } catch (RateLimitException ex) {
      telemetry.onRateLimited(venueId, limiter.name());
      throw ex;
    }
    return limiter;
  }

  protected Instrument requireInstrument(String symbol) {
    connection.requireConnected();
    String canonical = canonicalSymbol(symbol);
    Map<String, Instrument> current = instruments;
    Instrument instrument = current.get(canonical);
    if (instrument == null) {
      throw new InvalidSymbolException(
          venueId, canonical, "Symbol " + canonical + " is not listed on " + venueId);
    }
    return instrument;
  }

  protected String canonicalSymbol(String symbol) {
    if (!CanonicalSymbol.isValid(symbol)) {
      throw new InvalidSymbolException(
          venueId, symbol, "Symbol must be BASE/QUOTE but was " + symbol);
    }
    return CanonicalSymbol.parse(symbol).toString();
  }

  protected void replaceInstruments(Collection<Instrument> loaded) {
    Map<String, Instrument> next = new LinkedHashMap<>();
    for (Instrument instrument : loaded) {
      next.put(instrument.symbol(), instrument);
    }
    instruments = Map.copyOf(next);
  }

  protected void publish(AdapterEvent event) {
    eventBus.publish(event);
  }

  protected void publishError(ExchangeException error) {
    publish(new ErrorEvent(venueId, error.kind(), error.getMessage(), now()));
  }

  protected Instant now() {
    return clock.instant();
  }

  protected static int boundedLimit(int requested, int fallback, int max) {
    int value = requested <= 0 ? fallback : requested;
    return Math.min(value, max);
  }

  /** Spot venues report holdings as positions: one per asset with a non-zero total. */
  protected static List<Position> positionsFrom(BalanceSheet balances) {
    List<Position> positions = new ArrayList<>();
    for (Balance balance : balances.balances().values()) {
      if (balance.total().signum() > 0) {
        positions.add(
            new Position(balance.currency(), balance.total(), null, balances.timestamp()));
      }
    }
    return List.copyOf(positions);
  }

  /** Keeps the newest {@code limit} entries of an ascending list. */
  protected static <T> List<T> tail(List<T> items, int limit) {
    if (items.size() <= limit) {
      return List.copyOf(items);
    }
    return List.copyOf(items.subList(items.size() - limit, items.size()));
  }

  protected static void requireOrderId(String orderId) {
    if (orderId == null || orderId.isBlank()) {
      throw new IllegalArgumentException("orderId is required");
    }
  }

  private ExchangeException recordFailure(String operation, long started, ExchangeException ex) {
    telemetry.onRequestFailure(
        venueId, operation, ex.kind().code(), System.nanoTime() - started);
    log.debug(
        "Venue request failed venue={} operation={} error_kind={} message={}",
        venueId,
        operation,
        ex.kind(),
        ex.getMessage());
    return ex;
  }

  private HealthStatus health(
      boolean healthy, ConnectionState state, Duration latency, String detail) {
    return new HealthStatus(
        venueId, healthy, state, settings.sandbox(), settings.testMode(), latency, detail, now());
  }
}
