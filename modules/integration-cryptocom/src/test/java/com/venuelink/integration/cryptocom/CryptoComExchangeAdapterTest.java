package com.venuelink.integration.cryptocom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.AdapterSettings;
import com.venuelink.adapter.core.ConnectionState;
import com.venuelink.adapter.core.Credentials;
import com.venuelink.adapter.core.HealthStatus;
import com.venuelink.adapter.core.OrderRequest;
import com.venuelink.adapter.core.VenueResult;
import com.venuelink.adapter.core.error.AuthenticationException;
import com.venuelink.adapter.core.error.InsufficientFundsException;
import com.venuelink.adapter.core.error.InvalidSymbolException;
import com.venuelink.adapter.core.error.OrderException;
import com.venuelink.adapter.core.error.RateLimitException;
import com.venuelink.adapter.core.signing.Hmac;
import com.venuelink.adapter.core.telemetry.NoOpAdapterTelemetry;
import com.venuelink.domain.market.BalanceSheet;
import com.venuelink.domain.market.Candle;
import com.venuelink.domain.market.Order;
import com.venuelink.domain.market.OrderSide;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.OrderType;
import com.venuelink.domain.market.Position;
import com.venuelink.domain.market.Ticker;
import com.venuelink.domain.market.TimeInForce;
import com.venuelink.domain.market.Timeframe;
import com.venuelink.testsupport.MutableClock;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CryptoComExchangeAdapterTest {
  static final String INSTRUMENTS =
      "{\"id\":1,\"method\":\"public/get-instruments\",\"code\":0,\"result\":{\"instruments\":["
          + "{\"instrument_name\":\"BTC_USD\",\"quote_currency\":\"USD\",\"base_currency\":\"BTC\","
          + "\"price_decimals\":2,\"quantity_decimals\":4,\"min_quantity\":\"0.0001\"},"
          + "{\"instrument_name\":\"ETH_USD\",\"quote_currency\":\"USD\",\"base_currency\":\"ETH\","
          + "\"price_decimals\":2,\"quantity_decimals\":3}]}}";
  static final String ACCOUNT_SUMMARY =
      "{\"id\":2,\"method\":\"private/get-account-summary\",\"code\":0,\"result\":{\"accounts\":["
          + "{\"currency\":\"USD\",\"balance\":\"1000\",\"available\":\"900\",\"order\":\"100\","
          + "\"stake\":\"0\"},"
          + "{\"currency\":\"BTC\",\"balance\":\"0\",\"available\":\"0\",\"order\":\"0\","
          + "\"stake\":\"0\"}]}}";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final MutableClock clock = MutableClock.startingAt("2024-03-01T00:00:00Z");
  private MockWebServer server;
  private CryptoComExchangeAdapter adapter;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    adapter = adapter(new Credentials("api-key", "api-secret"));
  }

  @AfterEach
  void tearDown() throws Exception {
    adapter.disconnect();
    server.shutdown();
  }

  @Test
  void shouldLoadInstrumentsOnConnect() throws Exception {
    server.enqueue(ok(INSTRUMENTS));

    adapter.connect();

    assertEquals(ConnectionState.CONNECTED, adapter.connectionState());
    assertEquals(
        List.of("BTC/USD", "ETH/USD"), adapter.supportedSymbols().stream().sorted().toList());
    assertEquals("BTC_USD", adapter.instruments().get("BTC/USD").venueSymbol());
    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertEquals("POST", request.getMethod());
    assertEquals("/v2/public/get-instruments", request.getPath());
    JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
    assertEquals("public/get-instruments", body.get("method").asText());
    assertFalse(body.has("sig"));
  }

  @Test
  void shouldNormalizeTickerAndAttachMetadata() throws Exception {
    connect();
    server.enqueue(
        ok(
            "{\"id\":3,\"method\":\"public/get-ticker\",\"code\":0,\"result\":{\"data\":[{"
                + "\"i\":\"BTC_USD\",\"b\":\"49990\",\"k\":\"50010\",\"a\":\"50000\","
                + "\"t\":1709251200000}]}}"));

    VenueResult<Ticker> result = adapter.getTicker("BTC/USD");

    assertEquals("BTC/USD", result.data().symbol());
    assertTrue(result.data().bid().compareTo(result.data().ask()) < 0);
    assertEquals("cryptocom", result.metadata().venue());
    JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
    assertEquals("BTC_USD", body.get("params").get("instrument_name").asText());
  }

  @Test
  void shouldRejectUnlistedSymbolWithoutCallingVenue() throws Exception {
    connect();

    assertThrows(InvalidSymbolException.class, () -> adapter.getTicker("DOGE/EUR"));
    assertThrows(InvalidSymbolException.class, () -> adapter.getTicker("BTCUSD"));
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void shouldRequireAuthenticationForPrivateCalls() throws Exception {
    connect();

    assertThrows(AuthenticationException.class, () -> adapter.getBalance());
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void shouldAuthenticateAndReadBalances() throws Exception {
    authenticate();
    server.enqueue(ok(ACCOUNT_SUMMARY));

    BalanceSheet balances = adapter.getBalance().data();

    assertEquals(ConnectionState.AUTHENTICATED, adapter.connectionState());
    assertEquals(new BigDecimal("900"), balances.balance("USD").free());
    assertEquals(new BigDecimal("100"), balances.balance("USD").used());
    RecordedRequest request = server.takeRequest();
    assertEquals("/v2/private/get-account-summary", request.getPath());
    JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
    assertEquals("api-key", body.get("api_key").asText());
    assertEquals(
        Hmac.hex(
            Hmac.SHA256,
            "api-secret",
            "private/get-account-summary"
                + body.get("id").asLong()
                + "api-key"
                + body.get("nonce").asLong()),
        body.get("sig").asText());
  }

  @Test
  void shouldNumberPublicAndPrivateRequestsFromOneSequence() throws Exception {
    authenticate();
    server.enqueue(ok(ACCOUNT_SUMMARY));
    adapter.getBalance();

    long connectId =
        objectMapper.readTree(server.takeRequest().getBody().readUtf8()).get("id").asLong();
    long authenticateId =
        objectMapper.readTree(server.takeRequest().getBody().readUtf8()).get("id").asLong();
    long balanceId =
        objectMapper.readTree(server.takeRequest().getBody().readUtf8()).get("id").asLong();

    assertTrue(connectId < authenticateId);
    assertTrue(authenticateId < balanceId);
  }

  @Test
  void shouldDerivePositionsFromNonZeroBalances() throws Exception {
    authenticate();
    server.enqueue(ok(ACCOUNT_SUMMARY));

    List<Position> positions = adapter.getPositions().data();

    assertEquals(1, positions.size());
    assertEquals("USD", positions.get(0).asset());
  }

  @Test
  void shouldSubmitSignedLimitOrder() throws Exception {
    authenticate();
    server.enqueue(
        ok(
            "{\"id\":4,\"method\":\"private/create-order\",\"code\":0,"
                + "\"result\":{\"order_id\":\"337843775021233500\",\"client_oid\":\"my-1\"}}"));

    OrderRequest request =
        new OrderRequest(
            "BTC/USD",
            OrderSide.BUY,
            OrderType.LIMIT,
            new BigDecimal("0.01"),
            new BigDecimal("50000"),
            null,
            TimeInForce.POST_ONLY,
            "my-1");
    Order order = adapter.createOrder(request).data();

    assertEquals("337843775021233500", order.id());
    assertEquals(OrderStatus.PENDING, order.status());
    assertEquals("my-1", order.clientOrderId());
    JsonNode params =
        objectMapper.readTree(server.takeRequest().getBody().readUtf8()).get("params");
    assertEquals("BTC_USD", params.get("instrument_name").asText());
    assertEquals("BUY", params.get("side").asText());
    assertEquals("LIMIT", params.get("type").asText());
    assertEquals("0.01", params.get("quantity").asText());
    assertEquals("50000", params.get("price").asText());
    assertEquals("POST_ONLY", params.get("exec_inst").asText());
    assertFalse(params.has("time_in_force"));
  }

  @Test
  void shouldRejectOrdersTheVenueCannotExpress() throws Exception {
    authenticate();
    OrderRequest trailing =
        new OrderRequest(
            "BTC/USD",
            OrderSide.SELL,
            OrderType.TRAILING_STOP,
            new BigDecimal("0.01"),
            null,
            new BigDecimal("100"),
            null,
            null);

    assertThrows(OrderException.class, () -> adapter.createOrder(trailing));
    assertThrows(
        OrderException.class,
        () ->
            adapter.createOrder(
                OrderRequest.market("BTC/USD", OrderSide.BUY, new BigDecimal("0.00001"))));
    assertEquals(2, server.getRequestCount());
  }

  @Test
  void shouldClassifyVenueErrorCode() throws Exception {
    authenticate();
    server.enqueue(
        ok(
            "{\"id\":5,\"method\":\"private/create-order\",\"code\":306,"
                + "\"message\":\"INSUFFICIENT_AVAILABLE_BALANCE\"}"));

    InsufficientFundsException ex =
        assertThrows(
            InsufficientFundsException.class,
            () ->
                adapter.createOrder(
                    OrderRequest.market("BTC/USD", OrderSide.BUY, new BigDecimal("1"))));
    assertTrue(ex.getMessage().contains("INSUFFICIENT_AVAILABLE_BALANCE"));
  }

  @Test
  void shouldMapHttp429ToRateLimitWithRetryAfter() throws Exception {
    connect();
    server.enqueue(
        new MockResponse()
            .setResponseCode(429)
            .setHeader("Retry-After", "2")
            .setBody("{\"code\":10006,\"message\":\"TOO_MANY_REQUESTS\"}"));

    RateLimitException ex =
        assertThrows(RateLimitException.class, () -> adapter.getOrderBook("ETH/USD", 10));
    assertEquals(Duration.ofSeconds(2), ex.retryAfter());
  }

  @Test
  void shouldCancelThenReturnOrderDetail() throws Exception {
    authenticate();
    server.enqueue(ok("{\"id\":6,\"method\":\"private/cancel-order\",\"code\":0}"));
    server.enqueue(
        ok(
            "{\"id\":7,\"method\":\"private/get-order-detail\",\"code\":0,\"result\":{"
                + "\"trade_list\":[],\"order_info\":{\"order_id\":\"42\","
                + "\"instrument_name\":\"ETH_USD\",\"type\":\"LIMIT\",\"side\":\"SELL\","
                + "\"price\":\"3000\",\"quantity\":\"1\",\"cumulative_quantity\":\"0\","
                + "\"status\":\"CANCELED\",\"create_time\":1709251200000}}}"));

    Order order = adapter.cancelOrder("42", "ETH/USD").data();

    assertEquals(OrderStatus.CANCELED, order.status());
    assertEquals("/v2/private/cancel-order", server.takeRequest().getPath());
    assertEquals("/v2/private/get-order-detail", server.takeRequest().getPath());
  }

  @Test
  void shouldFilterOpenOrdersByStatus() throws Exception {
    authenticate();
    server.enqueue(
        ok(
            "{\"id\":8,\"method\":\"private/get-open-orders\",\"code\":0,\"result\":{"
                + "\"count\":2,\"order_list\":["
                + order("1", "ACTIVE", "0")
                + ","
                + order("2", "ACTIVE", "0.5")
                + "]}}"));

    List<Order> partial = adapter.getOrders("BTC/USD", OrderStatus.PARTIALLY_FILLED, 10).data();

    assertEquals(1, partial.size());
    assertEquals("2", partial.get(0).id());
    JsonNode params =
        objectMapper.readTree(server.takeRequest().getBody().readUtf8()).get("params");
    assertEquals(10, params.get("page_size").asInt());
  }

  @Test
  void shouldReturnCandlesOldestFirstWithinLimit() throws Exception {
    connect();
    server.enqueue(
        ok(
            "{\"id\":9,\"method\":\"public/get-candlestick\",\"code\":0,\"result\":{"
                + "\"interval\":\"1D\",\"data\":["
                + "{\"t\":1709337600000,\"o\":2,\"h\":3,\"l\":1,\"c\":2,\"v\":10},"
                + "{\"t\":1709251200000,\"o\":1,\"h\":2,\"l\":1,\"c\":2,\"v\":5},"
                + "{\"t\":1709424000000,\"o\":2,\"h\":4,\"l\":2,\"c\":3,\"v\":7}]}}"));

    List<Candle> candles = adapter.getCandles("BTC/USD", Timeframe.ONE_DAY, 2).data();

    assertEquals(2, candles.size());
    assertTrue(candles.get(0).openTime().isBefore(candles.get(1).openTime()));
    JsonNode params =
        objectMapper.readTree(server.takeRequest().getBody().readUtf8()).get("params");
    assertEquals("1D", params.get("timeframe").asText());
  }

  @Test
  void shouldReportHealth() throws Exception {
    HealthStatus offline = adapter.healthCheck();
    assertFalse(offline.healthy());
    assertEquals("not connected", offline.detail());

    connect();
    server.enqueue(ok(INSTRUMENTS));
    assertTrue(adapter.healthCheck().healthy());
  }

  @Test
  void shouldRejectInvalidCredentials() throws Exception {
    connect();
    server.enqueue(
        new MockResponse()
            .setResponseCode(401)
            .setBody("{\"code\":10002,\"message\":\"UNAUTHORIZED\"}"));

    assertThrows(AuthenticationException.class, () -> adapter.authenticate());
    assertEquals(ConnectionState.CONNECTED, adapter.connectionState());
  }

  private void connect() {
    server.enqueue(ok(INSTRUMENTS));
    adapter.connect();
  }

  private void authenticate() {
    connect();
    server.enqueue(ok(ACCOUNT_SUMMARY));
    adapter.authenticate();
  }

  private CryptoComExchangeAdapter adapter(Credentials credentials) {
    URI rest = server.url("/v2").uri();
    CryptoComConfig config =
        CryptoComConfig.forEnvironment(false)
            .withEndpoints(
                rest,
                URI.create("ws://localhost:1/v2/market"),
                URI.create("ws://localhost:1/v2/user"));
    return new CryptoComExchangeAdapter(
        new AdapterSettings(false, Duration.ofSeconds(2), false, credentials, clock),
        config,
        HttpClient.newHttpClient(),
        objectMapper,
        new NoOpAdapterTelemetry());
  }

  private static String order(String id, String status, String filled) {
    return "{\"order_id\":\""
        + id
        + "\",\"instrument_name\":\"BTC_USD\",\"type\":\"LIMIT\",\"side\":\"BUY\","
        + "\"price\":\"50000\",\"quantity\":\"1\",\"cumulative_quantity\":\""
        + filled
        + "\",\"status\":\""
        + status
        + "\",\"create_time\":1709251200000}";
  }

  private static MockResponse ok(String body) {
    return new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }
}
