package com.venuelink.integration.cryptocom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.AdapterSettings;
import com.venuelink.adapter.core.Credentials;
import com.venuelink.adapter.core.MarketChannel;
import com.venuelink.adapter.core.error.ErrorKind;
import com.venuelink.adapter.core.event.ErrorEvent;
import com.venuelink.adapter.core.event.MarketUpdate;
import com.venuelink.adapter.core.event.OrderUpdate;
import com.venuelink.adapter.core.telemetry.NoOpAdapterTelemetry;
import com.venuelink.domain.market.OrderStatus;
import com.venuelink.domain.market.Ticker;
import com.venuelink.testsupport.EventRecorder;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CryptoComStreamsTest {
  private static final Duration WAIT = Duration.ofSeconds(5);

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
  private MockWebServer rest;
  private MockWebServer streams;
  private CryptoComExchangeAdapter adapter;
  private EventRecorder recorder;

  @BeforeEach
  void setUp() throws Exception {
    rest = new MockWebServer();
    rest.start();
    streams = new MockWebServer();
    streams.start();
    String wsBase = "ws://" + streams.getHostName() + ":" + streams.getPort();
    CryptoComConfig config =
        CryptoComConfig.forEnvironment(true)
            .withEndpoints(
                rest.url("/v2").uri(),
                URI.create(wsBase + "/v2/market"),
                URI.create(wsBase + "/v2/user"))
            .withStreamTiming(Duration.ZERO, Duration.ofMillis(50), Duration.ofMillis(200));
    adapter =
        new CryptoComExchangeAdapter(
            new AdapterSettings(
                true,
                Duration.ofSeconds(2),
                false,
                new Credentials("api-key", "api-secret"),
                Clock.systemUTC()),
            config,
            HttpClient.newHttpClient(),
            objectMapper,
            new NoOpAdapterTelemetry());
    recorder = EventRecorder.attach(adapter.events());
    rest.enqueue(ok(CryptoComExchangeAdapterTest.INSTRUMENTS));
    adapter.connect();
  }

  @AfterEach
  void tearDown() throws Exception {
    recorder.close();
    adapter.disconnect();
    streams.shutdown();
    rest.shutdown();
  }

  @Test
  void shouldSubscribeAnswerHeartbeatAndPublishTicker() throws Exception {
    streams.enqueue(
        new MockResponse()
            .withWebSocketUpgrade(
                new Recording() {
                  @Override
                  public void onMessage(WebSocket webSocket, String text) {
                    super.onMessage(webSocket, text);
                    if (text.contains("\"subscribe\"")) {
                      webSocket.send("{\"id\":42,\"method\":\"public/heartbeat\",\"code\":0}");
                      webSocket.send(
                          "{\"id\":-1,\"method\":\"subscribe\",\"code\":0,\"result\":{"
                              + "\"instrument_name\":\"BTC_USD\","
                              + "\"subscription\":\"ticker.BTC_USD\",\"channel\":\"ticker\","
                              + "\"data\":[{\"i\":\"BTC_USD\",\"b\":\"49990\",\"k\":\"50010\","
                              + "\"a\":\"50000\",\"t\":1709251200000}]}}");
                    }
                  }
                }));

    adapter.subscribeToMarketData(List.of("BTC/USD"), EnumSet.of(MarketChannel.TICKER));

    JsonNode subscribe = objectMapper.readTree(poll());
    assertEquals("subscribe", subscribe.get("method").asText());
    assertEquals("ticker.BTC_USD", subscribe.get("params").get("channels").get(0).asText());
    assertEquals(1, subscribe.get("params").get("channels").size());
    JsonNode heartbeat = objectMapper.readTree(poll());
    assertEquals("public/respond-heartbeat", heartbeat.get("method").asText());
    assertEquals(42, heartbeat.get("id").asInt());

    MarketUpdate update = recorder.awaitFirst(MarketUpdate.class, WAIT);
    assertEquals("ticker", update.channel());
    assertEquals("BTC/USD", update.symbol());
    assertEquals(new BigDecimal("50000"), ((Ticker) update.data()).last());
  }

  @Test
  void shouldPublishBookAndTradeFrames() throws Exception {
    streams.enqueue(
        new MockResponse()
            .withWebSocketUpgrade(
                new Recording() {
                  @Override
                  public void onMessage(WebSocket webSocket, String text) {
                    super.onMessage(webSocket, text);
                    webSocket.send(
                        "{\"method\":\"subscribe\",\"result\":{\"instrument_name\":\"ETH_USD\","
                            + "\"channel\":\"book\",\"subscription\":\"book.ETH_USD\","
                            + "\"data\":[{\"bids\":[[\"2999\",\"1\",1]],"
                            + "\"asks\":[[\"3001\",\"2\",1]],\"t\":1709251200000}]}}");
                    webSocket.send(
                        "{\"method\":\"subscribe\",\"result\":{\"instrument_name\":\"ETH_USD\","
                            + "\"channel\":\"trade\",\"subscription\":\"trade.ETH_USD\","
                            + "\"data\":[{\"d\":\"901\",\"t\":1709251200000,\"s\":\"SELL\","
                            + "\"p\":\"3000\",\"q\":\"0.25\",\"i\":\"ETH_USD\"}]}}");
                  }
                }));

    adapter.subscribeToMarketData(
        List.of("ETH/USD"), EnumSet.of(MarketChannel.ORDER_BOOK, MarketChannel.TRADES));

    List<MarketUpdate> updates = recorder.awaitCount(MarketUpdate.class, 2, WAIT);
    assertEquals("orderbook", updates.get(0).channel());
    assertEquals("trades", updates.get(1).channel());
    assertEquals("ETH/USD", updates.get(1).symbol());
  }

  @Test
  void shouldAuthenticateUserStreamBeforeSubscribing() throws Exception {
    streams.enqueue(
        new MockResponse()
            .withWebSocketUpgrade(
                new Recording() {
                  @Override
                  public void onMessage(WebSocket webSocket, String text) {
                    super.onMessage(webSocket, text);
                    if (text.contains("public/auth")) {
                      webSocket.send("{\"id\":1,\"method\":\"public/auth\",\"code\":0}");
                    } else if (text.contains("user.order")) {
                      webSocket.send(
                          "{\"method\":\"subscribe\",\"result\":{\"channel\":\"user.order\","
                              + "\"subscription\":\"user.order\",\"data\":[{"
                              + "\"order_id\":\"55\",\"instrument_name\":\"BTC_USD\","
                              + "\"type\":\"LIMIT\",\"side\":\"BUY\",\"price\":\"50000\","
                              + "\"quantity\":\"0.1\",\"cumulative_quantity\":\"0.1\","
                              + "\"avg_price\":\"50000\",\"status\":\"FILLED\","
                              + "\"create_time\":1709251200000}]}}");
                    }
                  }
                }));
    authenticate();

    adapter.subscribeToOrderUpdates();

    JsonNode auth = objectMapper.readTree(poll());
    assertEquals("public/auth", auth.get("method").asText());
    assertEquals("api-key", auth.get("api_key").asText());
    assertNotNull(auth.get("sig"));
    JsonNode subscribe = objectMapper.readTree(poll());
    assertEquals("user.order", subscribe.get("params").get("channels").get(0).asText());
    OrderUpdate update = recorder.awaitFirst(OrderUpdate.class, WAIT);
    assertEquals("55", update.order().id());
    assertEquals(OrderStatus.FILLED, update.order().status());
  }

  @Test
  void shouldReportRejectedUserStreamAuthentication() throws Exception {
    streams.enqueue(
        new MockResponse()
            .withWebSocketUpgrade(
                new Recording() {
                  @Override
                  public void onMessage(WebSocket webSocket, String text) {
                    super.onMessage(webSocket, text);
                    webSocket.send(
                        "{\"id\":1,\"method\":\"public/auth\",\"code\":10002,"
                            + "\"message\":\"UNAUTHORIZED\"}");
                  }
                }));
    authenticate();

    adapter.subscribeToOrderUpdates();

    ErrorEvent error =
        recorder.await(ErrorEvent.class, e -> e.type() == ErrorKind.AUTHENTICATION, WAIT);
    assertTrue(error.message().contains("cryptocom"));
    assertEquals("public/auth", objectMapper.readTree(poll()).get("method").asText());
  }

  private void authenticate() {
    rest.enqueue(ok(CryptoComExchangeAdapterTest.ACCOUNT_SUMMARY));
    adapter.authenticate();
  }

  private String poll() throws InterruptedException {
    String message = inbox.poll(WAIT.toMillis(), TimeUnit.MILLISECONDS);
    assertNotNull(message, "server received no frame");
    return message;
  }

  private static MockResponse ok(String body) {
    return new MockResponse().setResponseCode(200).setBody(body);
  }

  private class Recording extends WebSocketListener {
    @Override
    public void onMessage(WebSocket webSocket, String text) {
      inbox.add(text);
    }
  }
}
