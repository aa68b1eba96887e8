package com.venuelink.adapter.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuelink.adapter.core.error.ErrorKind;
import com.venuelink.adapter.core.error.ExchangeException;
import com.venuelink.adapter.core.event.AdapterEvent;
import com.venuelink.adapter.core.event.AdapterEventBus;
import com.venuelink.adapter.core.event.Connected;
import com.venuelink.adapter.core.event.Disconnected;
import com.venuelink.adapter.core.event.ErrorEvent;
import com.venuelink.adapter.core.telemetry.AdapterTelemetry;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one venue WebSocket: connects, replays the handshake and the active channel set after every
 * reconnect, answers venue heartbeats and publishes decoded frames on the adapter event bus in
 * arrival order.
 */
public class WebSocketStreamManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WebSocketStreamManager.class);

  private final String venue;
  private final String streamName;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final StreamConfig config;
  private final StreamProtocol protocol;
  private final AdapterEventBus eventBus;
  private final AdapterTelemetry telemetry;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean connected = new AtomicBoolean(false);
  private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
  private final AtomicLong reconnectAttempts = new AtomicLong(0L);
  private final AtomicReference<WebSocket> webSocketRef = new AtomicReference<>();
  private final AtomicReference<Listener> listenerRef = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> reconnectTaskRef = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> openDelayTaskRef = new AtomicReference<>();
  private final Object channelLock = new Object();
  private final Set<String> activeChannels = new LinkedHashSet<>();
  private boolean ready;

  public WebSocketStreamManager(
      String venue,
      String streamName,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      StreamConfig config,
      StreamProtocol protocol,
      AdapterEventBus eventBus,
      AdapterTelemetry telemetry,
      Clock clock) {
    if (venue == null || venue.isBlank()) {
      throw new IllegalArgumentException("venue is required");
    }
    if (streamName == null || streamName.isBlank()) {
      throw new IllegalArgumentException("streamName is required");
    }
    this.venue = venue;
    this.streamName = streamName;
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.protocol = Objects.requireNonNull(protocol, "protocol is required");
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, venue + "-" + streamName + "-stream");
              thread.setDaemon(true);
              return thread;
            });
  }

  public void open() {
    if (scheduler.isShutdown()) {
      throw new IllegalStateException(venue + " " + streamName + " stream was closed");
    }
    if (!running.compareAndSet(false, true)) {
      return;
    }
    log.info("Opening venue stream venue={} stream={} uri={}", venue, streamName, config.uri());
    scheduleReconnect(Duration.ZERO);
  }

  public void subscribe(Set<String> channels) {
    Set<String> added = new LinkedHashSet<>();
    boolean sendNow;
    synchronized (channelLock) {
      for (String channel : channels) {
        if (activeChannels.add(channel)) {
          added.add(channel);
        }
      }
      sendNow = ready && !added.isEmpty();
    }
    if (sendNow) {
      sendAll(protocol.subscribeMessages(added));
    }
  }

  public void unsubscribe(Set<String> channels) {
    Set<String> removed = new LinkedHashSet<>();
    boolean sendNow;
    synchronized (channelLock) {
      for (String channel : channels) {
        if (activeChannels.remove(channel)) {
          removed.add(channel);
        }
      }
      sendNow = ready && !removed.isEmpty();
    }
    if (sendNow) {
      sendAll(protocol.unsubscribeMessages(removed));
    }
  }

  public Set<String> activeChannels() {
    synchronized (channelLock) {
      return Set.copyOf(activeChannels);
    }
  }

  public boolean isConnected() {
    return connected.get();
  }

  public boolean isReady() {
    synchronized (channelLock) {
      return ready;
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public long reconnectAttempts() {
    return reconnectAttempts.get();
  }

  @Override
  public void close() {
    running.set(false);
    cancelTask(reconnectTaskRef);
    cancelTask(openDelayTaskRef);
    WebSocket webSocket = webSocketRef.get();
    if (webSocket != null) {
      try {
        webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "client_close").join();
      } catch (RuntimeException ex) {
        log.debug("Close frame not delivered venue={} stream={}", venue, streamName, ex);
        webSocket.abort();
      }
    }
    Listener listener = listenerRef.getAndSet(null);
    if (listener != null) {
      listener.terminate("client_close", null);
    }
    updateConnected(false);
    scheduler.shutdownNow();
  }

  private void connect() {
    if (!running.get()) {
      return;
    }
    protocol.reset();
    try {
      WebSocket.Builder builder =
          httpClient.newWebSocketBuilder().connectTimeout(config.connectTimeout());
      protocol.handshakeHeaders().forEach(builder::header);
      Listener listener = new Listener();
      listenerRef.set(listener);
      builder.buildAsync(config.uri(), listener).join();
    } catch (RuntimeException ex) {
      handleConnectFailure(ex);
    }
  }

  private void handleConnectFailure(Throwable error) {
    updateConnected(false);
    String message = sanitizeMessage(error);
    log.warn("Venue stream connect failed venue={} stream={} error={}", venue, streamName, message);
    publish(new ErrorEvent(venue, ErrorKind.CONNECTION, message, clock.instant()));
    scheduleNextAttempt();
  }

  private void scheduleNextAttempt() {
    if (!running.get()) {
      return;
    }
    if (!config.reconnectEnabled()) {
      running.set(false);
      return;
    }
    int attempt = consecutiveFailures.incrementAndGet();
    long reconnectCount = reconnectAttempts.incrementAndGet();
    Duration delay = nextBackoff(attempt);
    telemetry.onStreamReconnectScheduled(venue, streamName);
    log.info(
        "Venue stream reconnect scheduled venue={} stream={} attempt={} delay_ms={}",
        venue,
        streamName,
        reconnectCount,
        delay.toMillis());
    scheduleReconnect(delay);
  }

  private void scheduleReconnect(Duration delay) {
    if (!running.get()) {
      return;
    }
    cancelTask(reconnectTaskRef);
    long delayMs = Math.max(0L, delay.toMillis());
    try {
      reconnectTaskRef.set(scheduler.schedule(this::connect, delayMs, TimeUnit.MILLISECONDS));
    } catch (RejectedExecutionException ex) {
      log.debug("Reconnect not scheduled after close venue={} stream={}", venue, streamName);
    }
  }

  private void afterOpen(WebSocket webSocket) {
    Optional<String> handshake = protocol.handshakeMessage();
    if (handshake.isPresent()) {
      send(webSocket, handshake.get());
      return;
    }
    markReady();
  }

  private void markReady() {
    Set<String> snapshot;
    synchronized (channelLock) {
      if (ready) {
        return;
      }
      ready = true;
      snapshot = new LinkedHashSet<>(activeChannels);
    }
    consecutiveFailures.set(0);
    log.info(
        "Venue stream ready venue={} stream={} channels={}", venue, streamName, snapshot.size());
    if (!snapshot.isEmpty()) {
      sendAll(protocol.subscribeMessages(snapshot));
    }
  }

  private void sendAll(List<String> messages) {
    for (String message : messages) {
      sendAsync(message);
    }
  }

  private void sendAsync(String message) {
    if (!running.get()) {
      return;
    }
    try {
      scheduler.execute(
          () -> {
            WebSocket webSocket = webSocketRef.get();
            if (webSocket != null) {
              send(webSocket, message);
            }
          });
    } catch (RejectedExecutionException ex) {
      log.debug("Outbound frame dropped after close venue={} stream={}", venue, streamName);
    }
  }

  private void send(WebSocket webSocket, String message) {
    try {
      webSocket.sendText(message, true).join();
    } catch (RuntimeException ex) {
      log.warn(
          "Failed to send venue stream frame venue={} stream={} error={}",
          venue,
          streamName,
          sanitizeMessage(ex));
      webSocket.abort();
    }
  }

  private void handleMessage(WebSocket webSocket, String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      telemetry.onStreamMessage(venue, streamName, "parse_error");
      publish(
          new ErrorEvent(
              venue,
              ErrorKind.UNCLASSIFIED,
              "Malformed " + venue + " " + streamName + " frame: " + sanitizeMessage(ex),
              clock.instant()));
      return;
    }
    Optional<String> reply = protocol.heartbeatReply(root);
    if (reply.isPresent()) {
      telemetry.onStreamMessage(venue, streamName, "heartbeat");
      sendAsync(reply.get());
      return;
    }
    HandshakeStatus status = protocol.handshakeStatus(root);
    if (status == HandshakeStatus.ACCEPTED) {
      telemetry.onStreamMessage(venue, streamName, "handshake");
      markReady();
      return;
    }
    if (status == HandshakeStatus.REJECTED) {
      telemetry.onStreamMessage(venue, streamName, "handshake");
      rejectHandshake(webSocket);
      return;
    }
    try {
      List<AdapterEvent> events = protocol.decode(root);
      if (events.isEmpty()) {
        telemetry.onStreamMessage(venue, streamName, "ignored");
        return;
      }
      for (AdapterEvent event : events) {
        telemetry.onStreamMessage(venue, streamName, event.kind().code());
        publish(event);
      }
    } catch (ExchangeException ex) {
      telemetry.onStreamMessage(venue, streamName, "parse_error");
      publish(new ErrorEvent(venue, ex.kind(), ex.getMessage(), clock.instant()));
    } catch (RuntimeException ex) {
      telemetry.onStreamMessage(venue, streamName, "parse_error");
      publish(
          new ErrorEvent(
              venue,
              ErrorKind.UNCLASSIFIED,
              "Failed to decode " + venue + " " + streamName + " frame: " + sanitizeMessage(ex),
              clock.instant()));
    }
  }

  private void rejectHandshake(WebSocket webSocket) {
    log.warn("Venue stream handshake rejected venue={} stream={}", venue, streamName);
    running.set(false);
    cancelTask(reconnectTaskRef);
    publish(
        new ErrorEvent(
            venue,
            ErrorKind.AUTHENTICATION,
            venue + " " + streamName + " stream rejected authentication",
            clock.instant()));
    webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "auth_rejected");
  }

  private void publish(AdapterEvent event) {
    eventBus.publish(event);
  }

  private Duration nextBackoff(int attempt) {
    long base = config.reconnectBaseBackoff().toMillis();
    long max = config.reconnectMaxBackoff().toMillis();
    long value = base;
    int steps = Math.max(0, attempt - 1);
    for (int i = 0; i < steps; i++) {
      if (value >= max / 2) {
        value = max;
        break;
      }
      value *= 2;
    }
    return Duration.ofMillis(Math.min(value, max));
  }

  private void updateConnected(boolean value) {
    if (connected.getAndSet(value) != value) {
      telemetry.onStreamStateChanged(venue, streamName, value);
    }
  }

  private static void cancelTask(AtomicReference<ScheduledFuture<?>> taskRef) {
    ScheduledFuture<?> task = taskRef.getAndSet(null);
    if (task != null) {
      task.cancel(false);
    }
  }

  private static String sanitizeMessage(Throwable error) {
    Throwable unwrapped =
        error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
    String message = unwrapped.getMessage();
    if (message == null || message.isBlank()) {
      return unwrapped.getClass().getSimpleName();
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    return compact.length() <= 300 ? compact : compact.substring(0, 300);
  }

  private final class Listener implements WebSocket.Listener {
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final StringBuilder frameBuffer = new StringBuilder();

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocketRef.set(webSocket);
      updateConnected(true);
      log.info("Venue stream connected venue={} stream={}", venue, streamName);
      publish(new Connected(venue, streamName, clock.instant()));
      try {
        openDelayTaskRef.set(
            scheduler.schedule(
                () -> afterOpen(webSocket),
                config.openDelay().toMillis(),
                TimeUnit.MILLISECONDS));
      } catch (RejectedExecutionException ex) {
        log.debug("Stream opened after close venue={} stream={}", venue, streamName);
        webSocket.abort();
      }
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      frameBuffer.append(data);
      if (last) {
        String payload = frameBuffer.toString();
        frameBuffer.setLength(0);
        handleMessage(webSocket, payload);
      }
      webSocket.request(1);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      terminate(reason == null || reason.isBlank() ? "closed_" + statusCode : reason, null);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      terminate("ws_error", error);
    }

    private void terminate(String reason, Throwable error) {
      if (!terminated.compareAndSet(false, true)) {
        return;
      }
      cancelTask(openDelayTaskRef);
      synchronized (channelLock) {
        ready = false;
      }
      boolean wasOpen = connected.get();
      updateConnected(false);
      WebSocket socket = webSocketRef.getAndSet(null);
      if (socket != null) {
        socket.abort();
      }
      if (wasOpen) {
        log.info(
            "Venue stream disconnected venue={} stream={} reason={}", venue, streamName, reason);
        publish(new Disconnected(venue, streamName, reason, clock.instant()));
      }
      if (error != null) {
        publish(
            new ErrorEvent(venue, ErrorKind.CONNECTION, sanitizeMessage(error), clock.instant()));
      }
      scheduleNextAttempt();
    }
  }
}
