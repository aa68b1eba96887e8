package com.venuelink.adapter.core.http;

import com.venuelink.adapter.core.error.ConnectionException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class VenueHttpTransport {
  private static final Logger log = LoggerFactory.getLogger(VenueHttpTransport.class);

  private final String venue;
  private final HttpClient httpClient;
  private final Duration timeout;

  public VenueHttpTransport(String venue, HttpClient httpClient, Duration timeout) {
    if (venue == null || venue.isBlank()) {
      throw new IllegalArgumentException("venue is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    this.venue = venue;
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.timeout = timeout;
  }

  public VenueHttpResponse get(URI uri, Map<String, String> headers, String action) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout).GET();
    headers.forEach(builder::header);
    return execute(builder.build(), action);
  }

  public VenueHttpResponse post(
      URI uri, String body, Map<String, String> headers, String action) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .POST(
                HttpRequest.BodyPublishers.ofString(
                    body == null ? "" : body, StandardCharsets.UTF_8));
    headers.forEach(builder::header);
    return execute(builder.build(), action);
  }

  private VenueHttpResponse execute(HttpRequest request, String action) {
    log.debug(
        "Sending venue request venue={} action={} method={} uri={}",
        venue,
        action,
        request.method(),
        request.uri());
    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      return new VenueHttpResponse(response.statusCode(), response.body(), response.headers());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ConnectionException(venue, venue + " " + action + " request was interrupted", ex);
    } catch (HttpTimeoutException ex) {
      throw new ConnectionException(venue, venue + " " + action + " request timed out", ex);
    } catch (IOException ex) {
      throw new ConnectionException(venue, "Failed " + venue + " " + action + " request", ex);
    }
  }
}
