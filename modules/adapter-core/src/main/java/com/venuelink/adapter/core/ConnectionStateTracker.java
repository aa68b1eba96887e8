package com.venuelink.adapter.core;

import com.venuelink.adapter.core.error.AuthenticationException;
import com.venuelink.adapter.core.error.ConnectionException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

public class ConnectionStateTracker {
  private static final Map<ConnectionState, EnumSet<ConnectionState>> ALLOWED_TRANSITIONS =
      Map.of(
          ConnectionState.DISCONNECTED, EnumSet.of(ConnectionState.CONNECTING),
          ConnectionState.CONNECTING,
              EnumSet.of(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED),
          ConnectionState.CONNECTED,
              EnumSet.of(ConnectionState.AUTHENTICATED, ConnectionState.DISCONNECTED),
          ConnectionState.AUTHENTICATED,
              EnumSet.of(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED));

  private final String venue;
  private final AtomicReference<ConnectionState> state =
      new AtomicReference<>(ConnectionState.DISCONNECTED);

  public ConnectionStateTracker(String venue) {
    this.venue = Objects.requireNonNull(venue, "venue must not be null");
  }

  public ConnectionState current() {
    return state.get();
  }

  public boolean beginConnecting() {
    return state.compareAndSet(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);
  }

  public void markConnected() {
    transition(ConnectionState.CONNECTED);
  }

  public void markAuthenticated() {
    transition(ConnectionState.AUTHENTICATED);
  }

  public void revokeAuthentication() {
    state.compareAndSet(ConnectionState.AUTHENTICATED, ConnectionState.CONNECTED);
  }

  public ConnectionState markDisconnected() {
    return state.getAndSet(ConnectionState.DISCONNECTED);
  }

  public void requireConnected() {
    if (!state.get().isConnected()) {
      throw new ConnectionException(venue, venue + " adapter is not connected");
    }
  }

  public void requireAuthenticated() {
    ConnectionState current = state.get();
    if (!current.isConnected()) {
      throw new ConnectionException(venue, venue + " adapter is not connected");
    }
    if (current != ConnectionState.AUTHENTICATED) {
      throw new AuthenticationException(venue, venue + " adapter is not authenticated");
    }
  }

  private void transition(ConnectionState target) {
    state.updateAndGet(
        current -> {
          if (current == target) {
            return current;
          }
          EnumSet<ConnectionState> allowed = ALLOWED_TRANSITIONS.get(current);
          if (allowed == null || !allowed.contains(target)) {
            throw new ConnectionException(
                venue, venue + " adapter cannot move from " + current + " to " + target);
          }
          return target;
        });
  }
}
