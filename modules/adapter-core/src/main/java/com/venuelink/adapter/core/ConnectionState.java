package com.venuelink.adapter.core;

public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  AUTHENTICATED;

  public boolean isConnected() {
    return this == CONNECTED || this == AUTHENTICATED;
  }
}
