package com.venuelink.adapter.core.stream;

public enum HandshakeStatus {
  NONE,
  ACCEPTED,
  REJECTED
}
