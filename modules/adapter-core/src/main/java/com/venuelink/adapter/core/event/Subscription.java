package com.venuelink.adapter.core.event;

public interface Subscription extends AutoCloseable {
  void unsubscribe();

  boolean isActive();

  @Override
  default void close() {
    unsubscribe();
  }
}
