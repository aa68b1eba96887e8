package com.venuelink.adapter.core.event;

import java.time.Instant;

public interface AdapterEvent {
  String venue();

  EventKind kind();

  Instant occurredAt();
}
