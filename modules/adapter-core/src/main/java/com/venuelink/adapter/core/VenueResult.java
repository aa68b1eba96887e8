package com.venuelink.adapter.core;

import java.util.Objects;
import java.util.function.Function;

public record VenueResult<T>(T data, ResponseMetadata metadata) {
  public VenueResult {
    Objects.requireNonNull(metadata, "metadata must not be null");
  }

  public <R> VenueResult<R> map(Function<? super T, ? extends R> mapper) {
    return new VenueResult<>(mapper.apply(data), metadata);
  }
}
