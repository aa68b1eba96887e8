package com.venuelink.autoconfigure;

import com.venuelink.adapter.core.ExchangeAdapter;

@FunctionalInterface
public interface ExchangeAdapterFactory {
  ExchangeAdapter create();
}
