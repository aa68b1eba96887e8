package com.venuelink.domain.market;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public record BalanceSheet(Instant timestamp, Map<String, Balance> balances) {
  public BalanceSheet {
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    balances = Map.copyOf(Objects.requireNonNull(balances, "balances must not be null"));
  }

  public static BalanceSheet of(Instant timestamp, Collection<Balance> balances) {
    Map<String, Balance> byCurrency = new LinkedHashMap<>();
    for (Balance balance : balances) {
      if (byCurrency.putIfAbsent(balance.currency(), balance) != null) {
        throw new MarketDomainException("duplicate balance for " + balance.currency());
      }
    }
    return new BalanceSheet(timestamp, byCurrency);
  }

  public Balance balance(String currency) {
    String key = currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
    Balance balance = balances.get(key);
    return balance == null ? Balance.zero(key.isEmpty() ? "UNKNOWN" : key) : balance;
  }
}
