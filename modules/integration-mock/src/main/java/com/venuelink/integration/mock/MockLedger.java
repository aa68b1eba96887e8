package com.venuelink.integration.mock;

import com.venuelink.adapter.core.error.InsufficientFundsException;
import com.venuelink.domain.market.Balance;
import com.venuelink.domain.market.BalanceSheet;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Free and reserved amounts per currency. Every mutation moves value between {@code free} and
 * {@code used} or in and out of the account as a whole, so {@code free + used == total} holds.
 */
final class MockLedger {
  private final String venueId;
  private final Map<String, Holding> holdings = new TreeMap<>();

  MockLedger(String venueId, Map<String, BigDecimal> initial) {
    this.venueId = venueId;
    initial.forEach((currency, amount) -> holding(currency).free = amount);
  }

  /** Moves {@code amount} from free to used, or rejects when free is short. */
  synchronized void reserve(String currency, BigDecimal amount) {
    Holding holding = holding(currency);
    if (holding.free.compareTo(amount) < 0) {
      throw new InsufficientFundsException(venueId, key(currency), amount, holding.free);
    }
    holding.free = holding.free.subtract(amount);
    holding.used = holding.used.add(amount);
  }

  /** Returns up to {@code amount} of reserved funds to free. */
  synchronized void release(String currency, BigDecimal amount) {
    Holding holding = holding(currency);
    BigDecimal released = amount.min(holding.used);
    holding.used = holding.used.subtract(released);
    holding.free = holding.free.add(released);
  }

  /**
   * Removes {@code fromReserved} out of used and {@code fromFree} out of free in one step; nothing
   * changes when either side cannot cover its part.
   */
  synchronized void spend(String currency, BigDecimal fromReserved, BigDecimal fromFree) {
    Holding holding = holding(currency);
    if (holding.used.compareTo(fromReserved) < 0) {
      throw new IllegalStateException(
          "Reserved " + key(currency) + " " + holding.used + " cannot cover " + fromReserved);
    }
    if (holding.free.compareTo(fromFree) < 0) {
      throw new InsufficientFundsException(venueId, key(currency), fromFree, holding.free);
    }
    holding.used = holding.used.subtract(fromReserved);
    holding.free = holding.free.subtract(fromFree);
  }

  synchronized void credit(String currency, BigDecimal amount) {
    Holding holding = holding(currency);
    holding.free = holding.free.add(amount);
  }

  synchronized Balance balance(String currency) {
    Holding holding = holding(currency);
    return Balance.of(key(currency), holding.free, holding.used);
  }

  synchronized BalanceSheet snapshot(Instant timestamp) {
    List<Balance> balances = new ArrayList<>();
    for (Map.Entry<String, Holding> entry : holdings.entrySet()) {
      balances.add(Balance.of(entry.getKey(), entry.getValue().free, entry.getValue().used));
    }
    return BalanceSheet.of(timestamp, balances);
  }

  private Holding holding(String currency) {
    return holdings.computeIfAbsent(key(currency), ignored -> new Holding());
  }

  private static String key(String currency) {
    return currency.trim().toUpperCase(Locale.ROOT);
  }

  private static final class Holding {
    private BigDecimal free = BigDecimal.ZERO;
    private BigDecimal used = BigDecimal.ZERO;
  }
}
