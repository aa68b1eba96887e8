package com.venuelink.integration.mock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.venuelink.adapter.core.error.InsufficientFundsException;
import com.venuelink.domain.market.Balance;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MockLedgerTest {
  private final MockLedger ledger =
      new MockLedger("mock", Map.of("usd", new BigDecimal("100"), "BTC", BigDecimal.ONE));

  @Test
  void shouldMoveReservedFundsOutOfFree() {
    ledger.reserve("USD", new BigDecimal("40"));

    assertBalance("USD", "60", "40");
  }

  @Test
  void shouldRejectReservationBeyondFree() {
    ledger.reserve("USD", new BigDecimal("90"));

    InsufficientFundsException error =
        assertThrows(
            InsufficientFundsException.class, () -> ledger.reserve("USD", new BigDecimal("20")));

    assertEquals("USD", error.currency());
    assertEquals(0, new BigDecimal("10").compareTo(error.available()));
    assertBalance("USD", "10", "90");
  }

  @Test
  void shouldSpendReservationBeforeFreeAndReleaseTheRest() {
    ledger.reserve("USD", new BigDecimal("50"));

    ledger.spend("USD", new BigDecimal("30"), new BigDecimal("5"));
    assertBalance("USD", "45", "20");

    ledger.release("USD", new BigDecimal("20"));
    assertBalance("USD", "65", "0");
  }

  @Test
  void shouldLeaveBalancesUntouchedWhenFreeCannotCoverExcess() {
    ledger.reserve("BTC", new BigDecimal("0.5"));

    assertThrows(
        InsufficientFundsException.class,
        () -> ledger.spend("BTC", new BigDecimal("0.5"), new BigDecimal("0.6")));

    assertBalance("BTC", "0.5", "0.5");
  }

  @Test
  void shouldCreditUnknownCurrencies() {
    ledger.credit("eth", new BigDecimal("2"));

    assertEquals(3, ledger.snapshot(Instant.EPOCH).balances().size());
    assertBalance("ETH", "2", "0");
  }

  private void assertBalance(String currency, String free, String used) {
    Balance balance = ledger.balance(currency);
    assertEquals(0, new BigDecimal(free).compareTo(balance.free()), "free " + currency);
    assertEquals(0, new BigDecimal(used).compareTo(balance.used()), "used " + currency);
    assertEquals(0, balance.free().add(balance.used()).compareTo(balance.total()));
  }
}
