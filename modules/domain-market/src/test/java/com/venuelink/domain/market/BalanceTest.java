package com.venuelink.domain.market;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class BalanceTest {
  @Test
  void shouldRequireFreePlusUsedToEqualTotal() {
    assertThrows(
        MarketDomainException.class,
        () ->
            new Balance(
                "USD", new BigDecimal("10"), new BigDecimal("5"), new BigDecimal("16")));
  }

  @Test
  void shouldLookUpBalancesCaseInsensitively() {
    BalanceSheet sheet =
        BalanceSheet.of(
            Instant.parse("2026-02-24T00:00:00Z"),
            List.of(Balance.of("usd", new BigDecimal("100"), new BigDecimal("25"))));

    assertEquals(new BigDecimal("125"), sheet.balance("Usd").total());
    assertEquals(BigDecimal.ZERO, sheet.balance("BTC").total());
  }

  @Test
  void shouldRejectDuplicateCurrencies() {
    assertThrows(
        MarketDomainException.class,
        () ->
            BalanceSheet.of(
                Instant.parse("2026-02-24T00:00:00Z"),
                List.of(Balance.zero("BTC"), Balance.zero("btc"))));
  }
}
