package com.venuelink.domain.market;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record AccountInfo(
    String accountId,
    String accountType,
    boolean tradingEnabled,
    Set<String> permissions,
    BalanceSheet balances,
    List<Position> positions,
    Instant timestamp) {
  public AccountInfo {
    DomainChecks.requireNonBlank(accountId, "accountId");
    DomainChecks.requireNonBlank(accountType, "accountType");
    permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    Objects.requireNonNull(balances, "balances must not be null");
    positions = positions == null ? List.of() : List.copyOf(positions);
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }
}
