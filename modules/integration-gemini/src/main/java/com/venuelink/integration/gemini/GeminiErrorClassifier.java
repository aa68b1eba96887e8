package com.venuelink.integration.gemini;

import com.venuelink.adapter.core.error.ErrorKind;
import com.venuelink.adapter.core.error.ErrorKindMapping;
import com.venuelink.adapter.core.error.ExchangeException;
import com.venuelink.adapter.core.error.VenueErrorClassifier;
import com.venuelink.adapter.core.error.VenueFailure;
import java.util.Map;

/** Classifies on the {@code reason} field of Gemini error bodies, then on HTTP status. */
public class GeminiErrorClassifier implements VenueErrorClassifier {
  private static final ErrorKindMapping MAPPING =
      new ErrorKindMapping(
          Map.ofEntries(
              Map.entry("InvalidSignature", ErrorKind.AUTHENTICATION),
              Map.entry("InvalidApiKey", ErrorKind.AUTHENTICATION),
              Map.entry("MissingApikeyHeader", ErrorKind.AUTHENTICATION),
              Map.entry("InvalidNonce", ErrorKind.AUTHENTICATION),
              Map.entry("MissingRole", ErrorKind.AUTHENTICATION),
              Map.entry("AccountNotFound", ErrorKind.AUTHENTICATION),
              Map.entry("RateLimit", ErrorKind.RATE_LIMIT),
              Map.entry("RateLimited", ErrorKind.RATE_LIMIT),
              Map.entry("InsufficientFunds", ErrorKind.INSUFFICIENT_FUNDS),
              Map.entry("InvalidSymbol", ErrorKind.INVALID_SYMBOL),
              Map.entry("OrderNotFound", ErrorKind.ORDER),
              Map.entry("InvalidPrice", ErrorKind.ORDER),
              Map.entry("InvalidQuantity", ErrorKind.ORDER),
              Map.entry("InvalidOrderType", ErrorKind.ORDER),
              Map.entry("InvalidSide", ErrorKind.ORDER),
              Map.entry("ClientOrderIdTooLong", ErrorKind.ORDER),
              Map.entry("AuctionNotOpen", ErrorKind.ORDER),
              Map.entry("MarketNotOpen", ErrorKind.ORDER),
              Map.entry("InvalidStopPrice", ErrorKind.ORDER),
              Map.entry("System", ErrorKind.CONNECTION),
              Map.entry("Maintenance", ErrorKind.CONNECTION)),
          Map.of(
              400, ErrorKind.ORDER,
              401, ErrorKind.AUTHENTICATION,
              403, ErrorKind.AUTHENTICATION,
              404, ErrorKind.INVALID_SYMBOL,
              429, ErrorKind.RATE_LIMIT));

  @Override
  public ExchangeException classify(VenueFailure failure) {
    return MAPPING.toException(failure);
  }

  public ErrorKind kindOf(VenueFailure failure) {
    return MAPPING.resolve(failure);
  }
}
