package com.venuelink.integration.cryptocom;

import com.venuelink.adapter.core.error.ErrorKind;
import com.venuelink.adapter.core.error.ErrorKindMapping;
import com.venuelink.adapter.core.error.ExchangeException;
import com.venuelink.adapter.core.error.VenueErrorClassifier;
import com.venuelink.adapter.core.error.VenueFailure;
import java.util.HashMap;
import java.util.Map;

public class CryptoComErrorClassifier implements VenueErrorClassifier {
  private static final ErrorKindMapping MAPPING = new ErrorKindMapping(codes(), statuses());

  @Override
  public ExchangeException classify(VenueFailure failure) {
    return MAPPING.toException(failure);
  }

  public ErrorKind kindOf(VenueFailure failure) {
    return MAPPING.resolve(failure);
  }

  private static Map<String, ErrorKind> codes() {
    Map<String, ErrorKind> codes = new HashMap<>();
    codes.put("10001", ErrorKind.CONNECTION);
    codes.put("10002", ErrorKind.AUTHENTICATION);
    codes.put("10003", ErrorKind.AUTHENTICATION);
    codes.put("10007", ErrorKind.AUTHENTICATION);
    codes.put("10006", ErrorKind.RATE_LIMIT);
    codes.put("306", ErrorKind.INSUFFICIENT_FUNDS);
    codes.put("20002", ErrorKind.INSUFFICIENT_FUNDS);
    codes.put("30003", ErrorKind.INVALID_SYMBOL);
    codes.put("316", ErrorKind.ORDER);
    codes.put("10004", ErrorKind.ORDER);
    codes.put("20001", ErrorKind.ORDER);
    // 30004..30025: price, quantity and notional bounds on order parameters
    for (int code = 30004; code <= 30025; code++) {
      codes.put(Integer.toString(code), ErrorKind.ORDER);
    }
    return codes;
  }

  private static Map<Integer, ErrorKind> statuses() {
    return Map.of(
        401, ErrorKind.AUTHENTICATION,
        403, ErrorKind.AUTHENTICATION,
        429, ErrorKind.RATE_LIMIT);
  }
}
