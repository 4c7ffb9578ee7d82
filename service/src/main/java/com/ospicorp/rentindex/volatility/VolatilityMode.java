package com.ospicorp.rentindex.volatility;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum VolatilityMode {
  FORECAST,
  RESIDUAL;

  @JsonValue
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static VolatilityMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return FORECAST;
    }
    return VolatilityMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
