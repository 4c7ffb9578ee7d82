package com.ospicorp.rentindex.volatility;

import java.util.List;

public record VolatilityResult(String region, VolatilityMode mode,
    List<VolatilityPoint> points) {

  public VolatilityResult {
    points = List.copyOf(points);
  }
}
