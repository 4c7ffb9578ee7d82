package com.ospicorp.rentindex.forecast;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Forecast of one region for the months after its last observation. {@code model} is absent
 * when the result was read back from an artifact.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResult(String region, int horizon, List<ForecastPoint> points,
    SarimaFit model) {

  public ForecastResult {
    points = List.copyOf(points);
  }
}
