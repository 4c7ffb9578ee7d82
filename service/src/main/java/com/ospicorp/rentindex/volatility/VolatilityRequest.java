package com.ospicorp.rentindex.volatility;

import com.ospicorp.rentindex.forecast.ForecastResult;
import com.ospicorp.rentindex.series.model.RegionSeries;

/**
 * Input of one volatility computation; the variant selects the estimator.
 */
public sealed interface VolatilityRequest
    permits VolatilityRequest.FromForecast, VolatilityRequest.FromResidual {

  String region();

  VolatilityMode mode();

  record FromForecast(ForecastResult forecast) implements VolatilityRequest {
    @Override
    public String region() {
      return forecast.region();
    }

    @Override
    public VolatilityMode mode() {
      return VolatilityMode.FORECAST;
    }
  }

  record FromResidual(RegionSeries series, int window) implements VolatilityRequest {
    public FromResidual {
      if (window < 3) {
        throw new IllegalArgumentException("Rolling window must be at least 3, got " + window);
      }
    }

    @Override
    public String region() {
      return series.region();
    }

    @Override
    public VolatilityMode mode() {
      return VolatilityMode.RESIDUAL;
    }
  }
}
