package com.ospicorp.rentindex.volatility;

import com.ospicorp.rentindex.forecast.ForecastPoint;
import com.ospicorp.rentindex.forecast.ForecastResult;
import com.ospicorp.rentindex.series.model.DataPoint;
import com.ospicorp.rentindex.series.model.RegionSeries;
import com.ospicorp.rentindex.series.service.RollingStats;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class VolatilityEstimator {

  public static final int DEFAULT_WINDOW = 12;
  static final double ZERO_TOLERANCE = 1e-12;

  public VolatilityResult estimate(VolatilityRequest request) {
    if (request instanceof VolatilityRequest.FromForecast fromForecast) {
      return fromForecast(fromForecast.forecast());
    }
    if (request instanceof VolatilityRequest.FromResidual fromResidual) {
      return fromResidual(fromResidual.series(), fromResidual.window());
    }
    throw new IllegalStateException("Unhandled volatility request " + request);
  }

  VolatilityResult fromForecast(ForecastResult forecast) {
    List<VolatilityPoint> points = new ArrayList<>(forecast.points().size());
    for (ForecastPoint p : forecast.points()) {
      points.add(new VolatilityPoint(p.date(), ratio(Math.abs(p.upper() - p.lower()),
          Math.abs(p.mean()))));
    }
    return new VolatilityResult(forecast.region(), VolatilityMode.FORECAST, points);
  }

  VolatilityResult fromResidual(RegionSeries series, int window) {
    int minPeriods = RollingStats.defaultMinPeriods(window);
    Double[] values = series.values();
    Double[] trend = RollingStats.mean(values, window, minPeriods);

    // residuals where both sides exist, compacted before the second rolling pass
    List<Integer> positions = new ArrayList<>();
    List<Double> residuals = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      if (values[i] != null && trend[i] != null) {
        positions.add(i);
        residuals.add(values[i] - trend[i]);
      }
    }
    Double[] dispersion = RollingStats.std(residuals.toArray(new Double[0]), window, minPeriods);

    List<VolatilityPoint> points = new ArrayList<>();
    for (int j = 0; j < dispersion.length; j++) {
      if (dispersion[j] == null) {
        continue;
      }
      int i = positions.get(j);
      Double index = ratio(dispersion[j], trend[i]);
      if (index != null) {
        points.add(new VolatilityPoint(series.points().get(i).date(), index));
      }
    }
    return new VolatilityResult(series.region(), VolatilityMode.RESIDUAL, points);
  }

  public List<DataPoint> trend(RegionSeries series, int window) {
    if (window < 3) {
      throw new IllegalArgumentException("Rolling window must be at least 3, got " + window);
    }
    Double[] trend = RollingStats.mean(series.values(), window,
        RollingStats.defaultMinPeriods(window));
    List<DataPoint> out = new ArrayList<>(trend.length);
    for (int i = 0; i < trend.length; i++) {
      LocalDate month = series.points().get(i).date();
      out.add(new DataPoint(month, trend[i]));
    }
    return out;
  }

  private static Double ratio(double numerator, double denominator) {
    if (Math.abs(denominator) < ZERO_TOLERANCE) {
      return null;
    }
    double value = numerator / denominator;
    return Double.isFinite(value) ? value : null;
  }
}
