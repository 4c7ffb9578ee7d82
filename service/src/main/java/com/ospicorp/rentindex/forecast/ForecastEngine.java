package com.ospicorp.rentindex.forecast;

import com.ospicorp.rentindex.error.ForecastFitException;
import com.ospicorp.rentindex.error.InsufficientHistoryException;
import com.ospicorp.rentindex.series.model.DataPoint;
import com.ospicorp.rentindex.series.model.RegionSeries;
import com.ospicorp.rentindex.series.service.FillPolicy;
import com.ospicorp.rentindex.series.service.Filler;
import com.ospicorp.rentindex.series.service.MonthlyCalendar;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ForecastEngine {
  private static final Logger log = LoggerFactory.getLogger(ForecastEngine.class);

  public static final int DEFAULT_HORIZON = 9;
  public static final int MIN_OBSERVATIONS = 2 * SarimaModel.SEASON;

  private final int maxIterations;

  public ForecastEngine() {
    this(SarimaModel.MAX_ITERATIONS);
  }

  ForecastEngine(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public ForecastResult forecast(RegionSeries series, int horizon) {
    if (horizon < 1) {
      throw new IllegalArgumentException("Forecast horizon must be greater than 0");
    }
    String region = series.region();
    int observed = series.nonMissingCount();
    if (observed < MIN_OBSERVATIONS) {
      throw new InsufficientHistoryException(region, observed, MIN_OBSERVATIONS);
    }

    double[] y = prepare(series.points());
    SarimaModel model = new SarimaModel(y);
    NelderMead.Result result = model.fit(maxIterations);
    if (!result.converged()) {
      throw new ForecastFitException(region,
          "no convergence after " + result.iterations() + " iterations");
    }
    if (!Double.isFinite(result.value())) {
      throw new ForecastFitException(region, "objective is not finite at the optimum");
    }
    SarimaFit fit = model.summarize(result);
    log.debug("Region {}: ar.L1={} ma.L1={} ma.S.L12={} sigma2={} ({} iterations)", region,
        fit.ar(), fit.ma(), fit.seasonalMa(), fit.sigma2(), fit.iterations());

    double[][] forecast = model.forecast(fit, horizon);
    double[] means = forecast[0];
    double[] variances = forecast[1];
    List<LocalDate> months = MonthlyCalendar.following(series.lastMonth(), horizon);
    List<ForecastPoint> points = new ArrayList<>(horizon);
    for (int h = 0; h < horizon; h++) {
      double halfWidth = SarimaModel.Z_95 * Math.sqrt(variances[h]);
      if (!Double.isFinite(means[h]) || !Double.isFinite(halfWidth)) {
        throw new ForecastFitException(region, "non-finite forecast at step " + (h + 1));
      }
      points.add(new ForecastPoint(months.get(h), means[h], means[h] - halfWidth,
          means[h] + halfWidth));
    }
    return new ForecastResult(region, horizon, points, fit);
  }

  // Leading gaps are dropped, interior gaps interpolated and trailing gaps carried forward.
  static double[] prepare(List<DataPoint> points) {
    int first = 0;
    while (first < points.size() && points.get(first).isMissing()) {
      first++;
    }
    List<DataPoint> filled = Filler.fill(
        Filler.fill(points.subList(first, points.size()), FillPolicy.LINEAR), FillPolicy.FFILL);
    double[] y = new double[filled.size()];
    for (int i = 0; i < y.length; i++) {
      y[i] = filled.get(i).value();
    }
    return y;
  }
}
