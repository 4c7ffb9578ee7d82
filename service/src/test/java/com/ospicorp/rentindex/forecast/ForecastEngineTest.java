package com.ospicorp.rentindex.forecast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.rentindex.DatasetFixtures;
import com.ospicorp.rentindex.error.ForecastFitException;
import com.ospicorp.rentindex.error.InsufficientHistoryException;
import com.ospicorp.rentindex.series.model.DataPoint;
import com.ospicorp.rentindex.series.model.RegionSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ForecastEngineTest {

  private final ForecastEngine engine = new ForecastEngine();

  @Test
  void constantSeriesForecastsItsLevel() {
    double[] values = new double[36];
    Arrays.fill(values, 1800.0);

    ForecastResult result = engine.forecast(series("TX", values), ForecastEngine.DEFAULT_HORIZON);

    assertThat(result.points()).hasSize(9);
    for (ForecastPoint p : result.points()) {
      assertThat(p.mean()).isCloseTo(1800.0, within(1e-6));
      assertThat(p.lower()).isLessThanOrEqualTo(p.mean());
      assertThat(p.upper()).isGreaterThanOrEqualTo(p.mean());
    }
  }

  @Test
  void deterministicTrendAndSeasonAreExtrapolated() {
    int n = 48;
    double[] values = new double[n];
    for (int t = 0; t < n; t++) {
      values[t] = 1500 + 4 * t + 30 * Math.sin(2 * Math.PI * t / 12);
    }

    ForecastResult result = engine.forecast(series("GA", values), 6);

    for (int h = 0; h < 6; h++) {
      int t = n + h;
      double expected = 1500 + 4 * t + 30 * Math.sin(2 * Math.PI * t / 12);
      assertThat(result.points().get(h).mean()).isCloseTo(expected, within(1e-6));
    }
  }

  @Test
  void forecastMonthsFollowTheLastObservationAndBandsWiden() {
    double[] values = DatasetFixtures.seededSeries(60, 1450.0, 3.5, 4.0, 12.0, 42L);

    ForecastResult result = engine.forecast(series("TX", values), 9);

    assertThat(result.region()).isEqualTo("TX");
    assertThat(result.horizon()).isEqualTo(9);
    assertThat(result.points().get(0).date()).isEqualTo(LocalDate.of(2024, 1, 1));
    assertThat(result.points().get(8).date()).isEqualTo(LocalDate.of(2024, 9, 1));
    for (ForecastPoint p : result.points()) {
      assertThat(p.lower()).isLessThan(p.mean());
      assertThat(p.mean()).isLessThan(p.upper());
    }
    ForecastPoint first = result.points().get(0);
    ForecastPoint last = result.points().get(8);
    assertThat(last.upper() - last.lower()).isGreaterThan(first.upper() - first.lower());

    SarimaFit model = result.model();
    assertThat(model.sigma2()).isPositive();
    assertThat(model.residualCount()).isEqualTo(60 - 13 - 1);
  }

  @Test
  void seasonalRandomWalksFitWithoutFailures() {
    List<String> failures = new ArrayList<>();
    for (int months : new int[] {24, 30, 36, 60, 120}) {
      for (long seed = 0; seed < 12; seed++) {
        double[] values = randomWalkWithSeason(months, seed);
        try {
          ForecastResult result = engine.forecast(series("CA", values), 9);
          for (ForecastPoint p : result.points()) {
            assertThat(p.lower()).isLessThanOrEqualTo(p.mean());
            assertThat(p.upper()).isGreaterThanOrEqualTo(p.mean());
          }
        } catch (ForecastFitException ex) {
          failures.add(months + "/" + seed + ": " + ex.getMessage());
        }
      }
    }

    assertThat(failures).isEmpty();
  }

  @Test
  void fitFailureCarriesTheRegion() {
    ForecastEngine capped = new ForecastEngine(1);
    double[] values = DatasetFixtures.seededSeries(60, 1450.0, 3.5, 4.0, 12.0, 42L);

    assertThatThrownBy(() -> capped.forecast(series("75001", values), 9))
        .isInstanceOf(ForecastFitException.class)
        .hasMessageContaining("75001")
        .satisfies(ex -> assertThat(((ForecastFitException) ex).region()).isEqualTo("75001"));
  }

  @Test
  void interiorGapsAreInterpolatedBeforeFitting() {
    double[] values = DatasetFixtures.seededSeries(40, 1450.0, 3.5, 4.0, 12.0, 7L);
    List<DataPoint> points = new ArrayList<>(series("TX", values).points());
    points.set(20, new DataPoint(points.get(20).date(), null));
    points.set(0, new DataPoint(points.get(0).date(), null));

    double[] prepared = ForecastEngine.prepare(points);

    assertThat(prepared).hasSize(39);
    assertThat(prepared[19]).isCloseTo((values[19] + values[21]) / 2, within(1e-9));
  }

  @Test
  void shortHistoryIsRejected() {
    double[] values = DatasetFixtures.seededSeries(23, 1450.0, 3.5, 4.0, 12.0, 1L);

    assertThatThrownBy(() -> engine.forecast(series("00501", values), 9))
        .isInstanceOf(InsufficientHistoryException.class)
        .hasMessageContaining("00501");
  }

  @Test
  void horizonMustBePositive() {
    double[] values = new double[36];

    assertThatThrownBy(() -> engine.forecast(series("TX", values), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  static double[] randomWalkWithSeason(int months, long seed) {
    Random random = new Random(seed);
    double[] values = new double[months];
    double level = 1500;
    for (int t = 0; t < months; t++) {
      level += 3 + 6 * random.nextGaussian();
      values[t] = level + 20 * Math.sin(2 * Math.PI * t / 12);
    }
    return values;
  }

  static RegionSeries series(String region, double[] values) {
    List<DataPoint> points = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      points.add(new DataPoint(LocalDate.of(2019, 1, 1).plusMonths(i), values[i]));
    }
    return new RegionSeries(region, "zori_smoothed_seasonal", points);
  }
}
