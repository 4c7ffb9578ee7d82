package com.ospicorp.rentindex.forecast;

/**
 * Seasonal ARIMA (1,1,1)x(0,1,1,12) without constant.
 *
 * <p>With {@code w = (1 - B)(1 - B^12) y} the model is
 * {@code (1 - phi B) w_t = (1 + theta B)(1 + Theta B^12) e_t}. Conditional on the first
 * differenced value, {@code u_t = w_t - phi w_(t-1)} is a pure moving average whose exact
 * Gaussian likelihood is evaluated with a Kalman filter, so coefficients outside the invertible
 * region are scored like their reflections. Coefficients are unrestricted. Forecast variances
 * come from the psi weights of the full model including both differences.
 */
final class SarimaModel {
  static final int SEASON = 12;
  static final int DIFFERENCE_SPAN = SEASON + 1;
  static final int MA_ORDER = SEASON + 1;
  static final double Z_95 = 1.959963984540054;
  static final int MAX_ITERATIONS = 5_000;

  private static final int RESTARTS = 2;
  private static final double INITIAL_STEP = 0.1;
  private static final double MIN_VARIANCE = 1e-12;

  private final double[] y;
  private final double[] w;

  SarimaModel(double[] y) {
    if (y.length < DIFFERENCE_SPAN + 2) {
      throw new IllegalArgumentException("series too short for seasonal differencing: " + y.length);
    }
    this.y = y.clone();
    this.w = difference(y);
  }

  NelderMead.Result fit(int maxIterations) {
    NelderMead optimizer = new NelderMead(1e-10, 1e-14, 1e-9, maxIterations, RESTARTS);
    return optimizer.minimize(p -> objective(p[0], p[1], p[2]), new double[3], INITIAL_STEP);
  }

  SarimaFit summarize(NelderMead.Result result) {
    double[] p = result.point();
    Filtered filtered = filter(p[0], p[1], p[2]);
    return new SarimaFit(p[0], p[1], p[2], filtered.sigma2(), filtered.count(),
        result.iterations());
  }

  // n log(sigma2) + sum log F_t with sigma2 profiled out
  double objective(double phi, double theta, double seasonalTheta) {
    Filtered filtered = filter(phi, theta, seasonalTheta);
    double value = filtered.count() * Math.log(Math.max(filtered.sigma2(), MIN_VARIANCE))
        + filtered.logDeterminant();
    return Double.isFinite(value) ? value : Double.POSITIVE_INFINITY;
  }

  /**
   * Point forecasts and forecast-error variances for the next {@code steps} months.
   *
   * @return {@code [means, variances]}
   */
  double[][] forecast(SarimaFit fit, int steps) {
    double phi = fit.ar();
    double[] state = filter(phi, fit.ma(), fit.seasonalMa()).state();
    int m = w.length;
    int n = y.length;

    double[] wx = new double[m + steps];
    System.arraycopy(w, 0, wx, 0, m);
    double[] yx = new double[n + steps];
    System.arraycopy(y, 0, yx, 0, n);

    double[] means = new double[steps];
    for (int h = 0; h < steps; h++) {
      int k = m + h;
      double innovation = h < state.length ? state[h] : 0;
      wx[k] = phi * wx[k - 1] + innovation;
      int t = n + h;
      yx[t] = wx[k] + yx[t - 1] + yx[t - SEASON] - yx[t - DIFFERENCE_SPAN];
      means[h] = yx[t];
    }

    double[] psi = psiWeights(phi, fit.ma(), fit.seasonalMa(), steps);
    double[] variances = new double[steps];
    double cumulative = 0;
    for (int h = 0; h < steps; h++) {
      cumulative += psi[h] * psi[h];
      variances[h] = fit.sigma2() * cumulative;
    }
    return new double[][] {means, variances};
  }

  // Kalman filter over u_t = w_t - phi w_(t-1), state a_t[i] = sum_(j >= i) c_j e_(t+i-j).
  private Filtered filter(double phi, double theta, double seasonalTheta) {
    double[] c = maCoefficients(theta, seasonalTheta);
    int r = c.length;
    double[] a = new double[r];
    double[][] p = stationaryCovariance(c);
    double[] gain = new double[r];
    double sumSquares = 0;
    double logDeterminant = 0;
    int count = 0;

    for (int k = 1; k < w.length; k++) {
      double v = w[k] - phi * w[k - 1] - a[0];
      double f = p[0][0];
      sumSquares += v * v / f;
      logDeterminant += Math.log(f);
      count++;

      for (int i = 0; i < r; i++) {
        gain[i] = p[i][0] / f;
      }
      double[] next = new double[r];
      double[][] nextP = new double[r][r];
      for (int i = 0; i < r; i++) {
        if (i + 1 < r) {
          next[i] = a[i + 1] + gain[i + 1] * v;
        }
        for (int j = 0; j < r; j++) {
          double shifted = i + 1 < r && j + 1 < r
              ? p[i + 1][j + 1] - gain[i + 1] * p[0][j + 1]
              : 0;
          nextP[i][j] = shifted + c[i] * c[j];
        }
      }
      a = next;
      p = nextP;
    }
    return new Filtered(sumSquares / count, logDeterminant, count, a);
  }

  static double[] maCoefficients(double theta, double seasonalTheta) {
    double[] c = new double[MA_ORDER + 1];
    c[0] = 1;
    c[1] = theta;
    c[SEASON] = seasonalTheta;
    c[SEASON + 1] = theta * seasonalTheta;
    return c;
  }

  static double[][] stationaryCovariance(double[] c) {
    int r = c.length;
    double[][] p = new double[r][r];
    for (int i = 0; i < r; i++) {
      for (int j = 0; j < r; j++) {
        double sum = 0;
        for (int k = 0; k + Math.max(i, j) < r; k++) {
          sum += c[k + i] * c[k + j];
        }
        p[i][j] = sum;
      }
    }
    return p;
  }

  private record Filtered(double sigma2, double logDeterminant, int count, double[] state) {}

  static double[] difference(double[] y) {
    double[] w = new double[y.length - DIFFERENCE_SPAN];
    for (int k = 0; k < w.length; k++) {
      w[k] = y[k + DIFFERENCE_SPAN] - y[k + SEASON] - y[k + 1] + y[k];
    }
    return w;
  }

  static double[] psiWeights(double phi, double theta, double seasonalTheta, int count) {
    double[] ar = multiply(multiply(new double[] {1, -phi}, new double[] {1, -1}),
        seasonalDifference());
    double[] ma = multiply(new double[] {1, theta}, seasonalMa(seasonalTheta));
    double[] psi = new double[count];
    for (int j = 0; j < count; j++) {
      double value = j < ma.length ? ma[j] : 0;
      for (int i = 1; i <= Math.min(j, ar.length - 1); i++) {
        value -= ar[i] * psi[j - i];
      }
      psi[j] = value;
    }
    return psi;
  }

  private static double[] seasonalDifference() {
    double[] poly = new double[SEASON + 1];
    poly[0] = 1;
    poly[SEASON] = -1;
    return poly;
  }

  private static double[] seasonalMa(double seasonalTheta) {
    double[] poly = new double[SEASON + 1];
    poly[0] = 1;
    poly[SEASON] = seasonalTheta;
    return poly;
  }

  static double[] multiply(double[] a, double[] b) {
    double[] out = new double[a.length + b.length - 1];
    for (int i = 0; i < a.length; i++) {
      for (int j = 0; j < b.length; j++) {
        out[i + j] += a[i] * b[j];
      }
    }
    return out;
  }
}
