package com.ospicorp.rentindex.forecast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class NelderMeadTest {

  @Test
  void findsMinimumOfShiftedQuadratic() {
    NelderMead optimizer = new NelderMead(1e-12, 1e-16, 1e-10, 5_000);

    NelderMead.Result result = optimizer.minimize(
        p -> Math.pow(p[0] - 0.4, 2) + 3 * Math.pow(p[1] + 0.7, 2) + 2, new double[2], 0.1);

    assertThat(result.converged()).isTrue();
    assertThat(result.point()[0]).isCloseTo(0.4, within(1e-4));
    assertThat(result.point()[1]).isCloseTo(-0.7, within(1e-4));
    assertThat(result.value()).isCloseTo(2.0, within(1e-8));
  }

  @Test
  void nonFiniteRegionsAreAvoided() {
    NelderMead optimizer = new NelderMead(1e-12, 1e-16, 1e-10, 5_000);

    NelderMead.Result result = optimizer.minimize(
        p -> p[0] > 1 ? Double.NaN : Math.pow(p[0] - 0.5, 2), new double[] {0.9}, 0.3);

    assertThat(result.converged()).isTrue();
    assertThat(result.point()[0]).isCloseTo(0.5, within(1e-4));
  }

  @Test
  void reportsNonConvergenceWhenIterationsRunOut() {
    NelderMead optimizer = new NelderMead(0, 0, 0, 3);

    NelderMead.Result result = optimizer.minimize(
        p -> p[0] * p[0] + p[1] * p[1], new double[] {5, 5}, 1);

    assertThat(result.converged()).isFalse();
    assertThat(result.iterations()).isEqualTo(3);
  }
}
