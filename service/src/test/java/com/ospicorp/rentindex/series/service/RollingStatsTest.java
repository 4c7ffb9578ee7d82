package com.ospicorp.rentindex.series.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class RollingStatsTest {

  @Test
  void minPeriodsDefaultsToHalfTheWindowButAtLeastThree() {
    assertThat(RollingStats.defaultMinPeriods(12)).isEqualTo(6);
    assertThat(RollingStats.defaultMinPeriods(4)).isEqualTo(3);
  }

  @Test
  void meanSkipsMissingValuesAndHonorsMinPeriods() {
    Double[] values = {1d, 2d, null, 4d, 5d};

    Double[] mean = RollingStats.mean(values, 3, 2);

    assertThat(mean[0]).isNull();
    assertThat(mean[1]).isEqualTo(1.5);
    assertThat(mean[2]).isEqualTo(1.5);
    assertThat(mean[3]).isEqualTo(3.0);
    assertThat(mean[4]).isEqualTo(4.5);
  }

  @Test
  void stdIsTheSampleDeviation() {
    Double[] values = {2d, 4d, 4d, 4d, 5d, 5d, 7d, 9d};

    Double[] std = RollingStats.std(values, 8, 8);

    assertThat(std[6]).isNull();
    assertThat(std[7]).isCloseTo(2.138089935, within(1e-9));
  }

  @Test
  void stdNeedsTwoValues() {
    Double[] std = RollingStats.std(new Double[] {3d, null, 4d}, 2, 1);

    assertThat(std[0]).isNull();
    assertThat(std[1]).isNull();
    assertThat(std[2]).isNull();
  }

  @Test
  void invalidWindowIsRejected() {
    assertThatThrownBy(() -> RollingStats.mean(new Double[0], 3, 4))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
