package com.ospicorp.rentindex.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.rentindex.volatility.VolatilityMode;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchDefaultsTest {

  private final BatchDefaults defaults = new BatchDefaults("data/zori.csv", "state", List.of(),
      "zori_smoothed_seasonal", 9, "forecast", 12, "out/f", "out/v", true, 4);

  @Test
  void missingBodyKeepsConfiguredValues() {
    BatchRequest request = defaults.merge(null);

    assertThat(request).isEqualTo(defaults.defaults());
    assertThat(request.allRegions()).isTrue();
  }

  @Test
  void providedFieldsOverrideDefaults() {
    BatchOverrides overrides = new BatchOverrides(null, "zip", List.of("00501"), null, 3,
        "Residual", null, null, null, false, null);

    BatchRequest request = defaults.merge(overrides);

    assertThat(request.geoLevel()).isEqualTo("zip");
    assertThat(request.regions()).containsExactly("00501");
    assertThat(request.horizon()).isEqualTo(3);
    assertThat(request.volatilityMode()).isEqualTo(VolatilityMode.RESIDUAL);
    assertThat(request.runForecast()).isFalse();
    assertThat(request.datasetLocation()).isEqualTo("data/zori.csv");
    assertThat(request.window()).isEqualTo(12);
    assertThat(request.allRegions()).isFalse();
  }

  @Test
  void unknownModeIsRejected() {
    BatchOverrides overrides = new BatchOverrides(null, null, null, null, null, "garch", null,
        null, null, null, null);

    assertThatThrownBy(() -> defaults.merge(overrides))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void allKeywordSelectsEveryRegion() {
    BatchRequest request = defaults.merge(new BatchOverrides(null, null, List.of(" all "), null,
        null, null, null, null, null, null, null));

    assertThat(request.allRegions()).isTrue();
  }
}
