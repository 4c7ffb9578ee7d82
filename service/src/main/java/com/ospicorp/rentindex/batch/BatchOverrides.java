package com.ospicorp.rentindex.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.util.List;

// Request body of a batch trigger; null fields keep the configured defaults
public record BatchOverrides(
    @JsonProperty("dataset") String datasetLocation,
    @JsonProperty("geo") String geoLevel,
    List<String> regions,
    @JsonProperty("value_col") String valueColumn,
    @Positive Integer horizon,
    String mode,
    @Min(3) Integer window,
    @JsonProperty("forecast_root") String forecastRoot,
    @JsonProperty("volatility_root") String volatilityRoot,
    @JsonProperty("run_forecast") Boolean runForecast,
    @Positive Integer workers
) {}
