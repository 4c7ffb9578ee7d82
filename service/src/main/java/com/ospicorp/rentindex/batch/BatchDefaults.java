package com.ospicorp.rentindex.batch;

import com.ospicorp.rentindex.volatility.VolatilityMode;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class BatchDefaults {
  private final BatchRequest defaults;

  public BatchDefaults(
      @Value("${rentindex.dataset.location:data/processed/zori_long.csv}") String location,
      @Value("${rentindex.dataset.geo-level:state}") String geoLevel,
      @Value("${rentindex.batch.regions:}") List<String> regions,
      @Value("${rentindex.dataset.value-column:zori_smoothed_seasonal}") String valueColumn,
      @Value("${rentindex.forecast.horizon:9}") int horizon,
      @Value("${rentindex.volatility.mode:forecast}") String mode,
      @Value("${rentindex.volatility.window:12}") int window,
      @Value("${rentindex.output.forecast-root:data/processed/forecasts}") String forecastRoot,
      @Value("${rentindex.output.volatility-root:data/processed/volatility}") String volatilityRoot,
      @Value("${rentindex.batch.run-forecast:true}") boolean runForecast,
      @Value("${rentindex.batch.workers:4}") int workers) {
    this.defaults = new BatchRequest(location, geoLevel, regions, valueColumn, horizon,
        VolatilityMode.fromString(mode), window, forecastRoot, volatilityRoot, runForecast,
        workers);
  }

  public BatchRequest defaults() {
    return defaults;
  }

  public BatchRequest merge(BatchOverrides o) {
    if (o == null) {
      return defaults;
    }
    return new BatchRequest(
        o.datasetLocation() != null ? o.datasetLocation() : defaults.datasetLocation(),
        o.geoLevel() != null ? o.geoLevel() : defaults.geoLevel(),
        o.regions() != null ? o.regions() : defaults.regions(),
        o.valueColumn() != null ? o.valueColumn() : defaults.valueColumn(),
        o.horizon() != null ? o.horizon() : defaults.horizon(),
        o.mode() != null ? VolatilityMode.fromString(o.mode()) : defaults.volatilityMode(),
        o.window() != null ? o.window() : defaults.window(),
        o.forecastRoot() != null ? o.forecastRoot() : defaults.forecastRoot(),
        o.volatilityRoot() != null ? o.volatilityRoot() : defaults.volatilityRoot(),
        o.runForecast() != null ? o.runForecast() : defaults.runForecast(),
        o.workers() != null ? o.workers() : defaults.workers());
  }
}
