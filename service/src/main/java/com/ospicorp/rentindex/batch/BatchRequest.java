package com.ospicorp.rentindex.batch;

import com.ospicorp.rentindex.volatility.VolatilityMode;
import java.util.List;
import java.util.Locale;
import org.springframework.util.StringUtils;

// No regions, or the single entry ALL, means every region in the catalog.
public record BatchRequest(
    String datasetLocation,
    String geoLevel,
    List<String> regions,
    String valueColumn,
    int horizon,
    VolatilityMode volatilityMode,
    int window,
    String forecastRoot,
    String volatilityRoot,
    boolean runForecast,
    int workers
) {

  public BatchRequest {
    regions = regions == null ? List.of() : List.copyOf(regions);
  }

  public boolean allRegions() {
    return regions.isEmpty()
        || (regions.size() == 1 && "ALL".equals(regions.get(0).trim().toUpperCase(Locale.ROOT)));
  }

  public void validate() {
    if (!StringUtils.hasText(datasetLocation)) {
      throw new IllegalArgumentException("dataset location must be provided");
    }
    if (!StringUtils.hasText(valueColumn)) {
      throw new IllegalArgumentException("value column must be provided");
    }
    if (horizon < 1) {
      throw new IllegalArgumentException("Forecast horizon must be greater than 0");
    }
    if (window < 3) {
      throw new IllegalArgumentException("Rolling window must be at least 3");
    }
    if (volatilityMode == null) {
      throw new IllegalArgumentException("volatility mode must be provided");
    }
    if (!StringUtils.hasText(forecastRoot) || !StringUtils.hasText(volatilityRoot)) {
      throw new IllegalArgumentException("forecast and volatility output roots must be provided");
    }
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be positive");
    }
  }
}
