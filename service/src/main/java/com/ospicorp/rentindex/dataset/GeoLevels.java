package com.ospicorp.rentindex.dataset;

import java.util.Locale;
import java.util.Map;
import org.springframework.util.StringUtils;

public final class GeoLevels {
  private static final Map<String, String> COLUMNS = Map.of(
      "state", "state",
      "zip", "zip",
      "metro", "RegionName");

  private GeoLevels() {
  }

  public static String column(String geoLevel) {
    if (!StringUtils.hasText(geoLevel)) {
      throw new IllegalArgumentException("geo level must be provided");
    }
    String trimmed = geoLevel.trim();
    return COLUMNS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
  }
}
