package com.ospicorp.rentindex.error;

import java.util.List;

public class EmptySeriesException extends RegionDataException {
  private final List<String> availableRegions;

  public EmptySeriesException(String region, String geoColumn, List<String> availableRegions) {
    super(region, "No rows for " + geoColumn + "=" + region + "; available: "
        + preview(availableRegions));
    this.availableRegions = List.copyOf(availableRegions);
  }

  public List<String> availableRegions() {
    return availableRegions;
  }

  @Override
  public String kind() {
    return "empty-series";
  }

  private static String preview(List<String> regions) {
    if (regions.size() <= 20) {
      return regions.toString();
    }
    return regions.subList(0, 20) + " ... (" + regions.size() + " total)";
  }
}
