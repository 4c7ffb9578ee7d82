package com.ospicorp.rentindex.error;

public class ForecastArtifactMissingException extends RegionDataException {

  public ForecastArtifactMissingException(String region, String path) {
    super(region, "No forecast artifact for region " + region + " at " + path);
  }

  @Override
  public String kind() {
    return "forecast-missing";
  }
}
