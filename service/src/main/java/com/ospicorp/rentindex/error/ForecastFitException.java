package com.ospicorp.rentindex.error;

public class ForecastFitException extends RegionDataException {

  public ForecastFitException(String region, String message) {
    super(region, "Forecast fit failed for region " + region + ": " + message);
  }

  @Override
  public String kind() {
    return "fit-failed";
  }
}
