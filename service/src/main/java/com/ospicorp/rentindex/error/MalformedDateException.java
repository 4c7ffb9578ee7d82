package com.ospicorp.rentindex.error;

public class MalformedDateException extends RegionDataException {

  public MalformedDateException(String region, String rawDate) {
    super(region, "Region " + region + " has an unparseable date '" + rawDate + "'");
  }

  @Override
  public String kind() {
    return "malformed-date";
  }
}
