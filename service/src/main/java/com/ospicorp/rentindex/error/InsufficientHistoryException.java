package com.ospicorp.rentindex.error;

public class InsufficientHistoryException extends RegionDataException {
  private final int observed;
  private final int required;

  public InsufficientHistoryException(String region, int observed, int required) {
    super(region, "Region " + region + " has " + observed
        + " non-missing observations; at least " + required + " are needed");
    this.observed = observed;
    this.required = required;
  }

  public int observed() {
    return observed;
  }

  public int required() {
    return required;
  }

  @Override
  public String kind() {
    return "insufficient-history";
  }
}
