package com.ospicorp.rentindex.error;

import java.time.LocalDate;

public class DuplicateMonthException extends RegionDataException {
  private final LocalDate month;

  public DuplicateMonthException(String region, LocalDate month) {
    super(region, "Region " + region + " has more than one row for month " + month);
    this.month = month;
  }

  public LocalDate month() {
    return month;
  }

  @Override
  public String kind() {
    return "duplicate-month";
  }
}
