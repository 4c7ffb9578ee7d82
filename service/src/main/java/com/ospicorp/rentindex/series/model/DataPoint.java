package com.ospicorp.rentindex.series.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDate;

// One month of a series; a null value marks a missing month
public record DataPoint(LocalDate date, Double value) {

  @JsonIgnore
  public boolean isMissing() {
    return value == null;
  }
}
