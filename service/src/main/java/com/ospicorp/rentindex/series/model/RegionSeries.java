package com.ospicorp.rentindex.series.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

public record RegionSeries(String region, @JsonProperty("value_col") String valueColumn, List<DataPoint> points) {

  public RegionSeries {
    points = List.copyOf(points);
  }

  public int size() {
    return points.size();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return points.isEmpty();
  }

  public int nonMissingCount() {
    int count = 0;
    for (DataPoint p : points) {
      if (!p.isMissing()) {
        count++;
      }
    }
    return count;
  }

  public LocalDate firstMonth() {
    return points.isEmpty() ? null : points.get(0).date();
  }

  public LocalDate lastMonth() {
    return points.isEmpty() ? null : points.get(points.size() - 1).date();
  }

  public Double[] values() {
    Double[] values = new Double[points.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = points.get(i).value();
    }
    return values;
  }
}
