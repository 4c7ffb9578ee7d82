package com.ospicorp.rentindex.series.service;

import com.ospicorp.rentindex.series.model.DataPoint;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class MonthlyCalendar {
  private MonthlyCalendar() {
  }

  public static LocalDate monthStart(LocalDate date) {
    return date.withDayOfMonth(1);
  }

  public static List<DataPoint> reindex(List<DataPoint> in) {
    if (in.isEmpty()) return in;
    Map<LocalDate, Double> buckets = new LinkedHashMap<>();
    LocalDate previous = null;
    for (DataPoint p : in) {
      LocalDate bucket = monthStart(p.date());
      if (previous != null && !bucket.isAfter(previous)) {
        throw new IllegalArgumentException(
            "Months must be strictly increasing: " + bucket + " follows " + previous);
      }
      buckets.put(bucket, p.value());
      previous = bucket;
    }
    LocalDate first = monthStart(in.get(0).date());
    int months = (int) ChronoUnit.MONTHS.between(first, previous) + 1;
    List<DataPoint> out = new ArrayList<>(months);
    for (int i = 0; i < months; i++) {
      LocalDate month = first.plusMonths(i);
      out.add(new DataPoint(month, buckets.get(month)));
    }
    return out;
  }

  public static List<LocalDate> following(LocalDate last, int count) {
    List<LocalDate> months = new ArrayList<>(count);
    LocalDate start = monthStart(last);
    for (int i = 1; i <= count; i++) {
      months.add(start.plusMonths(i));
    }
    return months;
  }
}
