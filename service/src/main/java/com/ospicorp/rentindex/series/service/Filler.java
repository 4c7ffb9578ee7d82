package com.ospicorp.rentindex.series.service;

import com.ospicorp.rentindex.series.model.DataPoint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Filler {
  private Filler() {
  }

  public static List<DataPoint> fill(List<DataPoint> in, FillPolicy policy) {
    if (policy == FillPolicy.NONE) return in;
    List<DataPoint> out = new ArrayList<>(in.size());
    if (policy == FillPolicy.FFILL) {
      Double last = null;
      for (var p : in) {
        last = (p.value() != null) ? p.value() : last;
        out.add(new DataPoint(p.date(), last));
      }
      return out;
    }
    if (policy == FillPolicy.LINEAR) {
      return interpolate(in);
    }
    Double next = null;
    for (int i = in.size() - 1; i >= 0; --i) {
      var p = in.get(i);
      next = (p.value() != null) ? p.value() : next;
      out.add(new DataPoint(p.date(), next));
    }
    Collections.reverse(out);
    return out;
  }

  // Straight line between the nearest observed neighbours; edges stay missing.
  private static List<DataPoint> interpolate(List<DataPoint> in) {
    List<DataPoint> out = new ArrayList<>(in);
    int prev = -1;
    for (int i = 0; i < in.size(); i++) {
      Double value = in.get(i).value();
      if (value == null) {
        continue;
      }
      if (prev >= 0 && i - prev > 1) {
        double start = in.get(prev).value();
        double step = (value - start) / (i - prev);
        for (int j = prev + 1; j < i; j++) {
          out.set(j, new DataPoint(in.get(j).date(), start + step * (j - prev)));
        }
      }
      prev = i;
    }
    return out;
  }
}
