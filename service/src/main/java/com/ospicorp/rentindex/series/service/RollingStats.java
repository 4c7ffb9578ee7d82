package com.ospicorp.rentindex.series.service;

/**
 * Trailing-window statistics over position-indexed values. A window covers the current position
 * and the {@code window - 1} before it; missing (null) values are skipped, and a result is only
 * produced when at least {@code minPeriods} values are present.
 */
public final class RollingStats {
  private RollingStats() {
  }

  public static int defaultMinPeriods(int window) {
    return Math.max(3, window / 2);
  }

  public static Double[] mean(Double[] values, int window, int minPeriods) {
    validate(window, minPeriods);
    Double[] out = new Double[values.length];
    for (int i = 0; i < values.length; i++) {
      double sum = 0;
      int count = 0;
      for (int j = Math.max(0, i - window + 1); j <= i; j++) {
        if (values[j] != null) {
          sum += values[j];
          count++;
        }
      }
      out[i] = count >= minPeriods ? sum / count : null;
    }
    return out;
  }

  public static Double[] std(Double[] values, int window, int minPeriods) {
    validate(window, minPeriods);
    Double[] out = new Double[values.length];
    for (int i = 0; i < values.length; i++) {
      int from = Math.max(0, i - window + 1);
      double sum = 0;
      int count = 0;
      for (int j = from; j <= i; j++) {
        if (values[j] != null) {
          sum += values[j];
          count++;
        }
      }
      if (count < Math.max(2, minPeriods)) {
        continue;
      }
      double mean = sum / count;
      double squares = 0;
      for (int j = from; j <= i; j++) {
        if (values[j] != null) {
          double dev = values[j] - mean;
          squares += dev * dev;
        }
      }
      out[i] = Math.sqrt(squares / (count - 1));
    }
    return out;
  }

  private static void validate(int window, int minPeriods) {
    if (window < 1) {
      throw new IllegalArgumentException("window must be positive");
    }
    if (minPeriods < 1 || minPeriods > window) {
      throw new IllegalArgumentException("minPeriods must be between 1 and window");
    }
  }
}
