package com.ospicorp.rentindex.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.rentindex.series.model.DataPoint;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class FillerTest {

  private static final List<DataPoint> GAPPY = List.of(
      new DataPoint(LocalDate.of(2020, 1, 1), null),
      new DataPoint(LocalDate.of(2020, 2, 1), 10d),
      new DataPoint(LocalDate.of(2020, 3, 1), null),
      new DataPoint(LocalDate.of(2020, 4, 1), null),
      new DataPoint(LocalDate.of(2020, 5, 1), 16d),
      new DataPoint(LocalDate.of(2020, 6, 1), null));

  @Test
  void noneReturnsOriginalList() {
    assertSame(GAPPY, Filler.fill(GAPPY, FillPolicy.NONE));
  }

  @Test
  void forwardFillCarriesLastValue() {
    var out = Filler.fill(GAPPY, FillPolicy.FFILL);

    assertNull(out.get(0).value());
    assertEquals(10d, out.get(2).value());
    assertEquals(10d, out.get(3).value());
    assertEquals(16d, out.get(5).value());
  }

  @Test
  void backFillLooksAhead() {
    var out = Filler.fill(GAPPY, FillPolicy.BFILL);

    assertEquals(10d, out.get(0).value());
    assertEquals(16d, out.get(3).value());
    assertNull(out.get(5).value());
  }

  @Test
  void linearInterpolatesInteriorGapsOnly() {
    var out = Filler.fill(GAPPY, FillPolicy.LINEAR);

    assertNull(out.get(0).value());
    assertEquals(12d, out.get(2).value(), 1e-12);
    assertEquals(14d, out.get(3).value(), 1e-12);
    assertNull(out.get(5).value());
    assertEquals(GAPPY.get(4).date(), out.get(4).date());
  }
}
