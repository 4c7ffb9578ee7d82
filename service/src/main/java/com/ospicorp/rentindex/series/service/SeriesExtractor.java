package com.ospicorp.rentindex.series.service;

import com.ospicorp.rentindex.dataset.CsvDatasetReader;
import com.ospicorp.rentindex.dataset.CsvValues;
import com.ospicorp.rentindex.dataset.DatasetTable;
import com.ospicorp.rentindex.dataset.GeoLevels;
import com.ospicorp.rentindex.error.DuplicateMonthException;
import com.ospicorp.rentindex.error.EmptySeriesException;
import com.ospicorp.rentindex.error.MalformedDateException;
import com.ospicorp.rentindex.series.model.DataPoint;
import com.ospicorp.rentindex.series.model.RegionSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SeriesExtractor {
  private static final Logger log = LoggerFactory.getLogger(SeriesExtractor.class);

  private final CsvDatasetReader reader;

  public SeriesExtractor(CsvDatasetReader reader) {
    this.reader = reader;
  }

  public RegionSeries extract(String location, String geoLevel, String region,
      String valueColumn) {
    requireText(region, "region");
    requireText(valueColumn, "value column");
    String geoColumn = GeoLevels.column(geoLevel);
    String wanted = region.trim();
    DatasetTable.Builder rows = DatasetTable.builder(geoColumn, valueColumn);
    TreeSet<String> seen = new TreeSet<>();
    reader.scan(location, List.of(geoColumn, CsvDatasetReader.DATE_COLUMN, valueColumn), row -> {
      if (CsvValues.isMissing(row[0])) {
        return;
      }
      String id = row[0].trim();
      seen.add(id);
      if (id.equals(wanted)) {
        rows.add(id, row[1], row[2]);
      }
    });
    return extract(rows.build(), wanted, List.copyOf(seen));
  }

  public RegionSeries extract(DatasetTable table, String region) {
    requireText(region, "region");
    return extract(table, region.trim(), table.regions());
  }

  private RegionSeries extract(DatasetTable table, String region, List<String> available) {
    List<DatasetTable.Row> rows = table.rowsFor(region);
    if (rows.isEmpty()) {
      throw new EmptySeriesException(region, table.geoColumn(), available);
    }

    List<DataPoint> parsed = new ArrayList<>(rows.size());
    int unparseable = 0;
    for (DatasetTable.Row row : rows) {
      LocalDate month = CsvValues.parseMonth(row.date());
      if (month == null) {
        throw new MalformedDateException(region, row.date());
      }
      Double value = CsvValues.parseDouble(row.value());
      if (value == null && !CsvValues.isMissing(row.value())) {
        unparseable++;
      }
      parsed.add(new DataPoint(month, value));
    }
    if (unparseable > 0) {
      log.debug("Region {}: {} non-numeric {} values treated as missing", region, unparseable,
          table.valueColumn());
    }

    // stable sort keeps source order between equal months, so the first conflict is reported
    parsed.sort(Comparator.comparing(DataPoint::date));
    for (int i = 1; i < parsed.size(); i++) {
      if (parsed.get(i).date().equals(parsed.get(i - 1).date())) {
        throw new DuplicateMonthException(region, parsed.get(i).date());
      }
    }

    List<DataPoint> monthly = MonthlyCalendar.reindex(parsed);
    log.debug("Region {}: {} rows -> {} months ({} to {})", region, rows.size(), monthly.size(),
        monthly.get(0).date(), monthly.get(monthly.size() - 1).date());
    return new RegionSeries(region, table.valueColumn(), monthly);
  }

  private static void requireText(String value, String name) {
    if (!StringUtils.hasText(value)) {
      throw new IllegalArgumentException(name + " must be provided");
    }
  }
}
