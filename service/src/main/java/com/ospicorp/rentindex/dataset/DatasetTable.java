package com.ospicorp.rentindex.dataset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DatasetTable {

  public record Row(String date, String value) {}

  private final String geoColumn;
  private final String valueColumn;
  private final Map<String, List<Row>> rowsByRegion;
  private final List<String> regions;
  private final int rowCount;

  private DatasetTable(String geoColumn, String valueColumn, Map<String, List<Row>> rowsByRegion) {
    this.geoColumn = geoColumn;
    this.valueColumn = valueColumn;
    Map<String, List<Row>> frozen = new LinkedHashMap<>();
    int count = 0;
    for (var e : rowsByRegion.entrySet()) {
      frozen.put(e.getKey(), List.copyOf(e.getValue()));
      count += e.getValue().size();
    }
    this.rowsByRegion = frozen;
    this.regions = frozen.keySet().stream().sorted().toList();
    this.rowCount = count;
  }

  public static Builder builder(String geoColumn, String valueColumn) {
    return new Builder(geoColumn, valueColumn);
  }

  public String geoColumn() {
    return geoColumn;
  }

  public String valueColumn() {
    return valueColumn;
  }

  public List<Row> rowsFor(String region) {
    return rowsByRegion.getOrDefault(region, List.of());
  }

  public List<String> regions() {
    return regions;
  }

  public int rowCount() {
    return rowCount;
  }

  public static final class Builder {
    private final String geoColumn;
    private final String valueColumn;
    private final Map<String, List<Row>> rows = new LinkedHashMap<>();

    private Builder(String geoColumn, String valueColumn) {
      this.geoColumn = geoColumn;
      this.valueColumn = valueColumn;
    }

    public Builder add(String region, String date, String value) {
      if (CsvValues.isMissing(region)) {
        return this;
      }
      rows.computeIfAbsent(region.trim(), k -> new ArrayList<>()).add(new Row(date, value));
      return this;
    }

    public DatasetTable build() {
      return new DatasetTable(geoColumn, valueColumn, rows);
    }
  }
}
