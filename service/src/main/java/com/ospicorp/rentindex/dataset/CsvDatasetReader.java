package com.ospicorp.rentindex.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.rentindex.error.DataAccessException;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Streams long-format CSV datasets. A location is a single file or a directory of files; in a
 * directory, path segments of the form {@code column=value} fill that column for files that do
 * not carry it. Only the requested columns are kept per row.
 */
@Component
public class CsvDatasetReader {
  private static final Logger log = LoggerFactory.getLogger(CsvDatasetReader.class);
  public static final String DATE_COLUMN = "date";

  private final DatasetStore store;
  private final CsvMapper mapper;

  public CsvDatasetReader(DatasetStore store) {
    this.store = store;
    this.mapper = new CsvMapper();
    this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
  }

  public DatasetStore store() {
    return store;
  }

  public void scan(String location, List<String> columns, Consumer<String[]> sink) {
    for (String file : dataFiles(location)) {
      scanFile(location, file, columns, sink);
    }
  }

  public DatasetTable load(String location, String geoColumn, String valueColumn) {
    DatasetTable.Builder builder = DatasetTable.builder(geoColumn, valueColumn);
    scan(location, List.of(geoColumn, DATE_COLUMN, valueColumn),
        row -> builder.add(row[0], row[1], row[2]));
    DatasetTable table = builder.build();
    log.info("Loaded {} rows for {} regions from {} (geo column {}, value column {})",
        table.rowCount(), table.regions().size(), location, geoColumn, valueColumn);
    return table;
  }

  public void requireColumns(String location, List<String> columns) {
    for (String file : dataFiles(location)) {
      try (Reader reader = store.openReader(file);
          MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
        if (!it.hasNextValue()) {
          continue;
        }
        projection(location, file, it.nextValue(), columns);
      } catch (IOException ex) {
        throw new DataAccessException("Unable to read dataset file " + file, ex);
      }
    }
  }

  List<String> dataFiles(String location) {
    List<String> files;
    try {
      files = store.listFiles(location);
    } catch (IOException ex) {
      throw new DataAccessException("Dataset location is not readable: " + location, ex);
    }
    List<String> csv = files.stream()
        .filter(f -> f.toLowerCase(Locale.ROOT).endsWith(".csv"))
        .toList();
    if (csv.isEmpty()) {
      throw new DataAccessException("No CSV files found at " + location);
    }
    return csv;
  }

  private void scanFile(String location, String file, List<String> columns,
      Consumer<String[]> sink) {
    try (Reader reader = store.openReader(file);
        MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
      if (!it.hasNextValue()) {
        log.warn("Skipping empty dataset file {}", file);
        return;
      }
      Projection projection = projection(location, file, it.nextValue(), columns);
      long rows = 0;
      while (it.hasNextValue()) {
        sink.accept(projection.apply(it.nextValue()));
        rows++;
      }
      log.debug("Read {} rows from {}", rows, file);
    } catch (IOException ex) {
      throw new DataAccessException("Unable to read dataset file " + file, ex);
    }
  }

  private Projection projection(String location, String file, String[] header,
      List<String> columns) {
    List<String> names = new ArrayList<>(header.length);
    for (int i = 0; i < header.length; i++) {
      String name = header[i] == null ? "" : header[i].trim();
      if (i == 0 && name.startsWith("\uFEFF")) {
        name = name.substring(1);
      }
      names.add(name);
    }
    Map<String, String> partitions = partitionValues(store.relativize(location, file));
    int[] indexes = new int[columns.size()];
    String[] constants = new String[columns.size()];
    for (int c = 0; c < columns.size(); c++) {
      String column = columns.get(c);
      indexes[c] = names.indexOf(column);
      if (indexes[c] < 0) {
        if (!partitions.containsKey(column)) {
          throw new DataAccessException("Column '" + column + "' not found in " + file
              + "; available columns: " + names);
        }
        constants[c] = partitions.get(column);
      }
    }
    return new Projection(indexes, constants);
  }

  static Map<String, String> partitionValues(String relativePath) {
    Map<String, String> values = new LinkedHashMap<>();
    String[] segments = relativePath.split("/");
    // the last segment is the file name
    for (String segment : Arrays.copyOf(segments, Math.max(0, segments.length - 1))) {
      int eq = segment.indexOf('=');
      if (eq > 0) {
        values.put(segment.substring(0, eq), segment.substring(eq + 1));
      }
    }
    return values;
  }

  private record Projection(int[] indexes, String[] constants) {
    String[] apply(String[] row) {
      String[] out = new String[indexes.length];
      for (int i = 0; i < indexes.length; i++) {
        int index = indexes[i];
        if (index < 0) {
          out[i] = constants[i];
        } else {
          out[i] = index < row.length ? row[index] : null;
        }
      }
      return out;
    }
  }
}
