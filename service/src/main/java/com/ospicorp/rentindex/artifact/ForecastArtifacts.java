package com.ospicorp.rentindex.artifact;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.rentindex.dataset.DatasetStore;
import com.ospicorp.rentindex.error.ForecastArtifactMissingException;
import com.ospicorp.rentindex.forecast.ForecastPoint;
import com.ospicorp.rentindex.forecast.ForecastResult;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ForecastArtifacts {
  private static final CsvSchema SCHEMA = CsvSchema.builder()
      .addColumn("date")
      .addNumberColumn("mean")
      .addNumberColumn("ci95_lo")
      .addNumberColumn("ci95_hi")
      .setUseHeader(true)
      .build();

  private final DatasetStore store;
  private final CsvMapper mapper = ArtifactPaths.csvMapper();

  public ForecastArtifacts(DatasetStore store) {
    this.store = store;
  }

  public String write(String root, String geoColumn, ForecastResult forecast) {
    String path = ArtifactPaths.forecast(store, root, geoColumn, forecast.region());
    List<ForecastPoint> rows = forecast.points().stream()
        .sorted(Comparator.comparing(ForecastPoint::date))
        .toList();
    try (Writer writer = store.openWriter(path);
        SequenceWriter out = mapper.writerFor(ForecastPoint.class).with(SCHEMA)
            .writeValues(writer)) {
      out.writeAll(rows);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to write forecast artifact " + path, ex);
    }
    return path;
  }

  public ForecastResult read(String root, String geoColumn, String region) {
    String path = ArtifactPaths.forecast(store, root, geoColumn, region);
    if (!store.exists(path)) {
      throw new ForecastArtifactMissingException(region, path);
    }
    try (Reader reader = store.openReader(path);
        MappingIterator<ForecastPoint> it = mapper.readerFor(ForecastPoint.class)
            .with(SCHEMA)
            .readValues(reader)) {
      List<ForecastPoint> points = it.readAll();
      return new ForecastResult(region, points.size(), points, null);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read forecast artifact " + path, ex);
    }
  }
}
